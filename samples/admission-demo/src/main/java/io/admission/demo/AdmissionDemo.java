package io.admission.demo;

import io.admission.Admission;
import io.admission.AdmissionListener;
import io.admission.AdmissionRequest;
import io.admission.RequestExecutor;
import io.admission.stats.AdmissionStats;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Simple demo showing admission control in front of a JDBC database, without Spring.
 * <p>
 * Run with: mvn -pl samples/admission-demo exec:java
 */
public final class AdmissionDemo {

    public static void main(String[] args) throws Exception {
        // 1. Setup H2 in-memory database
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:admission;MODE=MySQL;DB_CLOSE_DELAY=-1");
        createSchema(dataSource);

        CountDownLatch firstRound = new CountDownLatch(4);
        CountDownLatch latch = new CountDownLatch(8);

        // 2. Build admission control around a JDBC executor
        try (Admission admission = Admission.builder()
                .executor(jdbcExecutor(dataSource))
                .maxConcurrentRequests(4)
                .requestTimeout(Duration.ofSeconds(2))
                .defaultCacheTtl(Duration.ofMinutes(1))
                .listener(AdmissionListener.onCompletion((ticketId, result, priority) -> {
                    System.out.printf("[%s] %s -> %s%s%n", priority, ticketId, result.value(),
                            result.fromCache() ? " (cached)" : "");
                    firstRound.countDown();
                    latch.countDown();
                }))
                .listener(AdmissionListener.onFailure((ticketId, error, priority) -> {
                    System.out.printf("[%s] %s FAILED: %s%n", priority, ticketId, error.getMessage());
                    firstRound.countDown();
                    latch.countDown();
                }))
                .build()) {

            // 3. Enqueue the sample queries twice; once the first round has finished,
            //    the second round is served from cache
            populateSampleQueries(admission);
            if (!firstRound.await(10, TimeUnit.SECONDS)) {
                System.out.println("Timed out waiting for the first round");
            }
            System.out.println("-- second round --");
            populateSampleQueries(admission);

            if (!latch.await(10, TimeUnit.SECONDS)) {
                System.out.println("Timed out waiting for sample queries");
            }

            // 4. Print stats
            AdmissionStats stats = admission.getStats();
            System.out.println();
            System.out.println("Total requests:     " + stats.totalRequests());
            System.out.println("Completed:          " + stats.completedRequests());
            System.out.println("Failed:             " + stats.failedRequests());
            System.out.printf("Avg response time:  %.2f ms%n", stats.averageResponseTime());
            System.out.println("Circuit breaker:    " + (stats.circuitBreaker().isOpen() ? "OPEN" : "CLOSED"));
            System.out.printf("Cache:              %d entries, hit ratio %.2f%n",
                    stats.cache().size(), stats.cache().hitRatio());
            stats.queryStats().forEach((operation, opStats) ->
                    System.out.printf("  %-70s count=%d avg=%.2f ms%n",
                            abbreviate(operation), opStats.count(), opStats.averageTime()));
        }
    }

    private static void populateSampleQueries(Admission admission) {
        String today = LocalDate.now().toString();
        admission.enqueue(AdmissionRequest.query("SELECT * FROM siswa WHERE status = ?")
                .params("aktif").build(), "high");
        admission.enqueue(AdmissionRequest.query("SELECT * FROM guru WHERE status = ?")
                .params("aktif").build(), "high");
        admission.enqueue(AdmissionRequest.query("SELECT * FROM kelas WHERE status = ?")
                .params("aktif").build(), "normal");
        admission.enqueue(AdmissionRequest.query(
                "SELECT COUNT(*) AS total FROM absensi_siswa WHERE tanggal = ?")
                .params(today).build(), "critical");
    }

    private static RequestExecutor jdbcExecutor(DataSource dataSource) {
        return request -> {
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement ps = conn.prepareStatement(request.operation())) {
                List<Object> params = request.params();
                for (int i = 0; i < params.size(); i++) {
                    ps.setObject(i + 1, params.get(i));
                }
                if (!ps.execute()) {
                    return ps.getUpdateCount();
                }
                try (ResultSet rs = ps.getResultSet()) {
                    return readRows(rs);
                }
            }
        };
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 1; c <= meta.getColumnCount(); c++) {
                row.put(meta.getColumnLabel(c).toLowerCase(Locale.ROOT), rs.getObject(c));
            }
            rows.add(row);
        }
        return rows;
    }

    private static String abbreviate(String operation) {
        return operation.length() > 70 ? operation.substring(0, 67) + "..." : operation;
    }

    private static void createSchema(DataSource dataSource) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE siswa (id INT PRIMARY KEY, nama VARCHAR(100), status VARCHAR(20))");
            stmt.execute("CREATE TABLE guru (id INT PRIMARY KEY, nama VARCHAR(100), status VARCHAR(20))");
            stmt.execute("CREATE TABLE kelas (id INT PRIMARY KEY, nama VARCHAR(20), status VARCHAR(20))");
            stmt.execute("CREATE TABLE absensi_siswa (id INT PRIMARY KEY, siswa_id INT, tanggal VARCHAR(10), status VARCHAR(20))");
            stmt.execute("INSERT INTO siswa VALUES (1, 'Ayu', 'aktif'), (2, 'Budi', 'aktif'), (3, 'Citra', 'lulus')");
            stmt.execute("INSERT INTO guru VALUES (1, 'Pak Dedi', 'aktif')");
            stmt.execute("INSERT INTO kelas VALUES (1, 'XII IPA 1', 'aktif'), (2, 'XII IPS 1', 'aktif')");
            stmt.execute("INSERT INTO absensi_siswa VALUES (1, 1, '" + LocalDate.now() + "', 'hadir')");
        }
    }
}
