package io.admission.cache;

import io.admission.AdmissionRequest;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryCacheKeysTest {

    @Test
    void derivesPrefixedBase64OfOperationAndParams() {
        AdmissionRequest request = AdmissionRequest.query("SELECT * FROM siswa WHERE id = ?")
                .params(42, "x")
                .build();

        String key = QueryCacheKeys.getDefault().keyFor(request);

        String expected = "query_" + Base64.getEncoder().encodeToString(
                "SELECT * FROM siswa WHERE id = ?[42,\"x\"]".getBytes(StandardCharsets.UTF_8));
        assertEquals(expected, key);
    }

    @Test
    void differentParamsGiveDifferentKeys() {
        String a = QueryCacheKeys.getDefault().keyFor(AdmissionRequest.query("q").params(1).build());
        String b = QueryCacheKeys.getDefault().keyFor(AdmissionRequest.query("q").params(2).build());

        assertNotEquals(a, b);
        assertTrue(a.startsWith(QueryCacheKeys.PREFIX));
    }

    @Test
    void explicitKeyWins() {
        AdmissionRequest request = AdmissionRequest.query("q").cacheKey("students").build();

        assertEquals("students", QueryCacheKeys.resolve(request, QueryCacheKeys.getDefault()));
    }

    @Test
    void resolveRejectsEmptyDerivedKey() {
        AdmissionRequest request = AdmissionRequest.query("q").build();

        assertThrows(IllegalStateException.class, () -> QueryCacheKeys.resolve(request, r -> ""));
    }
}
