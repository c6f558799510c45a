package io.admission.burst;

/**
 * One admission or outcome in the request history.
 *
 * @param id           ticket id
 * @param kind         what happened
 * @param timestamp    epoch milliseconds of the ticket's admission
 * @param responseTime milliseconds from admission to outcome, {@code 0} for admissions
 * @param success      {@code false} only for failed outcomes
 * @param error        failure message, or {@code null}
 */
public record HistoryEntry(String id, Kind kind, long timestamp, double responseTime,
    boolean success, String error) {

  public enum Kind {
    ADMITTED,
    COMPLETED,
    FAILED
  }

  public static HistoryEntry admitted(String id, long timestamp) {
    return new HistoryEntry(id, Kind.ADMITTED, timestamp, 0.0, true, null);
  }

  public static HistoryEntry completed(String id, long timestamp, double responseTime) {
    return new HistoryEntry(id, Kind.COMPLETED, timestamp, responseTime, true, null);
  }

  public static HistoryEntry failed(String id, long timestamp, double responseTime, String error) {
    return new HistoryEntry(id, Kind.FAILED, timestamp, responseTime, false, error);
  }
}
