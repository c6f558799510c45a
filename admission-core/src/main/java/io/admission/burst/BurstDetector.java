package io.admission.burst;

import java.time.Duration;

/**
 * Flags admission bursts: after each admission, the number of admissions in the trailing
 * window (the current one included) is compared against a threshold.
 *
 * <p>Detection is purely observational. It never rejects or delays work.
 *
 * <p>Not thread-safe. The owning dispatcher guards every call with its state lock.
 */
public final class BurstDetector {
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

  private final int threshold;
  private final long windowMs;
  private long detections;
  private long lastBurstTime = -1L;

  public BurstDetector(int threshold, Duration window) {
    if (threshold <= 0) {
      throw new IllegalArgumentException("threshold must be > 0");
    }
    if (window == null || window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be > 0");
    }
    this.threshold = threshold;
    this.windowMs = window.toMillis();
  }

  /**
   * Runs one burst check against the history.
   *
   * @param history the request history, already containing the current admission
   * @param now     current time in epoch milliseconds
   * @return the number of admissions in the window if it reached the threshold, otherwise {@code -1}
   */
  public int check(RequestHistory history, long now) {
    int recent = history.countSince(HistoryEntry.Kind.ADMITTED, now, windowMs);
    if (recent >= threshold) {
      detections++;
      lastBurstTime = now;
      return recent;
    }
    return -1;
  }

  public int threshold() {
    return threshold;
  }

  public long windowMs() {
    return windowMs;
  }

  public long detections() {
    return detections;
  }

  /**
   * Epoch milliseconds of the last detection, or {@code -1} if none.
   */
  public long lastBurstTime() {
    return lastBurstTime;
  }
}
