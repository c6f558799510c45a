package io.admission.stats;

/**
 * Running request counters and the incremental mean response time.
 *
 * <p>Not thread-safe. The owning dispatcher guards every call with its state lock.
 */
public final class StatsRecorder {
  private long totalRequests;
  private long activeRequests;
  private int inFlightRequests;
  private long completedRequests;
  private long failedRequests;
  private double averageResponseTime;
  private long circuitBreakerTrips;

  public void onAdmitted() {
    totalRequests++;
    activeRequests++;
  }

  public void onDispatched() {
    inFlightRequests++;
  }

  public void onCompleted(double responseTimeMs) {
    finish();
    completedRequests++;
    averageResponseTime += (responseTimeMs - averageResponseTime) / completedRequests;
  }

  public void onFailed() {
    finish();
    failedRequests++;
  }

  public void onBreakerTripped() {
    circuitBreakerTrips++;
  }

  private void finish() {
    activeRequests--;
    inFlightRequests--;
  }

  public long totalRequests() {
    return totalRequests;
  }

  public long activeRequests() {
    return activeRequests;
  }

  public int inFlightRequests() {
    return inFlightRequests;
  }

  public long completedRequests() {
    return completedRequests;
  }

  public long failedRequests() {
    return failedRequests;
  }

  public double averageResponseTime() {
    return averageResponseTime;
  }

  public long circuitBreakerTrips() {
    return circuitBreakerTrips;
  }
}
