package io.admission.breaker;

import java.time.Duration;

/**
 * Failure-counting circuit breaker with two states.
 *
 * <ul>
 *   <li><b>CLOSED</b>: dispatch proceeds. Each failure increments {@code failureCount};
 *       reaching {@code threshold} trips the breaker. Every {@value #HEALING_SUCCESSES}
 *       successes reset both counters.</li>
 *   <li><b>OPEN</b>: dispatch is halted until strictly more than {@code cooldown} has
 *       elapsed since the last failure. There is no half-open state: the first
 *       {@link #tryClose} after the cooldown closes the breaker and the next outcome is
 *       judged as usual.</li>
 * </ul>
 *
 * <p>Outcomes reported while OPEN (tickets that were already running when the breaker
 * tripped) are ignored.
 *
 * <p>Not thread-safe. The owning dispatcher guards every call with its state lock.
 */
public final class CircuitBreaker {
  public static final int HEALING_SUCCESSES = 5;

  private final int threshold;
  private final long cooldownMs;

  private boolean open;
  private int failureCount;
  private int successCount;
  private long lastFailureTime = -1L;
  private long openedAt = -1L;

  /**
   * @param threshold failures that trip the breaker (must be &gt; 0)
   * @param cooldown  time after the last failure before dispatch resumes (must be &ge; 0)
   */
  public CircuitBreaker(int threshold, Duration cooldown) {
    if (threshold <= 0) {
      throw new IllegalArgumentException("threshold must be > 0");
    }
    if (cooldown == null || cooldown.isNegative()) {
      throw new IllegalArgumentException("cooldown must be >= 0");
    }
    this.threshold = threshold;
    this.cooldownMs = cooldown.toMillis();
  }

  public boolean isOpen() {
    return open;
  }

  public int threshold() {
    return threshold;
  }

  /**
   * Records a successful outcome.
   *
   * @return {@code true} if this success healed the failure count
   */
  public boolean onSuccess() {
    if (open) {
      return false;
    }
    successCount++;
    if (successCount >= HEALING_SUCCESSES) {
      failureCount = 0;
      successCount = 0;
      return true;
    }
    return false;
  }

  /**
   * Records a failed outcome.
   *
   * @param now failure time in epoch milliseconds
   * @return {@code true} if this failure tripped the breaker
   */
  public boolean onFailure(long now) {
    if (open) {
      return false;
    }
    failureCount++;
    lastFailureTime = now;
    if (failureCount >= threshold) {
      open = true;
      openedAt = now;
      return true;
    }
    return false;
  }

  /**
   * Closes the breaker if it is open and the cooldown has elapsed.
   *
   * @param now current time in epoch milliseconds
   * @return {@code true} if the breaker transitioned to CLOSED
   */
  public boolean tryClose(long now) {
    if (!open || now - lastFailureTime <= cooldownMs) {
      return false;
    }
    open = false;
    failureCount = 0;
    successCount = 0;
    return true;
  }

  /**
   * Time left until {@link #tryClose} can succeed.
   *
   * @param now current time in epoch milliseconds
   * @return remaining milliseconds, {@code 0} when closed or already eligible
   */
  public long remainingCooldownMs(long now) {
    if (!open) {
      return 0L;
    }
    return Math.max(0L, cooldownMs - (now - lastFailureTime) + 1);
  }

  public BreakerState state() {
    return new BreakerState(open, failureCount, successCount, lastFailureTime, openedAt);
  }
}
