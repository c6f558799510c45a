package io.admission;

import java.util.Objects;

/**
 * A unit of admitted work waiting in a lane or running on a worker.
 *
 * @param id           unique, monotonically ordered ticket id
 * @param request      the admitted request
 * @param priority     lane the ticket was admitted into
 * @param enqueuedAt   admission time in epoch milliseconds
 * @param enqueuedNanos admission time from {@link System#nanoTime()}, for response-time measurement
 * @param dispatchedAt dispatch time in epoch milliseconds, or {@code -1} while queued
 */
public record Ticket(String id, AdmissionRequest request, Priority priority,
    long enqueuedAt, long enqueuedNanos, long dispatchedAt) {

  public Ticket {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(priority, "priority");
  }

  /**
   * Returns a copy of this ticket stamped with a dispatch time.
   *
   * @param dispatchedAt dispatch time in epoch milliseconds
   * @return the dispatched ticket
   */
  public Ticket dispatched(long dispatchedAt) {
    return new Ticket(id, request, priority, enqueuedAt, enqueuedNanos, dispatchedAt);
  }

  public boolean isDispatched() {
    return dispatchedAt >= 0;
  }
}
