package io.admission.dispatch;

import io.admission.Priority;
import io.admission.Ticket;

import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.Map;

/**
 * One FIFO lane per {@link Priority}. {@link #poll()} always serves the head of the
 * highest-priority non-empty lane; there is no aging, so a steady stream of
 * {@link Priority#CRITICAL} tickets starves the lanes below it.
 *
 * <p>Not thread-safe. {@link AdmissionDispatcher} guards every call with its state lock.
 */
public final class PriorityLanes {
  private final EnumMap<Priority, ArrayDeque<Ticket>> lanes = new EnumMap<>(Priority.class);

  public PriorityLanes() {
    for (Priority priority : Priority.values()) {
      lanes.put(priority, new ArrayDeque<>());
    }
  }

  /**
   * Appends a ticket to the tail of its lane.
   */
  public void add(Ticket ticket) {
    lanes.get(ticket.priority()).addLast(ticket);
  }

  /**
   * Removes and returns the next ticket to dispatch.
   *
   * @return the head of the highest-priority non-empty lane, or {@code null} if all are empty
   */
  public Ticket poll() {
    for (Priority priority : Priority.values()) {
      Ticket ticket = lanes.get(priority).pollFirst();
      if (ticket != null) {
        return ticket;
      }
    }
    return null;
  }

  public int size(Priority priority) {
    return lanes.get(priority).size();
  }

  public int totalSize() {
    int total = 0;
    for (ArrayDeque<Ticket> lane : lanes.values()) {
      total += lane.size();
    }
    return total;
  }

  public boolean isEmpty() {
    return totalSize() == 0;
  }

  public Map<Priority, Integer> sizes() {
    Map<Priority, Integer> sizes = new EnumMap<>(Priority.class);
    lanes.forEach((priority, lane) -> sizes.put(priority, lane.size()));
    return sizes;
  }
}
