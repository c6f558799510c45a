package io.admission.burst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded ring of recent {@link HistoryEntry history entries}; the oldest entry is
 * evicted once {@code capacity} is reached.
 *
 * <p>Not thread-safe. The owning dispatcher guards every call with its state lock.
 */
public final class RequestHistory {
  public static final int DEFAULT_CAPACITY = 1000;

  private final int capacity;
  private final Deque<HistoryEntry> entries;

  public RequestHistory() {
    this(DEFAULT_CAPACITY);
  }

  public RequestHistory(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1");
    }
    this.capacity = capacity;
    this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
  }

  public void add(HistoryEntry entry) {
    if (entries.size() == capacity) {
      entries.pollFirst();
    }
    entries.addLast(entry);
  }

  /**
   * Counts entries of the given kind with {@code now - timestamp < windowMs}.
   */
  public int countSince(HistoryEntry.Kind kind, long now, long windowMs) {
    int count = 0;
    var it = entries.descendingIterator();
    while (it.hasNext()) {
      HistoryEntry entry = it.next();
      if (entry.kind() == kind && now - entry.timestamp() < windowMs) {
        count++;
      }
    }
    return count;
  }

  public int size() {
    return entries.size();
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Returns a copy of the entries, oldest first.
   */
  public List<HistoryEntry> snapshot() {
    return new ArrayList<>(entries);
  }
}
