package io.admission;

import java.util.Locale;

/**
 * Priority class of an admitted request. Declaration order is dispatch order:
 * a non-empty {@link #CRITICAL} lane is always drained before {@link #HIGH}, and so on.
 */
public enum Priority {
  /** Writes that must not wait behind reads (e.g. attendance submission). */
  CRITICAL,
  /** Interactive reads. */
  HIGH,
  /** Analytics and reports. */
  NORMAL,
  /** Everything else. */
  LOW;

  /**
   * Resolves a priority name case-insensitively.
   *
   * @param name the priority name, may be {@code null}
   * @return the matching priority, or {@code null} if the name is not recognized
   */
  public static Priority fromName(String name) {
    if (name == null) {
      return null;
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (Priority priority : values()) {
      if (priority.name().equals(normalized)) {
        return priority;
      }
    }
    return null;
  }
}
