package io.admission.cache;

import java.time.Duration;

/**
 * A cached result and the time it was stored.
 *
 * @param key        the cache key
 * @param value      the cached value, may be {@code null}
 * @param insertedAt insertion time in epoch milliseconds
 */
public record CacheEntry(String key, Object value, long insertedAt) {

  /**
   * An entry is fresh while strictly less than {@code ttl} has elapsed since insertion.
   *
   * @param now current time in epoch milliseconds
   * @param ttl freshness window
   * @return {@code true} if the entry may be served
   */
  public boolean isFresh(long now, Duration ttl) {
    return now - insertedAt < ttl.toMillis();
  }
}
