package io.admission.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key to result map with lazy time-to-live expiry.
 *
 * <p>Freshness is checked only on lookup, against the TTL of the request doing the
 * lookup. Stale entries stay in place until the next miss for the same key overwrites
 * them or {@link #clear()} is called; there is no background sweep. When
 * {@code maxEntries} is positive the cache additionally evicts the least recently used
 * entry on overflow.
 *
 * <p>Not thread-safe. The owning dispatcher guards every call with its state lock.
 */
public final class ResultCache {
  private final int maxEntries;
  private final Map<String, CacheEntry> entries;
  private long hits;
  private long misses;

  /**
   * Creates an unbounded cache.
   */
  public ResultCache() {
    this(0);
  }

  /**
   * @param maxEntries maximum number of entries, or {@code 0} for unbounded
   */
  public ResultCache(int maxEntries) {
    if (maxEntries < 0) {
      throw new IllegalArgumentException("maxEntries must be >= 0");
    }
    this.maxEntries = maxEntries;
    this.entries = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
        return ResultCache.this.maxEntries > 0 && size() > ResultCache.this.maxEntries;
      }
    };
  }

  /**
   * Looks up a fresh entry. A stale entry counts as a miss but is left in place.
   *
   * @param key the cache key
   * @param ttl freshness window for this lookup
   * @param now current time in epoch milliseconds
   * @return the fresh entry, or empty on miss
   */
  public Optional<CacheEntry> lookup(String key, Duration ttl, long now) {
    CacheEntry entry = entries.get(key);
    if (entry != null && entry.isFresh(now, ttl)) {
      hits++;
      return Optional.of(entry);
    }
    misses++;
    return Optional.empty();
  }

  /**
   * Stores a result, replacing any previous entry for the key.
   *
   * @param key   the cache key
   * @param value the result, may be {@code null}
   * @param now   insertion time in epoch milliseconds
   */
  public void put(String key, Object value, long now) {
    entries.put(key, new CacheEntry(key, value, now));
  }

  public void clear() {
    entries.clear();
  }

  public int size() {
    return entries.size();
  }

  /**
   * Returns the current keys, stale ones included, in access order.
   */
  public List<String> keys() {
    return new ArrayList<>(entries.keySet());
  }

  public long hits() {
    return hits;
  }

  public long misses() {
    return misses;
  }
}
