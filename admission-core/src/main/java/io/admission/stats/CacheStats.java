package io.admission.stats;

import java.util.List;

/**
 * Result cache contents and hit counters.
 *
 * @param size   number of entries, stale ones included
 * @param keys   current keys
 * @param hits   fresh lookups
 * @param misses absent or stale lookups
 */
public record CacheStats(int size, List<String> keys, long hits, long misses) {

  public CacheStats {
    keys = List.copyOf(keys);
  }

  public double hitRatio() {
    long total = hits + misses;
    return total > 0 ? (double) hits / total : 0.0;
  }
}
