package io.admission.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultCacheTest {

    private static final Duration TTL = Duration.ofMillis(1000);

    @Test
    void freshEntryIsHit() {
        ResultCache cache = new ResultCache();
        cache.put("k", "v", 1_000);

        Optional<CacheEntry> entry = cache.lookup("k", TTL, 1_999);

        assertTrue(entry.isPresent());
        assertEquals("v", entry.get().value());
        assertEquals(1, cache.hits());
        assertEquals(0, cache.misses());
    }

    @Test
    void staleEntryIsMissButStaysInPlace() {
        ResultCache cache = new ResultCache();
        cache.put("k", "v", 1_000);

        assertFalse(cache.lookup("k", TTL, 2_000).isPresent());
        assertEquals(1, cache.size());
        assertEquals(1, cache.misses());
    }

    @Test
    void ttlIsTakenFromLookup() {
        ResultCache cache = new ResultCache();
        cache.put("k", "v", 0);

        assertFalse(cache.lookup("k", Duration.ofMillis(100), 500).isPresent());
        assertTrue(cache.lookup("k", Duration.ofSeconds(1), 500).isPresent());
    }

    @Test
    void nullValuesAreCached() {
        ResultCache cache = new ResultCache();
        cache.put("k", null, 0);

        Optional<CacheEntry> entry = cache.lookup("k", TTL, 1);
        assertTrue(entry.isPresent());
        assertNull(entry.get().value());
    }

    @Test
    void putOverwritesPreviousEntry() {
        ResultCache cache = new ResultCache();
        cache.put("k", "old", 0);
        cache.put("k", "new", 5_000);

        assertEquals("new", cache.lookup("k", TTL, 5_100).orElseThrow().value());
        assertEquals(1, cache.size());
    }

    @Test
    void boundedCacheEvictsLeastRecentlyUsed() {
        ResultCache cache = new ResultCache(2);
        cache.put("a", 1, 0);
        cache.put("b", 2, 0);
        cache.lookup("a", TTL, 1);
        cache.put("c", 3, 2);

        assertEquals(List.of("a", "c"), cache.keys());
    }

    @Test
    void clearRemovesEverything() {
        ResultCache cache = new ResultCache();
        cache.put("a", 1, 0);
        cache.put("b", 2, 0);

        cache.clear();

        assertEquals(0, cache.size());
        assertTrue(cache.keys().isEmpty());
    }

    @Test
    void rejectsNegativeMaxEntries() {
        assertThrows(IllegalArgumentException.class, () -> new ResultCache(-1));
    }
}
