package io.admission.burst;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestHistoryTest {

    @Test
    void rejectsCapacityBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> new RequestHistory(0));
    }

    @Test
    void evictsOldestWhenFull() {
        RequestHistory history = new RequestHistory(3);
        for (int i = 0; i < 5; i++) {
            history.add(HistoryEntry.admitted("t" + i, i));
        }

        List<HistoryEntry> entries = history.snapshot();
        assertEquals(3, entries.size());
        assertEquals("t2", entries.get(0).id());
        assertEquals("t4", entries.get(2).id());
    }

    @Test
    void countSinceFiltersByKindAndWindow() {
        RequestHistory history = new RequestHistory();
        history.add(HistoryEntry.admitted("a", 100));
        history.add(HistoryEntry.admitted("b", 900));
        history.add(HistoryEntry.completed("b", 900, 12.5));

        assertEquals(2, history.countSince(HistoryEntry.Kind.ADMITTED, 1000, 1000));
        assertEquals(1, history.countSince(HistoryEntry.Kind.ADMITTED, 1100, 1000));
        assertEquals(1, history.countSince(HistoryEntry.Kind.COMPLETED, 1000, 1000));
    }

    @Test
    void entriesCarryOutcomeDetail() {
        HistoryEntry ok = HistoryEntry.completed("a", 5, 3.5);
        HistoryEntry failed = HistoryEntry.failed("b", 6, 7.0, "boom");

        assertTrue(ok.success());
        assertEquals(3.5, ok.responseTime());
        assertFalse(failed.success());
        assertEquals("boom", failed.error());
        assertEquals(HistoryEntry.Kind.FAILED, failed.kind());
    }
}
