package io.admission.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNumberedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("admission-worker-");

        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});

        assertEquals("admission-worker-1", first.getName());
        assertEquals("admission-worker-2", second.getName());
        assertTrue(first.isDaemon());
        assertNotNull(first.getUncaughtExceptionHandler());
    }

    @Test
    void rejectsNullPrefix() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
