package io.admission;

import io.admission.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdmissionTest {

    private static final RequestExecutor ECHO = request -> request.operation();

    @Test
    void unknownPriorityNameFallsBackToNormal() {
        try (Admission admission = Admission.builder().executor(ECHO).autoStart(false).build()) {
            admission.enqueue(AdmissionRequest.of("a").build(), "urgent");
            admission.enqueue(AdmissionRequest.of("b").build(), (String) null);
            admission.enqueue(AdmissionRequest.of("c").build(), "high");
            admission.enqueue(AdmissionRequest.of("d").build());

            var sizes = admission.getStats().queueSizes();
            assertEquals(3, sizes.get(Priority.NORMAL));
            assertEquals(1, sizes.get(Priority.HIGH));
        }
    }

    @Test
    void builderCanOnlyBeUsedOnce() {
        Admission.Builder builder = Admission.builder().executor(ECHO).autoStart(false);
        builder.build().close();

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void setEnabledTogglesDispatch() {
        try (Admission admission = Admission.builder().executor(ECHO).autoStart(false).build()) {
            assertFalse(admission.isEnabled());
            admission.setEnabled(true);
            assertTrue(admission.isEnabled());
            admission.setEnabled(false);
            assertFalse(admission.isEnabled());
        }
    }

    @Test
    void closeAlsoClosesCloseableMetricsExporter() {
        AtomicBoolean closed = new AtomicBoolean();
        Admission admission = Admission.builder()
                .executor(ECHO)
                .metrics(new ClosingExporter(closed))
                .build();

        admission.close();

        assertTrue(closed.get());
        assertThrows(IllegalStateException.class, () ->
                admission.enqueue(AdmissionRequest.of("a").build(), Priority.LOW));
    }

    private static final class ClosingExporter implements MetricsExporter, AutoCloseable {
        private final AtomicBoolean closed;

        ClosingExporter(AtomicBoolean closed) {
            this.closed = closed;
        }

        @Override
        public void incrementAdmitted(Priority priority) {
        }

        @Override
        public void incrementCompleted() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void incrementTimedOut() {
        }

        @Override
        public void incrementBreakerTrips() {
        }

        @Override
        public void recordLaneDepth(Priority priority, int depth) {
        }

        @Override
        public void recordInFlight(int inFlight) {
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }
}
