package io.admission.dispatch;

import io.admission.AdmissionException;
import io.admission.AdmissionListener;
import io.admission.ExecutionResult;
import io.admission.Priority;
import io.admission.Ticket;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Listener that records every notification, for assertions in dispatcher tests.
 */
class RecordingListener implements AdmissionListener {
    final List<String> events = new CopyOnWriteArrayList<>();
    final Map<String, ExecutionResult> results = new ConcurrentHashMap<>();
    final Map<String, AdmissionException> errors = new ConcurrentHashMap<>();
    final List<Integer> burstCounts = new CopyOnWriteArrayList<>();

    @Override
    public void requestAdded(Ticket ticket) {
        events.add("added");
    }

    @Override
    public void requestCompleted(String ticketId, ExecutionResult result, Priority priority) {
        results.put(ticketId, result);
        events.add("completed");
    }

    @Override
    public void requestFailed(String ticketId, AdmissionException error, Priority priority) {
        errors.put(ticketId, error);
        events.add("failed");
    }

    @Override
    public void burstDetected(int requestCount, int threshold) {
        burstCounts.add(requestCount);
        events.add("burst");
    }

    @Override
    public void circuitBreakerTripped(int failureCount, int threshold) {
        events.add("tripped");
    }

    @Override
    public void circuitBreakerReset() {
        events.add("reset");
    }

    @Override
    public void enabled() {
        events.add("enabled");
    }

    @Override
    public void disabled() {
        events.add("disabled");
    }

    int outcomes() {
        return results.size() + errors.size();
    }

    long count(String event) {
        return events.stream().filter(event::equals).count();
    }

    /**
     * Polls until {@code outcomes() >= expected} or the timeout elapses.
     */
    boolean awaitOutcomes(int expected, long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (outcomes() < expected) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }
}
