package io.admission;

/**
 * Subscriber for admission lifecycle notifications.
 *
 * <p>All methods default to no-ops, so implementations override only what they need.
 * Notifications are delivered synchronously on the thread that caused them (the caller's
 * thread for {@link #requestAdded}, a worker thread for outcomes, the dispatcher thread
 * for breaker transitions) and never while internal state is locked. A listener that
 * throws is logged and skipped; the remaining listeners still run.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Admission.builder()
 *     .executor(queryRunner)
 *     .listener(AdmissionListener.onFailure((ticketId, error, priority) ->
 *         log.warn("ticket {} failed: {}", ticketId, error.getMessage())))
 *     .build();
 * }</pre>
 */
public interface AdmissionListener {

    default void requestAdded(Ticket ticket) {
    }

    default void requestCompleted(String ticketId, ExecutionResult result, Priority priority) {
    }

    default void requestFailed(String ticketId, AdmissionException error, Priority priority) {
    }

    /**
     * Admissions in the trailing window reached the burst threshold. Advisory only.
     *
     * @param requestCount admissions counted in the window, including the current one
     * @param threshold    the configured burst threshold
     */
    default void burstDetected(int requestCount, int threshold) {
    }

    default void circuitBreakerTripped(int failureCount, int threshold) {
    }

    default void circuitBreakerReset() {
    }

    default void enabled() {
    }

    default void disabled() {
    }

    /**
     * Creates a listener with only a completion hook.
     */
    static AdmissionListener onCompletion(CompletionHook hook) {
        return new AdmissionListener() {
            @Override
            public void requestCompleted(String ticketId, ExecutionResult result, Priority priority) {
                hook.accept(ticketId, result, priority);
            }
        };
    }

    /**
     * Creates a listener with only a failure hook.
     */
    static AdmissionListener onFailure(FailureHook hook) {
        return new AdmissionListener() {
            @Override
            public void requestFailed(String ticketId, AdmissionException error, Priority priority) {
                hook.accept(ticketId, error, priority);
            }
        };
    }

    @FunctionalInterface
    interface CompletionHook {
        void accept(String ticketId, ExecutionResult result, Priority priority);
    }

    @FunctionalInterface
    interface FailureHook {
        void accept(String ticketId, AdmissionException error, Priority priority);
    }
}
