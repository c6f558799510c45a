package io.admission;

/**
 * Callback that performs the actual work behind an admitted request, such as running a
 * database query on a cache miss.
 *
 * <p>Implementations may block. A call that outlives the configured request timeout is
 * interrupted and its result discarded. Implementations should honor interruption: a call
 * that keeps running holds an execution thread, and the dispatcher only keeps a bounded
 * number of those before failing new executions.
 */
@FunctionalInterface
public interface RequestExecutor {

    /**
     * Executes the request.
     *
     * @param request the admitted request
     * @return the result, may be {@code null}
     * @throws Exception any failure; the ticket is reported as failed
     */
    Object execute(AdmissionRequest request) throws Exception;
}
