package io.admission;

/**
 * Result of a dispatched ticket, tagged with whether it was served from the result cache.
 *
 * @param value     the value returned by the {@link RequestExecutor} or the cached value
 * @param fromCache {@code true} if no executor call was made
 */
public record ExecutionResult(Object value, boolean fromCache) {
}
