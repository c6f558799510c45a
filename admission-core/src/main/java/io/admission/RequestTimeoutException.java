package io.admission;

import java.time.Duration;

/**
 * The {@link RequestExecutor} did not finish within the configured request timeout.
 * Any result it produces afterwards is discarded.
 */
public final class RequestTimeoutException extends AdmissionException {

  private final Duration timeout;

  public RequestTimeoutException(Duration timeout) {
    super("Request timeout after " + timeout.toMillis() + " ms");
    this.timeout = timeout;
  }

  public Duration timeout() {
    return timeout;
  }
}
