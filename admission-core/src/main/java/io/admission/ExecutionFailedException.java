package io.admission;

/**
 * The {@link RequestExecutor} threw. The original exception is available as the cause.
 */
public final class ExecutionFailedException extends AdmissionException {

  public ExecutionFailedException(Throwable cause) {
    super(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName(), cause);
  }
}
