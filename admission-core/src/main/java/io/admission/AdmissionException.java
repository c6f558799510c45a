package io.admission;

/**
 * Base class for per-ticket failures reported through
 * {@link AdmissionListener#requestFailed}.
 *
 * <p>Circuit-open and capacity-full conditions are never reported this way. They only
 * delay dispatch.
 */
public abstract class AdmissionException extends RuntimeException {

  protected AdmissionException(String message) {
    super(message);
  }

  protected AdmissionException(String message, Throwable cause) {
    super(message, cause);
  }
}
