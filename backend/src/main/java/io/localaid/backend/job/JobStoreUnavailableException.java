package io.localaid.backend.job;

/**
 * Thrown by a job store when its backing table cannot be queried, typically because migrations have
 * not created it yet. Pollers treat this as "nothing to do right now".
 */
public class JobStoreUnavailableException extends RuntimeException {

  public JobStoreUnavailableException(String store, Throwable cause) {
    super(store + " is unavailable: " + rootMessage(cause), cause);
  }

  private static String rootMessage(Throwable cause) {
    Throwable current = cause;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
  }
}
