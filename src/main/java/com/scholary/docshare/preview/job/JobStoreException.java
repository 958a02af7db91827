package com.scholary.docshare.preview.job;

/**
 * Exception thrown when the job store cannot read or write a job row.
 *
 * <p>Surfaced directly to callers of the scheduler API. Fatal to that call, not to the scheduler.
 */
public class JobStoreException extends RuntimeException {

  public JobStoreException(String message) {
    super(message);
  }

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
