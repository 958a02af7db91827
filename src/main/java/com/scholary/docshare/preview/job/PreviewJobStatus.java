package com.scholary.docshare.preview.job;

/**
 * Lifecycle states of a preview job.
 *
 * <p>{@code PENDING -> PROCESSING -> COMPLETED | PENDING | FAILED}. {@code COMPLETED} is always
 * terminal; {@code FAILED} is terminal once the attempt ceiling is reached.
 */
public enum PreviewJobStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String value;

  PreviewJobStatus(String value) {
    this.value = value;
  }

  /** Lower-case name as stored and reported to callers. */
  public String value() {
    return value;
  }
}
