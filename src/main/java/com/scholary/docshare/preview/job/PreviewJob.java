package com.scholary.docshare.preview.job;

import java.time.Instant;
import java.util.UUID;

/**
 * One preview-generation lineage for a file.
 *
 * <p>Instances are plain mutable records of a job row. Stores hand out copies, so mutating an
 * instance has no effect until it is passed back to {@link PreviewJobStore#update(PreviewJob)}.
 */
public class PreviewJob {

  private UUID id;
  private final UUID fileId;
  private final UUID requestedById;

  private PreviewJobStatus status;
  private int attempts;
  private final int maxAttempts;
  private String lastError;

  private Instant startedAt;
  private Instant completedAt;
  private Instant nextRetryAt;
  private Instant createdAt;
  private Instant updatedAt;

  public PreviewJob(UUID fileId, UUID requestedById, int maxAttempts) {
    this.fileId = fileId;
    this.requestedById = requestedById;
    this.maxAttempts = maxAttempts;
    this.status = PreviewJobStatus.PENDING;
    this.attempts = 0;
  }

  /** A fresh {@code pending} job with no attempts made. */
  public static PreviewJob pending(UUID fileId, UUID requestedById, int maxAttempts) {
    return new PreviewJob(fileId, requestedById, maxAttempts);
  }

  /** True for {@code completed}, and for {@code failed} once the attempt ceiling is reached. */
  public boolean isTerminal() {
    return status == PreviewJobStatus.COMPLETED
        || (status == PreviewJobStatus.FAILED && attempts >= maxAttempts);
  }

  /** A failed job that still has attempts left may be reopened by an explicit retry. */
  public boolean isReopenable() {
    return status == PreviewJobStatus.FAILED && attempts < maxAttempts;
  }

  public PreviewJob copy() {
    PreviewJob copy = new PreviewJob(fileId, requestedById, maxAttempts);
    copy.id = id;
    copy.status = status;
    copy.attempts = attempts;
    copy.lastError = lastError;
    copy.startedAt = startedAt;
    copy.completedAt = completedAt;
    copy.nextRetryAt = nextRetryAt;
    copy.createdAt = createdAt;
    copy.updatedAt = updatedAt;
    return copy;
  }

  public UUID getId() {
    return id;
  }

  public void setId(UUID id) {
    this.id = id;
  }

  public UUID getFileId() {
    return fileId;
  }

  public UUID getRequestedById() {
    return requestedById;
  }

  public PreviewJobStatus getStatus() {
    return status;
  }

  public void setStatus(PreviewJobStatus status) {
    this.status = status;
  }

  public int getAttempts() {
    return attempts;
  }

  public void setAttempts(int attempts) {
    this.attempts = attempts;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public String getLastError() {
    return lastError;
  }

  public void setLastError(String lastError) {
    this.lastError = lastError;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public void setCompletedAt(Instant completedAt) {
    this.completedAt = completedAt;
  }

  public Instant getNextRetryAt() {
    return nextRetryAt;
  }

  public void setNextRetryAt(Instant nextRetryAt) {
    this.nextRetryAt = nextRetryAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }

  @Override
  public String toString() {
    return "PreviewJob{id="
        + id
        + ", fileId="
        + fileId
        + ", status="
        + status.value()
        + ", attempts="
        + attempts
        + "/"
        + maxAttempts
        + "}";
  }
}
