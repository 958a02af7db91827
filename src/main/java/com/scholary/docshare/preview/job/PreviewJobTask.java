package com.scholary.docshare.preview.job;

import java.util.Objects;
import java.util.UUID;

/**
 * Wake-up hint carried across the in-memory queue.
 *
 * <p>Never persisted and never authoritative: the worker re-reads the job store before acting, so
 * a dropped or duplicated task costs latency, not correctness.
 *
 * @param fileId the file whose pending job should be processed
 * @param requestedById the user that triggered the work, or null for system-triggered work
 */
public record PreviewJobTask(UUID fileId, UUID requestedById) {

  public PreviewJobTask {
    Objects.requireNonNull(fileId, "fileId must not be null");
  }

  public static PreviewJobTask forJob(PreviewJob job) {
    return new PreviewJobTask(job.getFileId(), job.getRequestedById());
  }
}
