package com.scholary.docshare.preview.scheduler;

import com.scholary.docshare.preview.config.PreviewProperties;
import com.scholary.docshare.preview.job.JobStoreException;
import com.scholary.docshare.preview.job.PreviewJob;
import com.scholary.docshare.preview.job.PreviewJobStatus;
import com.scholary.docshare.preview.job.PreviewJobStore;
import com.scholary.docshare.preview.job.PreviewJobTask;
import com.scholary.docshare.preview.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Admission, status lookup, explicit retry, and recovery for preview jobs.
 *
 * <p>The job store is the source of truth. The wake-up queue only shortens the time until the
 * worker notices new work; every hint it drops is recovered by {@link #recoverStaleJobs()}, which
 * re-announces all pending jobs from the store.
 *
 * <p>Admission holds a lock around lookup-then-insert, so concurrent callers for the same file
 * never create two in-flight jobs.
 */
@Service
public class PreviewQueueService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PreviewQueueService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /** A processing job not updated for this long is assumed orphaned by a dead or hung worker. */
  public static final Duration STALE_THRESHOLD = Duration.ofMinutes(10);

  static final Set<PreviewJobStatus> IN_FLIGHT =
      EnumSet.of(PreviewJobStatus.PENDING, PreviewJobStatus.PROCESSING);

  private final PreviewJobStore jobStore;
  private final PreviewWakeUpQueue wakeUpQueue;
  private final int maxAttempts;
  private final Clock clock;

  private final Object admissionLock = new Object();

  @Autowired
  public PreviewQueueService(
      PreviewJobStore jobStore,
      PreviewWakeUpQueue wakeUpQueue,
      PreviewProperties properties,
      Clock clock) {
    this(jobStore, wakeUpQueue, properties.maxAttempts(), clock);
  }

  public PreviewQueueService(
      PreviewJobStore jobStore, PreviewWakeUpQueue wakeUpQueue, int maxAttempts, Clock clock) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
    }
    this.jobStore = jobStore;
    this.wakeUpQueue = wakeUpQueue;
    this.maxAttempts = maxAttempts;
    this.clock = clock;
  }

  /**
   * Request a preview for a file.
   *
   * <p>If the file already has a pending or processing job, that job is returned unchanged.
   * Otherwise a new pending job is created and the worker is woken up if the queue has room.
   *
   * @param fileId the file to preview
   * @param requestedById the requesting user, or null for system-triggered work
   * @return the in-flight job for the file
   * @throws JobStoreException if the store cannot be read or written
   */
  public PreviewJob enqueue(UUID fileId, UUID requestedById) {
    Objects.requireNonNull(fileId, "fileId must not be null");

    PreviewJob job;
    synchronized (admissionLock) {
      Optional<PreviewJob> existing = jobStore.findLatestByFileIdAndStatusIn(fileId, IN_FLIGHT);
      if (existing.isPresent()) {
        LOGGER.debug("Preview already in flight: {}", existing.get());
        return existing.get();
      }

      job = jobStore.create(PreviewJob.pending(fileId, requestedById, maxAttempts));
    }

    if (wakeUpQueue.offer(new PreviewJobTask(fileId, requestedById))) {
      structuredLogger.logJobEnqueued(job.getId(), fileId);
    } else {
      structuredLogger.logQueueFull("preview_queue_full", job.getId(), fileId);
    }
    return job;
  }

  /**
   * Most recently created job for the file.
   *
   * @return the job, or empty if the file has never been queued
   * @throws JobStoreException if the store cannot be read
   */
  public Optional<PreviewJob> getJobByFileId(UUID fileId) {
    return jobStore.findLatestByFileId(fileId);
  }

  /**
   * Explicitly retry a file's preview.
   *
   * <p>A failed job that still has attempts left is reopened in place: back to pending, error and
   * retry time cleared, attempt count kept. In every other case (no job, job in flight, job
   * completed or out of attempts) this behaves exactly like {@link #enqueue(UUID, UUID)}.
   *
   * @throws JobStoreException if the store cannot be read or written
   */
  public PreviewJob retry(UUID fileId, UUID requestedById) {
    Objects.requireNonNull(fileId, "fileId must not be null");

    PreviewJob reopened = null;
    synchronized (admissionLock) {
      Optional<PreviewJob> latest = jobStore.findLatestByFileId(fileId);
      if (latest.isPresent() && latest.get().isReopenable()) {
        PreviewJob job = latest.get();
        job.setStatus(PreviewJobStatus.PENDING);
        job.setLastError(null);
        job.setNextRetryAt(null);
        reopened = jobStore.update(job);
      }
    }

    if (reopened == null) {
      return enqueue(fileId, requestedById);
    }

    LOGGER.info(
        "Reopened failed preview job: jobId={}, fileId={}, attempts={}/{}",
        reopened.getId(),
        fileId,
        reopened.getAttempts(),
        reopened.getMaxAttempts());
    if (!wakeUpQueue.offer(new PreviewJobTask(fileId, requestedById))) {
      structuredLogger.logQueueFull("preview_queue_full_on_retry", reopened.getId(), fileId);
    }
    return reopened;
  }

  /**
   * Repair orphaned jobs and re-announce due work.
   *
   * <p>First, processing jobs whose row has not been touched for {@link #STALE_THRESHOLD} are reset
   * to pending. Second, every pending job (and every failed job below its attempt ceiling whose
   * retry time has come) is offered to the wake-up queue again. The two passes are independent: a
   * store failure in one does not skip the other.
   */
  public void recoverStaleJobs() {
    Instant now = clock.instant();

    int recovered = 0;
    try {
      recovered = resetStaleJobs(now);
    } catch (JobStoreException e) {
      LOGGER.error("Stale preview job query failed", e);
    }

    int announced = 0;
    try {
      List<PreviewJob> dueJobs = jobStore.findDueForAnnouncement(now);
      for (PreviewJob job : dueJobs) {
        if (announce(job, "preview_queue_full_on_recovery")) {
          announced++;
        }
      }
    } catch (JobStoreException e) {
      LOGGER.error("Due preview job query failed", e);
    }

    if (recovered > 0 || announced > 0) {
      LOGGER.info("Preview recovery sweep: staleReset={}, reannounced={}", recovered, announced);
    }
  }

  private int resetStaleJobs(Instant now) {
    Instant cutoff = now.minus(STALE_THRESHOLD);
    int recovered = 0;

    for (PreviewJob candidate :
        jobStore.findByStatusAndUpdatedAtBefore(PreviewJobStatus.PROCESSING, cutoff)) {
      try {
        // The worker may have finished the job since the query ran
        Optional<PreviewJob> current = jobStore.findById(candidate.getId());
        if (current.isEmpty()
            || current.get().getStatus() != PreviewJobStatus.PROCESSING
            || !current.get().getUpdatedAt().isBefore(cutoff)) {
          continue;
        }

        PreviewJob job = current.get();
        Instant lastUpdatedAt = job.getUpdatedAt();
        job.setStatus(PreviewJobStatus.PENDING);
        job.setNextRetryAt(null);
        // A worker finishing between the read and this write wins
        Optional<PreviewJob> reset =
            jobStore.updateIf(
                job,
                stored ->
                    stored.getStatus() == PreviewJobStatus.PROCESSING
                        && stored.getUpdatedAt().equals(lastUpdatedAt));
        if (reset.isEmpty()) {
          continue;
        }
        PreviewJob saved = reset.get();

        structuredLogger.logStaleRecovered(saved.getId(), saved.getFileId(), lastUpdatedAt);
        announce(saved, "preview_queue_full_on_recovery");
        recovered++;

      } catch (JobStoreException e) {
        LOGGER.error("Stale preview job recovery failed: jobId={}", candidate.getId(), e);
      }
    }
    return recovered;
  }

  private boolean announce(PreviewJob job, String queueFullEvent) {
    if (wakeUpQueue.offer(PreviewJobTask.forJob(job))) {
      return true;
    }
    structuredLogger.logQueueFull(queueFullEvent, job.getId(), job.getFileId());
    return false;
  }
}
