package com.scholary.docshare.preview.scheduler;

import com.scholary.docshare.preview.config.PreviewProperties;
import com.scholary.docshare.preview.conversion.ConversionBackend;
import com.scholary.docshare.preview.file.FileCatalog;
import com.scholary.docshare.preview.file.SourceFile;
import com.scholary.docshare.preview.job.JobStoreException;
import com.scholary.docshare.preview.job.PreviewJob;
import com.scholary.docshare.preview.job.PreviewJobStatus;
import com.scholary.docshare.preview.job.PreviewJobStore;
import com.scholary.docshare.preview.job.PreviewJobTask;
import com.scholary.docshare.preview.logging.StructuredLogger;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Consumes wake-up hints and runs conversions one at a time.
 *
 * <p>With the default single worker thread, at most one conversion is in flight process-wide, which
 * bounds the load on the conversion service regardless of how many jobs are queued. A worker
 * count above one is accepted but gives up the guarantee that a file has at most one attempt
 * running: two hints for the same file could then be claimed by two threads at once.
 *
 * <p>Every hint is re-validated against the store. Conversion failures never leave this class;
 * they become persisted state transitions and log events.
 */
@Component
public class PreviewWorker implements SmartLifecycle {

  private static final Logger LOGGER = LoggerFactory.getLogger(PreviewWorker.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final Set<PreviewJobStatus> PENDING_ONLY = EnumSet.of(PreviewJobStatus.PENDING);
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private final PreviewWakeUpQueue wakeUpQueue;
  private final PreviewJobStore jobStore;
  private final FileCatalog fileCatalog;
  private final ConversionBackend conversionBackend;
  private final RetryBackoff retryBackoff;
  private final Clock clock;
  private final int workerCount;

  private volatile boolean running;
  private volatile boolean stopping;
  private ExecutorService executor;

  @Autowired
  public PreviewWorker(
      PreviewWakeUpQueue wakeUpQueue,
      PreviewJobStore jobStore,
      FileCatalog fileCatalog,
      ConversionBackend conversionBackend,
      RetryBackoff retryBackoff,
      PreviewProperties properties,
      Clock clock) {
    this(
        wakeUpQueue,
        jobStore,
        fileCatalog,
        conversionBackend,
        retryBackoff,
        clock,
        properties.workerCount());
  }

  public PreviewWorker(
      PreviewWakeUpQueue wakeUpQueue,
      PreviewJobStore jobStore,
      FileCatalog fileCatalog,
      ConversionBackend conversionBackend,
      RetryBackoff retryBackoff,
      Clock clock) {
    this(wakeUpQueue, jobStore, fileCatalog, conversionBackend, retryBackoff, clock, 1);
  }

  public PreviewWorker(
      PreviewWakeUpQueue wakeUpQueue,
      PreviewJobStore jobStore,
      FileCatalog fileCatalog,
      ConversionBackend conversionBackend,
      RetryBackoff retryBackoff,
      Clock clock,
      int workerCount) {
    if (workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
    }
    this.wakeUpQueue = wakeUpQueue;
    this.jobStore = jobStore;
    this.fileCatalog = fileCatalog;
    this.conversionBackend = conversionBackend;
    this.retryBackoff = retryBackoff;
    this.clock = clock;
    this.workerCount = workerCount;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    if (workerCount > 1) {
      LOGGER.warn(
          "Starting {} preview workers: concurrent attempts for the same file are possible",
          workerCount);
    }

    running = true;
    stopping = false;
    executor =
        Executors.newFixedThreadPool(
            workerCount, new CustomizableThreadFactory("preview-worker-"));
    for (int i = 0; i < workerCount; i++) {
      executor.submit(this::runLoop);
    }
    LOGGER.info("Preview worker started: threads={}", workerCount);
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    stopping = true;
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        LOGGER.warn("Preview worker did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOGGER.info("Preview worker stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  private void runLoop() {
    while (running && !Thread.currentThread().isInterrupted()) {
      PreviewJobTask task;
      try {
        task = wakeUpQueue.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }

      try {
        process(task);
      } catch (RuntimeException e) {
        LOGGER.error("Unexpected error processing preview task: fileId={}", task.fileId(), e);
      }
    }
  }

  /**
   * Handle one wake-up hint.
   *
   * <p>Claims the newest pending job for the hinted file, converts the file, and persists the
   * outcome. A hint with no pending job behind it is ignored.
   */
  public void process(PreviewJobTask task) {
    Optional<PreviewJob> pending;
    try {
      pending = jobStore.findLatestByFileIdAndStatusIn(task.fileId(), PENDING_ONLY);
    } catch (JobStoreException e) {
      LOGGER.error("Failed to load pending preview job: fileId={}", task.fileId(), e);
      return;
    }
    if (pending.isEmpty()) {
      LOGGER.debug("No pending preview job, ignoring hint: fileId={}", task.fileId());
      return;
    }

    PreviewJob job = pending.get();
    StructuredLogger.setJobContext(job.getId(), job.getFileId());
    try {
      job.setStatus(PreviewJobStatus.PROCESSING);
      job.setStartedAt(clock.instant());

      PreviewJob claimed;
      try {
        claimed = jobStore.update(job);
      } catch (JobStoreException e) {
        LOGGER.error("Failed to mark preview job processing: jobId={}", job.getId(), e);
        return;
      }

      convert(claimed);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void convert(PreviewJob job) {
    Optional<SourceFile> file;
    try {
      file = fileCatalog.findById(job.getFileId());
    } catch (RuntimeException e) {
      if (isShuttingDown()) {
        logAbandoned(job, e);
        return;
      }
      recordFailure(job, "file lookup failed: " + describe(e));
      return;
    }
    if (file.isEmpty()) {
      recordFailure(job, "file not found: " + job.getFileId());
      return;
    }

    long startNanos = System.nanoTime();
    String artifact;
    try {
      artifact = conversionBackend.convert(file.get());
    } catch (RuntimeException e) {
      if (isShuttingDown()) {
        logAbandoned(job, e);
        return;
      }
      LOGGER.debug("Conversion failed: jobId={}", job.getId(), e);
      recordFailure(job, describe(e));
      return;
    }
    long convertMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

    recordSuccess(job, artifact, convertMs);
  }

  /**
   * An interrupted attempt says nothing about the file, so it is not counted. The row stays
   * processing and the stale-job sweep hands it back to the queue.
   */
  private boolean isShuttingDown() {
    return Thread.currentThread().isInterrupted() || stopping;
  }

  private void logAbandoned(PreviewJob job, RuntimeException e) {
    LOGGER.warn(
        "Preview conversion interrupted by shutdown, leaving job for recovery: jobId={}, error={}",
        job.getId(),
        describe(e));
  }

  private void recordSuccess(PreviewJob claimed, String artifact, long convertMs) {
    PreviewJob job = claimed.copy();
    job.setStatus(PreviewJobStatus.COMPLETED);
    job.setCompletedAt(clock.instant());

    if (writeOutcome(claimed, job, "completed").isEmpty()) {
      return;
    }

    structuredLogger.logJobCompleted(job.getId(), job.getFileId(), job.getAttempts(), convertMs);
    LOGGER.debug("Preview artifact: jobId={}, artifact={}", job.getId(), artifact);
  }

  /**
   * Count a failed attempt and either schedule a retry or fail the job for good.
   *
   * <p>The retry time is advisory. Nothing here waits for it; the recovery sweep re-offers the job.
   */
  private void recordFailure(PreviewJob claimed, String reason) {
    PreviewJob job = claimed.copy();
    job.setAttempts(job.getAttempts() + 1);
    job.setLastError(reason);

    Instant nextRetryAt = null;
    if (job.getAttempts() >= job.getMaxAttempts()) {
      job.setStatus(PreviewJobStatus.FAILED);
    } else {
      nextRetryAt = clock.instant().plus(retryBackoff.delayAfter(job.getAttempts()));
      job.setStatus(PreviewJobStatus.PENDING);
      job.setNextRetryAt(nextRetryAt);
    }

    if (writeOutcome(claimed, job, "failed").isEmpty()) {
      return;
    }

    if (nextRetryAt == null) {
      structuredLogger.logFinalFailure(job.getId(), job.getFileId(), job.getAttempts(), reason);
    } else {
      structuredLogger.logRetryScheduled(
          job.getId(),
          job.getFileId(),
          job.getAttempts(),
          job.getMaxAttempts(),
          nextRetryAt,
          reason);
    }
  }

  /**
   * Write an outcome only while the row is still the one this worker claimed.
   *
   * <p>If the recovery sweep reset the job while the conversion ran, the row no longer matches and
   * the outcome is dropped.
   */
  private Optional<PreviewJob> writeOutcome(
      PreviewJob claimed, PreviewJob outcomeRow, String outcome) {
    Optional<PreviewJob> saved;
    try {
      saved =
          jobStore.updateIf(
              outcomeRow,
              current ->
                  current.getStatus() == PreviewJobStatus.PROCESSING
                      && Objects.equals(current.getStartedAt(), claimed.getStartedAt()));
    } catch (JobStoreException e) {
      LOGGER.error("Failed to record preview job {}: jobId={}", outcome, claimed.getId(), e);
      return Optional.empty();
    }

    if (saved.isEmpty()) {
      String currentStatus;
      try {
        currentStatus =
            jobStore
                .findById(claimed.getId())
                .map(job -> job.getStatus().value())
                .orElse("missing");
      } catch (JobStoreException e) {
        LOGGER.warn("Failed to reload preview job: jobId={}", claimed.getId(), e);
        currentStatus = "unknown";
      }
      structuredLogger.logOutcomeDiscarded(
          claimed.getId(), claimed.getFileId(), outcome, currentStatus);
    }
    return saved;
  }

  private static String describe(RuntimeException e) {
    String message = e.getMessage();
    if (message == null || message.isEmpty()) {
      return e.getClass().getSimpleName();
    }
    return message;
  }
}
