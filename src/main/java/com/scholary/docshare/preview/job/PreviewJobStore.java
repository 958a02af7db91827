package com.scholary.docshare.preview.job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Durable storage of preview job rows.
 *
 * <p>The store is the source of truth for job state. It offers per-row reads and writes plus the
 * handful of predicate queries the scheduler needs; it does not enforce scheduling invariants such
 * as one in-flight job per file.
 *
 * <p>Implementations hand out copies: callers read, mutate, and write a row back with {@link
 * #update(PreviewJob)}.
 */
public interface PreviewJobStore {

  /**
   * Insert a new row.
   *
   * <p>Assigns the id and stamps {@code createdAt} and {@code updatedAt}.
   *
   * @param job the job to insert; its id must be null
   * @return the stored row
   * @throws JobStoreException if the row cannot be written
   */
  PreviewJob create(PreviewJob job);

  /**
   * Overwrite an existing row by id, stamping {@code updatedAt}.
   *
   * @param job the job to write back
   * @return the stored row
   * @throws JobStoreException if the row does not exist or cannot be written
   */
  PreviewJob update(PreviewJob job);

  /**
   * Overwrite an existing row only if its current stored state satisfies {@code expected}.
   *
   * <p>The check and the write are atomic with respect to other writes of the same row.
   *
   * @param job the job to write back
   * @param expected condition on the row as currently stored
   * @return the stored row, or empty if the condition did not hold and nothing was written
   * @throws JobStoreException if the row does not exist or cannot be written
   */
  Optional<PreviewJob> updateIf(PreviewJob job, Predicate<PreviewJob> expected);

  Optional<PreviewJob> findById(UUID id);

  /** Most recently created row for the file, regardless of status. */
  Optional<PreviewJob> findLatestByFileId(UUID fileId);

  /** Most recently created row for the file whose status is one of {@code statuses}. */
  Optional<PreviewJob> findLatestByFileIdAndStatusIn(UUID fileId, Set<PreviewJobStatus> statuses);

  /** All rows in {@code status} whose {@code updatedAt} is strictly before {@code cutoff}. */
  List<PreviewJob> findByStatusAndUpdatedAtBefore(PreviewJobStatus status, Instant cutoff);

  /**
   * Rows that should be offered to the worker again: every {@code pending} row, plus {@code
   * failed} rows below their attempt ceiling whose {@code nextRetryAt} is at or before {@code
   * now}.
   */
  List<PreviewJob> findDueForAnnouncement(Instant now);
}
