package com.scholary.docshare.preview.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.docshare.preview.config.PreviewProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory job store backed by a Caffeine cache.
 *
 * <p>Terminal rows (completed, or failed at the attempt ceiling) expire after the configured
 * retention so finished history does not accumulate forever. Rows that can still make progress
 * never expire: losing a pending row would silently drop the work.
 *
 * <p>Every row carries an insertion sequence number so "most recent" stays well defined when two
 * rows share a creation timestamp.
 */
@Repository
public class InMemoryPreviewJobStore implements PreviewJobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryPreviewJobStore.class);

  private static final Comparator<StoredJob> NEWEST_FIRST =
      Comparator.comparingLong(StoredJob::sequence).reversed();

  private final Cache<UUID, StoredJob> cache;
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;

  @Autowired
  public InMemoryPreviewJobStore(Clock clock, PreviewProperties properties) {
    this(clock, properties.jobRetention());
  }

  public InMemoryPreviewJobStore(Clock clock, Duration retention) {
    this(clock, retention, Ticker.systemTicker());
  }

  public InMemoryPreviewJobStore(Clock clock, Duration retention, Ticker ticker) {
    this.clock = clock;
    this.cache =
        Caffeine.newBuilder().expireAfter(new TerminalRowExpiry(retention)).ticker(ticker).build();

    LOGGER.info("Initialized in-memory preview job store: retention={}", retention);
  }

  @Override
  public PreviewJob create(PreviewJob job) {
    if (job.getId() != null) {
      throw new IllegalArgumentException("New job must not have an id: " + job.getId());
    }

    Instant now = clock.instant();
    PreviewJob row = job.copy();
    row.setId(UUID.randomUUID());
    row.setCreatedAt(now);
    row.setUpdatedAt(now);

    cache.put(row.getId(), new StoredJob(sequence.incrementAndGet(), row));
    LOGGER.debug("Created preview job: {}", row);
    return row.copy();
  }

  @Override
  public PreviewJob update(PreviewJob job) {
    if (job.getId() == null) {
      throw new JobStoreException("Cannot update a job without an id");
    }

    PreviewJob row = job.copy();
    row.setUpdatedAt(clock.instant());

    StoredJob stored =
        cache
            .asMap()
            .computeIfPresent(
                job.getId(), (id, existing) -> new StoredJob(existing.sequence(), row));
    if (stored == null) {
      throw new JobStoreException("Preview job not found: " + job.getId());
    }
    return row.copy();
  }

  @Override
  public Optional<PreviewJob> updateIf(PreviewJob job, Predicate<PreviewJob> expected) {
    if (job.getId() == null) {
      throw new JobStoreException("Cannot update a job without an id");
    }

    PreviewJob row = job.copy();
    row.setUpdatedAt(clock.instant());

    StoredJob stored =
        cache
            .asMap()
            .computeIfPresent(
                job.getId(),
                (id, existing) ->
                    expected.test(existing.job().copy())
                        ? new StoredJob(existing.sequence(), row)
                        : existing);
    if (stored == null) {
      throw new JobStoreException("Preview job not found: " + job.getId());
    }
    if (stored.job() != row) {
      LOGGER.debug("Conditional update skipped, row changed: {}", stored.job());
      return Optional.empty();
    }
    return Optional.of(row.copy());
  }

  @Override
  public Optional<PreviewJob> findById(UUID id) {
    return Optional.ofNullable(cache.getIfPresent(id)).map(stored -> stored.job().copy());
  }

  @Override
  public Optional<PreviewJob> findLatestByFileId(UUID fileId) {
    return findLatest(job -> job.getFileId().equals(fileId));
  }

  @Override
  public Optional<PreviewJob> findLatestByFileIdAndStatusIn(
      UUID fileId, Set<PreviewJobStatus> statuses) {
    return findLatest(job -> job.getFileId().equals(fileId) && statuses.contains(job.getStatus()));
  }

  @Override
  public List<PreviewJob> findByStatusAndUpdatedAtBefore(PreviewJobStatus status, Instant cutoff) {
    return findAll(job -> job.getStatus() == status && job.getUpdatedAt().isBefore(cutoff));
  }

  @Override
  public List<PreviewJob> findDueForAnnouncement(Instant now) {
    return findAll(
        job ->
            job.getStatus() == PreviewJobStatus.PENDING
                || (job.isReopenable()
                    && job.getNextRetryAt() != null
                    && !job.getNextRetryAt().isAfter(now)));
  }

  /** Number of rows currently retained, after expired rows have been purged. */
  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private Optional<PreviewJob> findLatest(Predicate<PreviewJob> predicate) {
    return cache.asMap().values().stream()
        .filter(stored -> predicate.test(stored.job()))
        .min(NEWEST_FIRST)
        .map(stored -> stored.job().copy());
  }

  private List<PreviewJob> findAll(Predicate<PreviewJob> predicate) {
    return cache.asMap().values().stream()
        .filter(stored -> predicate.test(stored.job()))
        .sorted(NEWEST_FIRST.reversed())
        .map(stored -> stored.job().copy())
        .collect(Collectors.toList());
  }

  private record StoredJob(long sequence, PreviewJob job) {}

  /** Expires terminal rows after the retention window; everything else lives indefinitely. */
  private static final class TerminalRowExpiry implements Expiry<UUID, StoredJob> {

    private final long retentionNanos;

    TerminalRowExpiry(Duration retention) {
      this.retentionNanos = retention.toNanos();
    }

    @Override
    public long expireAfterCreate(UUID key, StoredJob value, long currentTime) {
      return lifetime(value);
    }

    @Override
    public long expireAfterUpdate(
        UUID key, StoredJob value, long currentTime, long currentDuration) {
      return lifetime(value);
    }

    @Override
    public long expireAfterRead(UUID key, StoredJob value, long currentTime, long currentDuration) {
      return currentDuration;
    }

    private long lifetime(StoredJob value) {
      return value.job().isTerminal() ? retentionNanos : Long.MAX_VALUE;
    }
  }
}
