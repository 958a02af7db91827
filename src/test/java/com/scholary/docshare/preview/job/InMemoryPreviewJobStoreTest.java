package com.scholary.docshare.preview.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.docshare.preview.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryPreviewJobStoreTest {

  private static final Duration RETENTION = Duration.ofDays(7);

  private MutableClock clock;
  private AtomicLong tickerNanos;
  private InMemoryPreviewJobStore store;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
    tickerNanos = new AtomicLong();
    Ticker ticker = tickerNanos::get;
    store = new InMemoryPreviewJobStore(clock, RETENTION, ticker);
  }

  @Test
  void create_shouldAssignIdAndTimestamps() {
    PreviewJob created = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));

    assertThat(created.getId()).isNotNull();
    assertThat(created.getStatus()).isEqualTo(PreviewJobStatus.PENDING);
    assertThat(created.getAttempts()).isZero();
    assertThat(created.getCreatedAt()).isEqualTo(clock.instant());
    assertThat(created.getUpdatedAt()).isEqualTo(clock.instant());
  }

  @Test
  void create_shouldRejectJobThatAlreadyHasId() {
    PreviewJob job = PreviewJob.pending(UUID.randomUUID(), null, 3);
    job.setId(UUID.randomUUID());

    assertThatThrownBy(() -> store.create(job)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void returnedRows_shouldBeCopies() {
    PreviewJob created = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));

    created.setStatus(PreviewJobStatus.COMPLETED);

    assertThat(store.findById(created.getId()))
        .get()
        .extracting(PreviewJob::getStatus)
        .isEqualTo(PreviewJobStatus.PENDING);
  }

  @Test
  void update_shouldOverwriteRowAndStampUpdatedAt() {
    PreviewJob created = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    clock.advance(Duration.ofSeconds(5));

    created.setStatus(PreviewJobStatus.PROCESSING);
    created.setStartedAt(clock.instant());
    store.update(created);

    PreviewJob reloaded = store.findById(created.getId()).orElseThrow();
    assertThat(reloaded.getStatus()).isEqualTo(PreviewJobStatus.PROCESSING);
    assertThat(reloaded.getStartedAt()).isEqualTo(clock.instant());
    assertThat(reloaded.getUpdatedAt()).isEqualTo(clock.instant());
    assertThat(reloaded.getCreatedAt()).isEqualTo(created.getCreatedAt());
  }

  @Test
  void update_shouldFailForUnknownRow() {
    PreviewJob job = PreviewJob.pending(UUID.randomUUID(), null, 3);
    job.setId(UUID.randomUUID());

    assertThatThrownBy(() -> store.update(job))
        .isInstanceOf(JobStoreException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void updateIf_shouldWriteWhenStoredRowMatches() {
    PreviewJob created = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    clock.advance(Duration.ofSeconds(5));

    created.setStatus(PreviewJobStatus.PROCESSING);
    PreviewJob saved =
        store
            .updateIf(created, stored -> stored.getStatus() == PreviewJobStatus.PENDING)
            .orElseThrow();

    assertThat(saved.getStatus()).isEqualTo(PreviewJobStatus.PROCESSING);
    assertThat(saved.getUpdatedAt()).isEqualTo(clock.instant());
    assertThat(store.findById(created.getId()).orElseThrow().getStatus())
        .isEqualTo(PreviewJobStatus.PROCESSING);
  }

  @Test
  void updateIf_shouldLeaveRowUntouchedWhenStoredRowChanged() {
    PreviewJob created = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    Instant createdAt = created.getUpdatedAt();
    clock.advance(Duration.ofSeconds(5));

    created.setStatus(PreviewJobStatus.COMPLETED);

    assertThat(
            store.updateIf(created, stored -> stored.getStatus() == PreviewJobStatus.PROCESSING))
        .isEmpty();
    PreviewJob reloaded = store.findById(created.getId()).orElseThrow();
    assertThat(reloaded.getStatus()).isEqualTo(PreviewJobStatus.PENDING);
    assertThat(reloaded.getUpdatedAt()).isEqualTo(createdAt);
  }

  @Test
  void updateIf_shouldFailForUnknownRow() {
    PreviewJob job = PreviewJob.pending(UUID.randomUUID(), null, 3);
    job.setId(UUID.randomUUID());

    assertThatThrownBy(() -> store.updateIf(job, stored -> true))
        .isInstanceOf(JobStoreException.class);
  }

  @Test
  void findLatestByFileId_shouldPreferMostRecentlyCreatedRow() {
    UUID fileId = UUID.randomUUID();
    PreviewJob first = store.create(PreviewJob.pending(fileId, null, 3));
    first.setStatus(PreviewJobStatus.FAILED);
    first.setAttempts(3);
    store.update(first);

    // Same timestamp on purpose: ordering must not depend on createdAt alone
    PreviewJob second = store.create(PreviewJob.pending(fileId, null, 3));
    store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));

    assertThat(store.findLatestByFileId(fileId))
        .get()
        .extracting(PreviewJob::getId)
        .isEqualTo(second.getId());
  }

  @Test
  void findLatestByFileIdAndStatusIn_shouldFilterOnStatus() {
    UUID fileId = UUID.randomUUID();
    PreviewJob pending = store.create(PreviewJob.pending(fileId, null, 3));
    PreviewJob completed = store.create(PreviewJob.pending(fileId, null, 3));
    completed.setStatus(PreviewJobStatus.COMPLETED);
    store.update(completed);

    assertThat(
            store.findLatestByFileIdAndStatusIn(
                fileId, EnumSet.of(PreviewJobStatus.PENDING, PreviewJobStatus.PROCESSING)))
        .get()
        .extracting(PreviewJob::getId)
        .isEqualTo(pending.getId());
    assertThat(
            store.findLatestByFileIdAndStatusIn(fileId, EnumSet.of(PreviewJobStatus.FAILED)))
        .isEmpty();
    assertThat(store.findLatestByFileId(UUID.randomUUID())).isEmpty();
  }

  @Test
  void findByStatusAndUpdatedAtBefore_shouldReturnOnlyOlderRowsInStatus() {
    PreviewJob old = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    old.setStatus(PreviewJobStatus.PROCESSING);
    store.update(old);
    Instant cutoff = clock.instant().plusSeconds(1);

    clock.advance(Duration.ofMinutes(1));
    PreviewJob fresh = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    fresh.setStatus(PreviewJobStatus.PROCESSING);
    store.update(fresh);
    store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));

    List<PreviewJob> stale =
        store.findByStatusAndUpdatedAtBefore(PreviewJobStatus.PROCESSING, cutoff);

    assertThat(stale).extracting(PreviewJob::getId).containsExactly(old.getId());
  }

  @Test
  void findByStatusAndUpdatedAtBefore_shouldExcludeRowUpdatedExactlyAtCutoff() {
    PreviewJob job = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    job.setStatus(PreviewJobStatus.PROCESSING);
    store.update(job);

    assertThat(store.findByStatusAndUpdatedAtBefore(PreviewJobStatus.PROCESSING, clock.instant()))
        .isEmpty();
  }

  @Test
  void findDueForAnnouncement_shouldIncludePendingAndDueReopenableRows() {
    PreviewJob pending = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));

    PreviewJob backingOff = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    backingOff.setAttempts(1);
    backingOff.setNextRetryAt(clock.instant().plus(Duration.ofMinutes(5)));
    store.update(backingOff);

    PreviewJob reopenable = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    reopenable.setStatus(PreviewJobStatus.FAILED);
    reopenable.setAttempts(1);
    reopenable.setNextRetryAt(clock.instant().minusSeconds(1));
    store.update(reopenable);

    PreviewJob notYetDue = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    notYetDue.setStatus(PreviewJobStatus.FAILED);
    notYetDue.setAttempts(1);
    notYetDue.setNextRetryAt(clock.instant().plusSeconds(60));
    store.update(notYetDue);

    PreviewJob exhausted = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    exhausted.setStatus(PreviewJobStatus.FAILED);
    exhausted.setAttempts(3);
    exhausted.setNextRetryAt(clock.instant().minusSeconds(1));
    store.update(exhausted);

    PreviewJob completed = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    completed.setStatus(PreviewJobStatus.COMPLETED);
    store.update(completed);

    assertThat(store.findDueForAnnouncement(clock.instant()))
        .extracting(PreviewJob::getId)
        .containsExactly(pending.getId(), backingOff.getId(), reopenable.getId());
  }

  @Test
  void terminalRows_shouldExpireAfterRetention() {
    PreviewJob completed = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    completed.setStatus(PreviewJobStatus.COMPLETED);
    store.update(completed);

    PreviewJob exhausted = store.create(PreviewJob.pending(UUID.randomUUID(), null, 1));
    exhausted.setStatus(PreviewJobStatus.FAILED);
    exhausted.setAttempts(1);
    store.update(exhausted);

    tickerNanos.addAndGet(RETENTION.minusMinutes(1).toNanos());
    assertThat(store.findById(completed.getId())).isPresent();

    tickerNanos.addAndGet(Duration.ofMinutes(2).toNanos());
    assertThat(store.findById(completed.getId())).isEmpty();
    assertThat(store.findById(exhausted.getId())).isEmpty();
    assertThat(store.size()).isZero();
  }

  @Test
  void nonTerminalRows_shouldNeverExpire() {
    PreviewJob pending = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));

    PreviewJob reopenable = store.create(PreviewJob.pending(UUID.randomUUID(), null, 3));
    reopenable.setStatus(PreviewJobStatus.FAILED);
    reopenable.setAttempts(1);
    store.update(reopenable);

    tickerNanos.addAndGet(RETENTION.multipliedBy(10).toNanos());

    assertThat(store.findById(pending.getId())).isPresent();
    assertThat(store.findById(reopenable.getId())).isPresent();
    assertThat(store.size()).isEqualTo(2);
  }
}
