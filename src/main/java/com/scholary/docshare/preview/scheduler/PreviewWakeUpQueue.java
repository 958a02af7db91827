package com.scholary.docshare.preview.scheduler;

import com.scholary.docshare.preview.job.PreviewJobTask;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, best-effort wake-up signal between producers and the preview worker.
 *
 * <p>Producers never block: {@link #offer(PreviewJobTask)} either accepts the hint or drops it and
 * returns false. Dropped hints are recovered by the periodic sweep, which re-announces every
 * pending job from the store.
 *
 * <p>A capacity of zero is allowed. The queue then buffers nothing and a hint is accepted only
 * when a worker is already blocked in {@link #take()}.
 */
public class PreviewWakeUpQueue {

  private final BlockingQueue<PreviewJobTask> queue;
  private final int capacity;

  public PreviewWakeUpQueue(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
    }
    this.capacity = capacity;
    this.queue = capacity == 0 ? new SynchronousQueue<>() : new ArrayBlockingQueue<>(capacity);
  }

  /**
   * Offer a hint without blocking.
   *
   * @return true if the hint was accepted, false if it was dropped
   */
  public boolean offer(PreviewJobTask task) {
    return queue.offer(task);
  }

  /** Block until a hint is available. */
  public PreviewJobTask take() throws InterruptedException {
    return queue.take();
  }

  /** Wait up to {@code timeout} for a hint; null if none arrived. */
  public PreviewJobTask poll(long timeout, TimeUnit unit) throws InterruptedException {
    return queue.poll(timeout, unit);
  }

  public int size() {
    return queue.size();
  }

  public int capacity() {
    return capacity;
  }
}
