package com.scholary.docshare.preview.scheduler;

import java.time.Duration;
import java.util.List;

/**
 * Backoff schedule for failed preview attempts.
 *
 * <p>The delay after the n-th failed attempt is entry {@code n-1} of the configured list. Past the
 * end of the list the last entry is reused, so delays grow through the schedule and then hold.
 */
public class RetryBackoff {

  private final List<Duration> delays;

  public RetryBackoff(List<Duration> delays) {
    if (delays == null || delays.isEmpty()) {
      throw new IllegalArgumentException("retry delays must not be empty");
    }
    for (Duration delay : delays) {
      if (delay == null || delay.isNegative()) {
        throw new IllegalArgumentException("retry delays must be non-negative: " + delays);
      }
    }
    this.delays = List.copyOf(delays);
  }

  /**
   * Delay to wait after the given number of failed attempts.
   *
   * @param attempts failed attempts so far, counting the one that just failed
   */
  public Duration delayAfter(int attempts) {
    int index = Math.min(Math.max(attempts - 1, 0), delays.size() - 1);
    return delays.get(index);
  }
}
