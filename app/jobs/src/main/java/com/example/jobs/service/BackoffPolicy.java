/*
 * Where: jobs service layer
 * What: ordered retry delays and the attempt budget derived from them
 * Why: retry timing must be deterministic, so the sequence is explicit instead of randomized
 */
package com.example.jobs.service;

import java.time.Duration;
import java.util.List;

/**
 * Retry delays {@code [d0, d1, ...]} applied to consecutive failures of one job.
 *
 * <p>A job gets one initial attempt plus one retry per delay, so {@link #maxAttempts()} is the
 * sequence length plus one. After the failure of an attempt made with {@code n} attempts left, the
 * next attempt waits {@code d[maxAttempts - n]}; the index is clamped to the last delay so a job
 * enqueued under a longer sequence still gets a delay when processed under a shorter one.
 */
public final class BackoffPolicy {

  private final List<Duration> delays;

  public BackoffPolicy(List<Duration> delays) {
    if (delays == null || delays.isEmpty()) {
      throw new IllegalArgumentException("backoff sequence must not be empty");
    }
    for (Duration delay : delays) {
      if (delay == null || delay.isNegative()) {
        throw new IllegalArgumentException("backoff delays must not be negative: " + delays);
      }
    }
    this.delays = List.copyOf(delays);
  }

  public static BackoffPolicy of(Duration... delays) {
    return new BackoffPolicy(List.of(delays));
  }

  public List<Duration> delays() {
    return delays;
  }

  public int maxAttempts() {
    return delays.size() + 1;
  }

  public Duration delayAfterFailure(int attemptsLeftBeforeFailure) {
    final int index = maxAttempts() - attemptsLeftBeforeFailure;
    return delays.get(Math.min(Math.max(index, 0), delays.size() - 1));
  }

  @Override
  public String toString() {
    return "BackoffPolicy" + delays;
  }
}
