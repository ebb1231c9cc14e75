/*
 * Where: jobs service layer
 * What: per event type dispatch spacing with a monotonic chain of slots
 * Why: a burst of raises must turn into a delta-spaced sequence, and a chain left behind by downtime must not fire all at once
 */
package com.example.jobs.service;

import com.example.jobs.model.JobRecord;
import com.example.jobs.model.RateLimitPolicy;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * Computes the earliest legal slot for an occurrence of a rate limited event type.
 *
 * <p>Each type keeps the last slot it handed out. A new occurrence gets {@code max(occurrence,
 * last + delta)} and becomes the new last slot. Because of the {@code max}, a chain whose last slot
 * lies in the past restarts at the occurrence time, which is what re-anchors stale jobs after an
 * idle period.
 *
 * <p>Slots are tracked per process. Instances sharing one jobs table each space their own raises.
 */
@Component
public class RateLimiter {

  private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

  /** Defines or replaces the policy of {@code eventType}; a replaced policy starts a fresh chain. */
  public void define(String eventType, RateLimitPolicy policy) {
    windows.put(eventType, new Window(policy));
  }

  public Optional<RateLimitPolicy> policyFor(String eventType) {
    final Window window = windows.get(eventType);
    return window == null ? Optional.empty() : Optional.of(window.policy);
  }

  /**
   * Reserves the next slot of {@code eventType} for an occurrence at {@code occurrence}.
   *
   * @return the slot, or empty when the type is not rate limited
   */
  public Optional<Instant> schedule(String eventType, Instant occurrence) {
    final Window window = windows.get(eventType);
    if (window == null) {
      return Optional.empty();
    }
    return Optional.of(window.next(occurrence));
  }

  /**
   * Slot of a timer of {@code eventType} that must not run before {@code at}.
   *
   * <p>An instant past the chain's next slot is returned as is and leaves the chain untouched, so
   * raises made before the timer fires are not queued behind it. An instant the chain has already
   * reached gets the chain's next slot instead, like an ordinary raise.
   *
   * @return the slot, or empty when the type is not rate limited
   */
  public Optional<Instant> scheduleTimer(String eventType, Instant at) {
    final Window window = windows.get(eventType);
    if (window == null) {
      return Optional.empty();
    }
    return Optional.of(window.nextTimer(at));
  }

  /**
   * Gives back {@code slot} when no later slot was reserved after it. A slot that is no longer the
   * newest one stays taken.
   */
  public void release(String eventType, Instant slot) {
    final Window window = windows.get(eventType);
    if (window != null && slot != null) {
      window.release(slot);
    }
  }

  /**
   * True when {@code job} is rate limited and has waited past its slot for longer than the
   * policy's max age.
   */
  public boolean isStale(JobRecord job, Instant now) {
    final Window window = windows.get(job.type());
    if (window == null || job.scheduledAt() == null) {
      return false;
    }
    final Duration waited = Duration.between(job.scheduledAt(), now);
    return waited.compareTo(window.policy.maxAge()) > 0;
  }

  private static final class Window {

    private final RateLimitPolicy policy;
    private Instant last;
    private Instant previous;

    private Window(RateLimitPolicy policy) {
      this.policy = policy;
    }

    private synchronized Instant next(Instant occurrence) {
      Instant slot = occurrence;
      if (last != null) {
        final Instant chained = last.plus(policy.delta());
        if (chained.isAfter(slot)) {
          slot = chained;
        }
      }
      previous = last;
      last = slot;
      return slot;
    }

    private synchronized Instant nextTimer(Instant at) {
      if (last == null || at.isAfter(last.plus(policy.delta()))) {
        return at;
      }
      return next(at);
    }

    private synchronized void release(Instant slot) {
      if (slot.equals(last)) {
        last = previous;
        previous = null;
      }
    }
  }
}
