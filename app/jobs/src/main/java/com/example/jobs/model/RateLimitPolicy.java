package com.example.jobs.model;

import java.time.Duration;

/**
 * Minimum spacing between dispatches of one event type, and how long a queued occurrence may wait
 * past its slot before the slot is abandoned and recomputed from the current time.
 */
public record RateLimitPolicy(Duration delta, Duration maxAge) {

  public RateLimitPolicy {
    if (delta == null || delta.isZero() || delta.isNegative()) {
      throw new IllegalArgumentException("rate limit delta must be positive");
    }
    // a zero max age would re-anchor every job the moment it becomes due
    if (maxAge == null || maxAge.isZero() || maxAge.isNegative()) {
      throw new IllegalArgumentException("rate limit max age must be positive");
    }
  }
}
