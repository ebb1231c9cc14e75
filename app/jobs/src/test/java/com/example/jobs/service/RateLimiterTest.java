package com.example.jobs.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.jobs.model.Event;
import com.example.jobs.model.JobKind;
import com.example.jobs.model.JobRecord;
import com.example.jobs.model.RateLimitPolicy;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class RateLimiterTest {

  private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");
  private static final Duration DELTA = Duration.ofMillis(100);
  private static final Duration MAX_AGE = Duration.ofSeconds(5);

  private final RateLimiter rateLimiter = new RateLimiter();

  @Test
  void unlimitedTypeHasNoSlot() {
    assertThat(rateLimiter.schedule("free", T0)).isEmpty();
    assertThat(rateLimiter.policyFor("free")).isEmpty();
  }

  @Test
  void burstIsSpacedByDelta() {
    rateLimiter.define("limited", new RateLimitPolicy(DELTA, MAX_AGE));

    assertThat(rateLimiter.schedule("limited", T0)).contains(T0);
    assertThat(rateLimiter.schedule("limited", T0)).contains(T0.plus(DELTA));
    assertThat(rateLimiter.schedule("limited", T0)).contains(T0.plus(DELTA.multipliedBy(2)));
  }

  @Test
  void chainRestartsAtOccurrenceAfterIdlePeriod() {
    rateLimiter.define("limited", new RateLimitPolicy(DELTA, MAX_AGE));
    rateLimiter.schedule("limited", T0);

    final Instant later = T0.plusSeconds(60);
    assertThat(rateLimiter.schedule("limited", later)).contains(later);
    assertThat(rateLimiter.schedule("limited", later)).contains(later.plus(DELTA));
  }

  @Test
  void redefiningStartsAFreshChain() {
    rateLimiter.define("limited", new RateLimitPolicy(DELTA, MAX_AGE));
    rateLimiter.schedule("limited", T0);
    rateLimiter.schedule("limited", T0);

    rateLimiter.define("limited", new RateLimitPolicy(Duration.ofSeconds(1), MAX_AGE));

    assertThat(rateLimiter.schedule("limited", T0)).contains(T0);
    assertThat(rateLimiter.policyFor("limited"))
        .contains(new RateLimitPolicy(Duration.ofSeconds(1), MAX_AGE));
  }

  @Test
  void timerBeyondTheChainKeepsItsInstantAndLeavesTheChainAlone() {
    rateLimiter.define("limited", new RateLimitPolicy(DELTA, MAX_AGE));
    final Instant inAnHour = T0.plus(Duration.ofHours(1));

    assertThat(rateLimiter.scheduleTimer("limited", inAnHour)).contains(inAnHour);
    assertThat(rateLimiter.schedule("limited", T0)).contains(T0);
    assertThat(rateLimiter.schedule("limited", T0)).contains(T0.plus(DELTA));
    assertThat(rateLimiter.scheduleTimer("free", inAnHour)).isEmpty();
  }

  @Test
  void timerInsideTheChainTakesTheNextSlot() {
    rateLimiter.define("limited", new RateLimitPolicy(DELTA, MAX_AGE));
    rateLimiter.schedule("limited", T0);
    rateLimiter.schedule("limited", T0);

    assertThat(rateLimiter.scheduleTimer("limited", T0.plusMillis(50)))
        .contains(T0.plus(DELTA.multipliedBy(2)));
    assertThat(rateLimiter.schedule("limited", T0)).contains(T0.plus(DELTA.multipliedBy(3)));
  }

  @Test
  void releasedNewestSlotIsHandedOutAgain() {
    rateLimiter.define("limited", new RateLimitPolicy(DELTA, MAX_AGE));
    rateLimiter.schedule("limited", T0);
    final Instant second = rateLimiter.schedule("limited", T0).orElseThrow();

    rateLimiter.release("limited", second);

    assertThat(rateLimiter.schedule("limited", T0)).contains(second);
  }

  @Test
  void releasingAnOlderSlotKeepsTheChain() {
    rateLimiter.define("limited", new RateLimitPolicy(DELTA, MAX_AGE));
    final Instant first = rateLimiter.schedule("limited", T0).orElseThrow();
    rateLimiter.schedule("limited", T0);

    rateLimiter.release("limited", first);
    rateLimiter.release("free", T0);

    assertThat(rateLimiter.schedule("limited", T0)).contains(T0.plus(DELTA.multipliedBy(2)));
  }

  @Test
  void jobIsStaleOnlyWhenItWaitedPastItsSlotForLongerThanMaxAge() {
    rateLimiter.define("limited", new RateLimitPolicy(DELTA, MAX_AGE));
    final JobRecord scheduled = job("limited", T0);

    assertThat(rateLimiter.isStale(scheduled, T0.plus(MAX_AGE))).isFalse();
    assertThat(rateLimiter.isStale(scheduled, T0.plus(MAX_AGE).plusMillis(1))).isTrue();
    assertThat(rateLimiter.isStale(job("limited", null), T0.plusSeconds(60))).isFalse();
    assertThat(rateLimiter.isStale(job("free", T0), T0.plusSeconds(60))).isFalse();
  }

  @Test
  void policyRequiresPositiveDurations() {
    assertThatThrownBy(() -> new RateLimitPolicy(Duration.ZERO, MAX_AGE))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RateLimitPolicy(DELTA, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private JobRecord job(String type, Instant scheduledAt) {
    return JobRecord.pending(JobKind.EVENT, Event.of(type, null, null), scheduledAt, 4, T0);
  }
}
