package com.example.jobs.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.jobs.service.JobMetrics.DispatchResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class JobMetricsTest {

  @Test
  void recordsDispatchBacklogAndNotificationMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final JobMetrics metrics = new JobMetrics(registry);

    final Instant eligibleAt = Instant.parse("2026-03-01T00:00:00Z");
    final Instant startedAt = Instant.parse("2026-03-01T00:00:02Z");

    metrics.recordDispatchResult(DispatchResult.SUCCEEDED);
    metrics.recordDispatchResult(DispatchResult.RETRY);
    metrics.recordDispatchResult(DispatchResult.RETRY);
    metrics.recordDispatchResult(DispatchResult.UNKNOWN_TYPE);
    metrics.recordDispatchDelay(eligibleAt, startedAt);
    metrics.recordNotificationDelivered(3);
    metrics.updateBacklogCurrent(7);

    final Counter succeeded =
        registry.get("jobs.dispatch.total").tag("result", "succeeded").counter();
    final Counter retry = registry.get("jobs.dispatch.total").tag("result", "retry").counter();
    final Counter unknown =
        registry.get("jobs.dispatch.total").tag("result", "unknown_type").counter();
    final Timer delay = registry.get("jobs.dispatch.delay").timer();
    final Counter delivered = registry.get("jobs.notification.delivered.total").counter();
    final Gauge backlog = registry.get("jobs.backlog.current").gauge();

    assertThat(succeeded.count()).isEqualTo(1.0d);
    assertThat(retry.count()).isEqualTo(2.0d);
    assertThat(unknown.count()).isEqualTo(1.0d);
    assertThat(delay.count()).isEqualTo(1L);
    assertThat(delay.totalTime(TimeUnit.SECONDS)).isEqualTo(2.0d);
    assertThat(delivered.count()).isEqualTo(3.0d);
    assertThat(backlog.value()).isEqualTo(7.0d);
  }

  @Test
  void ignoresDelayBeforeEligibilityAndNegativeBacklog() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final JobMetrics metrics = new JobMetrics(registry);
    final Instant now = Instant.parse("2026-03-01T00:00:00Z");

    metrics.recordDispatchDelay(now.plusSeconds(1), now);
    metrics.recordDispatchDelay(null, now);
    metrics.updateBacklogCurrent(-1);

    assertThat(registry.get("jobs.dispatch.delay").timer().count()).isZero();
    assertThat(registry.get("jobs.backlog.current").gauge().value()).isZero();
  }
}
