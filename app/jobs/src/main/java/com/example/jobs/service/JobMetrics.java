/*
 * Where: jobs service layer
 * What: dispatch outcomes, dispatch delay, backlog and notification deliveries as Micrometer meters
 * Why: retries and exhausted jobs never reach the raiser, so they have to be observable from outside
 */
package com.example.jobs.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class JobMetrics {

  public enum DispatchResult {
    SUCCEEDED,
    RETRY,
    FAILED,
    UNKNOWN_TYPE,
    REANCHORED;

    String tagValue() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private static final String METRIC_DISPATCH_TOTAL = "jobs.dispatch.total";
  private static final String METRIC_DISPATCH_DELAY = "jobs.dispatch.delay";
  private static final String METRIC_BACKLOG_CURRENT = "jobs.backlog.current";
  private static final String METRIC_NOTIFICATION_DELIVERED_TOTAL =
      "jobs.notification.delivered.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<DispatchResult, Counter> dispatchCounters = new ConcurrentHashMap<>();
  private final Counter notificationDeliveredCounter;
  private final Timer dispatchDelayTimer;

  public JobMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of pending or claimed jobs")
        .register(meterRegistry);
    this.notificationDeliveredCounter =
        Counter.builder(METRIC_NOTIFICATION_DELIVERED_TOTAL)
            .description("Total number of notification handler invocations")
            .register(meterRegistry);
    this.dispatchDelayTimer =
        Timer.builder(METRIC_DISPATCH_DELAY)
            .description("Delay between the time a job became eligible and the start of its attempt")
            .register(meterRegistry);
  }

  public void recordDispatchResult(DispatchResult result) {
    dispatchCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DISPATCH_TOTAL)
                    .description("Job dispatch outcomes")
                    .tags(Tags.of("result", result.tagValue()))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDispatchDelay(Instant eligibleAt, Instant startedAt) {
    if (eligibleAt == null || startedAt == null || startedAt.isBefore(eligibleAt)) {
      return;
    }
    dispatchDelayTimer.record(Duration.between(eligibleAt, startedAt));
  }

  public void recordNotificationDelivered(int count) {
    if (count > 0) {
      notificationDeliveredCounter.increment(count);
    }
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }
}
