/*
 * Where: jobs service layer
 * What: the entry point producers and handlers use; enqueue, register, rate limit, process, health
 * Why: callers work with events and never touch job rows, the dispatcher or the trigger directly
 */
package com.example.jobs.service;

import com.example.jobs.model.Event;
import com.example.jobs.model.JobHealth;
import com.example.jobs.model.JobKind;
import com.example.jobs.model.JobRecord;
import com.example.jobs.model.RateLimitPolicy;
import com.example.jobs.repository.JobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Durable, at-least-once event processing.
 *
 * <p>{@link #raiseEvent(Event)} persists a job and wakes the pipeline; the job is deleted once its
 * handler returns normally. A handler may therefore run more than once for one raise (a crash
 * between the handler and the delete, or an expired lease), so handlers must be idempotent.
 */
@Service
public class JobEngine {

  private static final Logger logger = LoggerFactory.getLogger(JobEngine.class);

  private final JobRepository jobRepository;
  private final JobHandlerRegistry handlers;
  private final RateLimiter rateLimiter;
  private final JobDispatcher dispatcher;
  private final JobTrigger trigger;
  private final JobHealthService healthService;
  private final BackoffPolicy defaultBackoff;
  private final Clock clock;

  public JobEngine(
      JobRepository jobRepository,
      JobHandlerRegistry handlers,
      RateLimiter rateLimiter,
      JobDispatcher dispatcher,
      JobTrigger trigger,
      JobHealthService healthService,
      BackoffPolicy defaultBackoff,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.handlers = handlers;
    this.rateLimiter = rateLimiter;
    this.dispatcher = dispatcher;
    this.trigger = trigger;
    this.healthService = healthService;
    this.defaultBackoff = defaultBackoff;
    this.clock = clock;
  }

  /**
   * Enqueues {@code event} for immediate processing, or for its next slot when the type is rate
   * limited.
   */
  public UUID raiseEvent(Event event) {
    requireType(event);
    final Instant now = Instant.now(clock);
    final Instant scheduledAt = rateLimiter.schedule(event.type(), now).orElse(null);
    return enqueue(JobKind.EVENT, event, scheduledAt, now);
  }

  /**
   * Enqueues {@code event} to run no earlier than {@code at}. A rate limited timer only takes a
   * slot of its type when {@code at} falls inside the type's current chain.
   */
  public UUID raiseEventAt(Event event, Instant at) {
    requireType(event);
    Objects.requireNonNull(at, "at");
    final Instant now = Instant.now(clock);
    final Instant scheduledAt = rateLimiter.scheduleTimer(event.type(), at).orElse(at);
    return enqueue(JobKind.TIMER, event, scheduledAt, now);
  }

  public void handleEvent(String eventType, JobHandler handler) {
    handlers.register(requireType(eventType), handler);
  }

  /**
   * Spaces consecutive dispatches of {@code eventType} by at least {@code delta}. A job that waited
   * past its slot for longer than {@code maxAge} is rescheduled from the current time instead of
   * being run late.
   */
  public void defineRateLimitForEvent(String eventType, Duration delta, Duration maxAge) {
    rateLimiter.define(requireType(eventType), new RateLimitPolicy(delta, maxAge));
    logger.info("rate limit defined type={} delta={} maxAge={}", eventType, delta, maxAge);
  }

  /** Wakes the background pipeline; returns without waiting for any job. */
  public void processJobs() {
    trigger.fire();
  }

  /**
   * Processes due jobs on the calling thread with the configured backoff.
   *
   * @param maxCount maximum number of handler invocations, {@code -1} for all currently due jobs
   * @return number of handler invocations
   */
  public int processJobsSync(int maxCount) {
    return dispatcher.processSync(maxCount, defaultBackoff);
  }

  /** Same as {@link #processJobsSync(int)} with the given retry delays for failures in this call. */
  public int processJobsSync(int maxCount, List<Duration> backoff) {
    return dispatcher.processSync(maxCount, new BackoffPolicy(backoff));
  }

  public JobHealth health(boolean includeDetails) {
    return healthService.health(includeDetails);
  }

  private UUID enqueue(JobKind kind, Event event, Instant scheduledAt, Instant now) {
    final JobRecord record =
        JobRecord.pending(kind, event, scheduledAt, defaultBackoff.maxAttempts(), now);
    try {
      jobRepository.insert(record);
    } catch (RuntimeException ex) {
      rateLimiter.release(record.type(), scheduledAt);
      throw ex;
    }
    logger.debug(
        "job enqueued id={} job={} type={} scheduledAt={}",
        record.jobId(),
        kind.columnValue(),
        record.type(),
        scheduledAt);
    fireAfterCommit(record.type(), scheduledAt);
    return record.jobId();
  }

  private void fireAfterCommit(String eventType, Instant scheduledAt) {
    // a round started before the commit would not see the new row
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              trigger.fire();
            }

            @Override
            public void afterCompletion(int status) {
              if (status == STATUS_ROLLED_BACK) {
                rateLimiter.release(eventType, scheduledAt);
              }
            }
          });
      return;
    }
    trigger.fire();
  }

  private static String requireType(Event event) {
    Objects.requireNonNull(event, "event");
    return requireType(event.type());
  }

  private static String requireType(String eventType) {
    if (eventType == null || eventType.isBlank()) {
      throw new IllegalArgumentException("event type is required");
    }
    return eventType;
  }
}
