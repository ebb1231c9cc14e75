/*
 * Where: jobs service layer
 * What: claims due jobs, runs their handlers and completes, retries or fails them
 * Why: one place owns the job state machine so the continuous and synchronous modes behave the same
 */
package com.example.jobs.service;

import com.example.common.TraceIds;
import com.example.jobs.config.JobPipelineConfig;
import com.example.jobs.config.JobPipelineProperties;
import com.example.jobs.model.JobRecord;
import com.example.jobs.repository.JobRepository;
import com.example.jobs.service.JobMetrics.DispatchResult;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs processing rounds against the jobs table.
 *
 * <p>A round claims up to {@code limit} due jobs (never more than the pipeline concurrency) and
 * handles each of them:
 *
 * <ul>
 *   <li>a rate limited job that waited past its slot for longer than the policy's max age is not
 *       run; it gets a fresh slot computed from the current time;
 *   <li>otherwise its handler runs; success deletes the row, a failure consumes one attempt and
 *       reschedules the job at the later of its backoff delay and its next rate limit slot, and the
 *       failure of the last attempt leaves the row as FAILED for inspection.
 * </ul>
 *
 * <p>Rounds of one dispatcher never overlap. Handlers run in parallel on the worker pool or, in
 * synchronous mode, one after another on the calling thread. Storage errors propagate to the
 * caller; jobs finished before the error stay finished and jobs still claimed are picked up again
 * when their lease expires. Handlers are not timed out: a hanging handler keeps its worker busy.
 * Picking up a job after its lease expired costs it one attempt, and a job whose lease expires on
 * its last attempt is marked FAILED at the start of the next round.
 */
@Service
public class JobDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(JobDispatcher.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final String MDC_JOB_ID = "job_id";
  private static final String MDC_JOB_TYPE = "job_type";
  private static final String LEASE_EXPIRED_ERROR = "lease expired on last attempt";

  private final JobRepository jobRepository;
  private final JobHandlerRegistry handlers;
  private final RateLimiter rateLimiter;
  private final JobMetrics metrics;
  private final JobPipelineProperties properties;
  private final Clock clock;
  private final Executor workerExecutor;
  private final ReentrantLock roundLock = new ReentrantLock();
  private final String lockedBy;

  public JobDispatcher(
      JobRepository jobRepository,
      JobHandlerRegistry handlers,
      RateLimiter rateLimiter,
      JobMetrics metrics,
      JobPipelineProperties properties,
      Clock clock,
      @Qualifier(JobPipelineConfig.JOB_WORKER_EXECUTOR) Executor workerExecutor) {
    this.jobRepository = jobRepository;
    this.handlers = handlers;
    this.rateLimiter = rateLimiter;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
    this.workerExecutor = workerExecutor;
    // several dispatchers may share a host, so the owner id carries an instance suffix
    this.lockedBy = resolveHostname() + "/" + UUID.randomUUID().toString().substring(0, 8);
  }

  /**
   * Runs rounds on the calling thread until nothing due is left or {@code maxCount} handlers have
   * been invoked.
   *
   * @param maxCount maximum number of handler invocations, {@code -1} for all currently due jobs
   * @return number of handler invocations
   */
  public int processSync(int maxCount, BackoffPolicy backoff) {
    if (maxCount == 0 || maxCount < -1) {
      return 0;
    }
    final int concurrency = properties.concurrency();
    int invoked = 0;
    while (maxCount < 0 || invoked < maxCount) {
      final int limit = maxCount < 0 ? concurrency : Math.min(concurrency, maxCount - invoked);
      final RoundResult result = processRound(limit, backoff, false);
      invoked += result.invoked();
      if (result.claimed() == 0) {
        break;
      }
    }
    return invoked;
  }

  public RoundResult processRound(int limit, BackoffPolicy backoff, boolean parallel) {
    final int batchSize = Math.min(limit, properties.concurrency());
    if (batchSize <= 0) {
      return RoundResult.EMPTY;
    }
    roundLock.lock();
    try {
      final Instant now = Instant.now(clock);
      failExpiredLeases(now);
      // claim in a single statement; handler IO never runs inside a database transaction
      final List<JobRecord> claimed =
          jobRepository.claimDue(batchSize, now, now.plus(properties.lease()), lockedBy);
      if (claimed.isEmpty()) {
        return RoundResult.EMPTY;
      }
      int invoked = 0;
      final List<CompletableFuture<Void>> running = new ArrayList<>();
      for (JobRecord job : claimed) {
        if (rateLimiter.isStale(job, now)) {
          reanchor(job);
          continue;
        }
        invoked++;
        if (parallel) {
          running.add(CompletableFuture.runAsync(() -> execute(job, backoff), workerExecutor));
        } else {
          execute(job, backoff);
        }
      }
      awaitAll(running);
      return new RoundResult(claimed.size(), invoked);
    } finally {
      roundLock.unlock();
    }
  }

  @VisibleForTesting
  String lockedBy() {
    return lockedBy;
  }

  private void execute(JobRecord job, BackoffPolicy backoff) {
    MDC.put(MDC_JOB_ID, job.jobId().toString());
    MDC.put(MDC_JOB_TYPE, job.type());
    final boolean traceCreated = TraceIds.putIfAbsent();
    try {
      final Instant startedAt = Instant.now(clock);
      metrics.recordDispatchDelay(
          job.scheduledAt() != null ? job.scheduledAt() : job.createdAt(), startedAt);
      final JobHandler handler = handlers.find(job.type()).orElse(null);
      if (handler == null) {
        logger.error(
            "no job handler registered id={} type={} attemptsLeft={}",
            job.jobId(),
            job.type(),
            job.attemptsLeft());
        metrics.recordDispatchResult(DispatchResult.UNKNOWN_TYPE);
        handleFailure(job, "no handler registered for type " + job.type(), null, backoff);
        return;
      }
      try {
        handler.handle(job.toEvent());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        handleFailure(job, ex.getMessage(), ex, backoff);
        return;
      } catch (Exception ex) {
        handleFailure(job, ex.getMessage(), ex, backoff);
        return;
      }
      final int updated = jobRepository.complete(job.jobId(), lockedBy);
      if (updated == 0) {
        logger.warn("job succeeded but lock was lost id={} type={}", job.jobId(), job.type());
      }
      metrics.recordDispatchResult(DispatchResult.SUCCEEDED);
    } finally {
      MDC.remove(MDC_JOB_ID);
      MDC.remove(MDC_JOB_TYPE);
      if (traceCreated) {
        MDC.remove(TraceIds.MDC_KEY);
      }
    }
  }

  @VisibleForTesting
  void handleFailure(JobRecord job, String message, Exception cause, BackoffPolicy backoff) {
    final Instant now = Instant.now(clock);
    final int remaining = job.attemptsLeft() - 1;
    final String error = truncateError(message);
    if (remaining <= 0) {
      final int updated = jobRepository.markFailed(job.jobId(), error, lockedBy);
      if (updated == 0) {
        logger.warn(
            "job failure skipped because lock was lost id={} type={}", job.jobId(), job.type());
        return;
      }
      metrics.recordDispatchResult(DispatchResult.FAILED);
      logger.warn(
          "job failed permanently id={} type={} error={}", job.jobId(), job.type(), error, cause);
      return;
    }
    final Instant backoffAt = now.plus(backoff.delayAfterFailure(job.attemptsLeft()));
    // the rate limit slot is never earlier than backoffAt, so this is the later of the two
    final Instant retryAt = rateLimiter.schedule(job.type(), backoffAt).orElse(backoffAt);
    final int updated =
        jobRepository.reschedule(job.jobId(), retryAt, remaining, error, lockedBy);
    if (updated == 0) {
      logger.warn(
          "job retry skipped because lock was lost id={} type={}", job.jobId(), job.type());
      return;
    }
    metrics.recordDispatchResult(DispatchResult.RETRY);
    logger.warn(
        "job retry scheduled id={} type={} attemptsLeft={} retryAt={}",
        job.jobId(),
        job.type(),
        remaining,
        retryAt,
        cause);
  }

  private void failExpiredLeases(Instant now) {
    final int expired = jobRepository.failExpiredLeases(now, LEASE_EXPIRED_ERROR);
    if (expired == 0) {
      return;
    }
    for (int i = 0; i < expired; i++) {
      metrics.recordDispatchResult(DispatchResult.FAILED);
    }
    logger.warn("jobs failed permanently after lease expired on last attempt count={}", expired);
  }

  private void reanchor(JobRecord job) {
    final Instant now = Instant.now(clock);
    final Instant slot = rateLimiter.schedule(job.type(), now).orElse(now);
    final int updated = jobRepository.reanchor(job.jobId(), slot, lockedBy);
    if (updated == 0) {
      logger.warn(
          "stale job reschedule skipped because lock was lost id={} type={}",
          job.jobId(),
          job.type());
      return;
    }
    metrics.recordDispatchResult(DispatchResult.REANCHORED);
    logger.info(
        "stale rate limited job rescheduled id={} type={} previousSlot={} slot={}",
        job.jobId(),
        job.type(),
        job.scheduledAt(),
        slot);
  }

  private void awaitAll(List<CompletableFuture<Void>> running) {
    if (running.isEmpty()) {
      return;
    }
    try {
      CompletableFuture.allOf(running.toArray(CompletableFuture[]::new)).join();
    } catch (CompletionException ex) {
      // allOf completes only after every job finished; surface the first storage error
      if (ex.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw ex;
    }
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private String resolveHostname() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
