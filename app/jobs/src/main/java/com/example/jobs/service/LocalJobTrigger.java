/*
 * Where: jobs service layer
 * What: single background thread fed by a signal queue of depth one
 * Why: any number of wake-up requests during a round collapse into at most one follow-up round
 */
package com.example.jobs.service;

import com.example.jobs.config.JobPipelineProperties;
import com.google.common.annotations.VisibleForTesting;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
public class LocalJobTrigger implements JobTrigger, SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(LocalJobTrigger.class);
  private static final Object SIGNAL = new Object();
  private static final long STOP_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(15);

  private final BlockingQueue<Object> signals = new ArrayBlockingQueue<>(1);
  private final JobDispatcher dispatcher;
  private final BackoffPolicy backoff;
  private final JobPipelineProperties properties;
  private volatile Thread loop;

  public LocalJobTrigger(
      JobDispatcher dispatcher, BackoffPolicy backoff, JobPipelineProperties properties) {
    this.dispatcher = dispatcher;
    this.backoff = backoff;
    this.properties = properties;
  }

  @Override
  public void fire() {
    if (loop == null) {
      logger.debug("job trigger ignored because the pipeline loop is not running");
      return;
    }
    // offer on a full queue is the coalescing: one pending signal is enough
    signals.offer(SIGNAL);
  }

  @Override
  public synchronized void start() {
    if (loop != null) {
      return;
    }
    if (!properties.enabled()) {
      logger.info("job pipeline loop disabled; jobs run only through processJobsSync");
      return;
    }
    final Thread thread = new Thread(this::runLoop, "job-trigger");
    thread.setDaemon(true);
    loop = thread;
    thread.start();
    logger.info(
        "job pipeline loop started concurrency={} backoff={}", properties.concurrency(), backoff);
  }

  @Override
  public synchronized void stop() {
    final Thread thread = loop;
    if (thread == null) {
      return;
    }
    loop = null;
    thread.interrupt();
    try {
      thread.join(STOP_TIMEOUT_MILLIS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    signals.clear();
    logger.info("job pipeline loop stopped");
  }

  @Override
  public boolean isRunning() {
    return loop != null;
  }

  private void runLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        signals.take();
        drain();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      } catch (RuntimeException ex) {
        // a storage outage must not kill the loop; the next signal retries
        logger.error("job processing round failed", ex);
      }
    }
  }

  @VisibleForTesting
  void drain() {
    final int limit = properties.concurrency();
    RoundResult result;
    do {
      result = dispatcher.processRound(limit, backoff, true);
    } while (result.claimed() >= limit && !Thread.currentThread().isInterrupted());
  }
}
