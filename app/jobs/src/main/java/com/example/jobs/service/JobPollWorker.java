/*
 * Where: jobs pipeline worker
 * What: fires the local trigger on a fixed delay
 * Why: retries and rate limited slots become due without any new raise to wake the loop
 */
package com.example.jobs.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "jobs.pipeline.enabled", havingValue = "true", matchIfMissing = true)
public class JobPollWorker {

  private final LocalJobTrigger trigger;

  @Scheduled(fixedDelayString = "${jobs.pipeline.poll-interval}")
  public void run() {
    trigger.fire();
  }
}
