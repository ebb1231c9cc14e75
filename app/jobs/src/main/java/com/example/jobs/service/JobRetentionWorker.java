package com.example.jobs.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "jobs.retention.enabled", havingValue = "true")
public class JobRetentionWorker {

  private final JobRetentionService retentionService;

  @Scheduled(fixedDelayString = "${jobs.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
