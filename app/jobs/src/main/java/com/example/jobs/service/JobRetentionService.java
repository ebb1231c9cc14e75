/*
 * Where: jobs service layer
 * What: deletes terminally failed jobs past the retention window
 * Why: failed rows stay for inspection but must not accumulate forever; old active rows point at a stuck pipeline
 */
package com.example.jobs.service;

import com.example.jobs.config.JobRetentionProperties;
import com.example.jobs.repository.JobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(JobRetentionService.class);

  private final JobRepository jobRepository;
  private final JobRetentionProperties properties;
  private final Clock clock;

  public int cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int staleActiveCount = jobRepository.countStaleActive(threshold);
    if (staleActiveCount > 0) {
      logger.error(
          "job retention found stale active jobs count={} threshold={}",
          staleActiveCount,
          threshold);
    }
    final int deleted = jobRepository.deleteFailedOlderThan(threshold);
    logger.info("job retention cleanup deleted failedJobs={} threshold={}", deleted, threshold);
    return deleted;
  }
}
