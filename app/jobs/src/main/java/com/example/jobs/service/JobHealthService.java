/*
 * Where: jobs service layer
 * What: read-only view of queue depth and per-job retry state
 * Why: exhausted jobs are retained instead of thrown, and this is where operators find them
 */
package com.example.jobs.service;

import com.example.jobs.model.JobHealth;
import com.example.jobs.model.JobHealthDetail;
import com.example.jobs.model.JobStatus;
import com.example.jobs.repository.JobRepository;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobHealthService {

  private final JobRepository jobRepository;
  private final JobMetrics metrics;

  public JobHealth health(boolean includeDetails) {
    final Map<JobStatus, Integer> counts = jobRepository.countByStatus();
    final int pending = counts.get(JobStatus.PENDING) + counts.get(JobStatus.PROCESSING);
    final int failed = counts.get(JobStatus.FAILED);
    metrics.updateBacklogCurrent(pending);
    final List<JobHealthDetail> details =
        includeDetails
            ? jobRepository.findAll().stream().map(JobHealthDetail::from).toList()
            : List.of();
    return JobHealth.of(pending, failed, details);
  }
}
