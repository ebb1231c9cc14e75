/*
 * Where: jobs domain model
 * What: queue depth and per-job retry state at one point in time
 * Why: exhausted jobs are only ever surfaced here, never thrown
 */
package com.example.jobs.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record JobHealth(Status status, int pendingCount, int failedCount, List<JobHealthDetail> details) {

  public enum Status {
    UP,
    DEGRADED
  }

  public JobHealth {
    details =
        details == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(details));
  }

  public static JobHealth of(int pendingCount, int failedCount, List<JobHealthDetail> details) {
    final Status status = failedCount == 0 ? Status.UP : Status.DEGRADED;
    return new JobHealth(status, pendingCount, failedCount, details);
  }
}
