/*
 * Where: jobs API model
 * What: response of the health endpoint
 * Why: fixes the JSON layout independently of the domain records
 */
package com.example.jobs.api;

import com.example.jobs.model.JobHealth;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobHealthResponse(
    String status, int pendingCount, int failedCount, List<JobHealthItem> details) {

  public JobHealthResponse {
    // SpotBugs EI_EXPOSE_REP: keep an unmodifiable copy
    details =
        details == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(details));
  }

  static JobHealthResponse from(JobHealth health) {
    return new JobHealthResponse(
        health.status().name(),
        health.pendingCount(),
        health.failedCount(),
        health.details().stream().map(JobHealthItem::from).toList());
  }
}
