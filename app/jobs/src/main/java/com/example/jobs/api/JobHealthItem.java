package com.example.jobs.api;

import com.example.jobs.model.JobHealthDetail;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobHealthItem(
    UUID jobId,
    String job,
    String type,
    String resource,
    UUID resourceId,
    String status,
    int attemptsLeft,
    Instant scheduledAt,
    Instant createdAt,
    String lastError) {

  static JobHealthItem from(JobHealthDetail detail) {
    return new JobHealthItem(
        detail.jobId(),
        detail.job().columnValue(),
        detail.type(),
        detail.resource(),
        detail.resourceId(),
        detail.status().name(),
        detail.attemptsLeft(),
        detail.scheduledAt(),
        detail.createdAt(),
        detail.lastError());
  }
}
