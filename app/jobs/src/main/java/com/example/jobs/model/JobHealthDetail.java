package com.example.jobs.model;

import java.time.Instant;
import java.util.UUID;

public record JobHealthDetail(
    UUID jobId,
    JobKind job,
    String type,
    String resource,
    UUID resourceId,
    JobStatus status,
    int attemptsLeft,
    Instant scheduledAt,
    Instant createdAt,
    String lastError) {

  public static JobHealthDetail from(JobRecord record) {
    return new JobHealthDetail(
        record.jobId(),
        record.kind(),
        record.type(),
        record.resource(),
        record.resourceId(),
        record.status(),
        record.attemptsLeft(),
        record.scheduledAt(),
        record.createdAt(),
        record.lastError());
  }
}
