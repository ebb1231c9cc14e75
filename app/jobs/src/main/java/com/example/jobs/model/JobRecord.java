/*
 * Where: jobs domain model
 * What: snapshot of one row of the jobs table
 * Why: shared by the store, the dispatcher and the health reporter
 */
package com.example.jobs.model;

import java.time.Instant;
import java.util.UUID;

public record JobRecord(
    UUID jobId,
    JobKind kind,
    String type,
    String resource,
    UUID resourceId,
    String payloadJson,
    JobStatus status,
    Instant scheduledAt,
    int attemptsLeft,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    String lastError,
    Instant createdAt) {

  public static JobRecord pending(
      JobKind kind, Event event, Instant scheduledAt, int attemptsLeft, Instant createdAt) {
    return new JobRecord(
        UUID.randomUUID(),
        kind,
        event.type(),
        event.resource(),
        event.resourceId(),
        event.payloadJson(),
        JobStatus.PENDING,
        scheduledAt,
        attemptsLeft,
        null,
        null,
        null,
        null,
        createdAt);
  }

  /** The event as handed to a handler, carrying the schedule this attempt was dispatched for. */
  public Event toEvent() {
    return new Event(type, resource, resourceId, payloadJson, scheduledAt, jobId, attemptsLeft);
  }
}
