/*
 * Where: jobs domain model
 * What: producer-facing event and the view a handler receives
 * Why: producers raise events without knowing about job rows
 */
package com.example.jobs.model;

import java.time.Instant;
import java.util.UUID;

/**
 * An event raised by a producer.
 *
 * <p>{@code scheduledAt}, {@code jobId} and {@code attemptsLeft} are filled in by the engine when
 * the event is delivered; producers leave them empty. {@code scheduledAt} stays null for a first
 * attempt that was never rate limited.
 */
public record Event(
    String type,
    String resource,
    UUID resourceId,
    String payloadJson,
    Instant scheduledAt,
    UUID jobId,
    int attemptsLeft) {

  public static Event of(String type, String resource, UUID resourceId) {
    return new Event(type, resource, resourceId, null, null, null, 0);
  }

  public Event withPayload(String payloadJson) {
    return new Event(type, resource, resourceId, payloadJson, scheduledAt, jobId, attemptsLeft);
  }
}
