/*
 * Where: jobs domain model
 * What: one resource mutation delivered to notification listeners
 * Why: listeners see the same shape whichever path they registered on
 */
package com.example.jobs.model;

import java.util.Arrays;
import java.util.Objects;

public record Notification(String resource, Operation operation, String state, byte[] payload) {

  public Notification {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(operation, "operation");
    state = state == null ? "" : state;
    // SpotBugs EI_EXPOSE_REP: keep a private copy of the payload
    payload = payload == null ? new byte[0] : Arrays.copyOf(payload, payload.length);
  }

  @Override
  public byte[] payload() {
    return Arrays.copyOf(payload, payload.length);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Notification that)) {
      return false;
    }
    return resource.equals(that.resource)
        && operation == that.operation
        && state.equals(that.state)
        && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    int result = resource.hashCode();
    result = 31 * result + operation.hashCode();
    result = 31 * result + state.hashCode();
    return 31 * result + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "Notification[resource=" + resource + ", operation=" + operation + ", state=" + state
        + ", payloadBytes=" + payload.length + "]";
  }
}
