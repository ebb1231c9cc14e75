/*
 * Where: jobs notification fan-out
 * What: one listener bound to a resource path, an operation and a state
 * Why: the handle returned to callers identifies exactly one registration, even for duplicate filters
 */
package com.example.jobs.service;

import com.example.jobs.model.Operation;
import java.util.Objects;

public final class NotificationRegistration {

  private static final char PATH_SEPARATOR = '/';

  private final String resourcePath;
  private final Operation operation;
  private final String state;
  private final NotificationHandler handler;

  NotificationRegistration(
      String resourcePath, Operation operation, String state, NotificationHandler handler) {
    this.resourcePath = Objects.requireNonNull(resourcePath, "resourcePath");
    this.operation = Objects.requireNonNull(operation, "operation");
    this.state = state == null ? "" : state;
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  public String resourcePath() {
    return resourcePath;
  }

  public Operation operation() {
    return operation;
  }

  public String state() {
    return state;
  }

  NotificationHandler handler() {
    return handler;
  }

  /**
   * True for the same operation, the same state and a resource equal to the registered path or
   * nested under it ({@code single} matches {@code notification/single}).
   */
  boolean matches(String resource, Operation operation, String state) {
    if (this.operation != operation || !this.state.equals(state)) {
      return false;
    }
    if (resource.equals(resourcePath)) {
      return true;
    }
    return resource.endsWith(resourcePath)
        && resource.charAt(resource.length() - resourcePath.length() - 1) == PATH_SEPARATOR;
  }

  @Override
  public String toString() {
    return "NotificationRegistration[resourcePath=" + resourcePath + ", operation=" + operation
        + ", state=" + state + "]";
  }
}
