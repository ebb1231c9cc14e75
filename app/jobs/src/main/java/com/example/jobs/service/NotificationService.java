/*
 * Where: jobs notification fan-out
 * What: synchronous delivery of resource mutations to registered listeners
 * Why: listeners react inside the mutating call, so they see every change in order
 */
package com.example.jobs.service;

import com.example.jobs.model.Notification;
import com.example.jobs.model.Operation;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

  private final List<NotificationRegistration> registrations = new CopyOnWriteArrayList<>();
  private final JobMetrics metrics;

  /**
   * Registers {@code handler} for mutations with {@code operation} and {@code state} on {@code
   * resourcePath} or any resource nested under it. Registering the same handler twice delivers
   * twice.
   */
  public NotificationRegistration requestNotification(
      String resourcePath, Operation operation, String state, NotificationHandler handler) {
    if (resourcePath == null || resourcePath.isBlank()) {
      throw new IllegalArgumentException("resource path is required");
    }
    final NotificationRegistration registration =
        new NotificationRegistration(resourcePath, operation, state, handler);
    registrations.add(registration);
    logger.debug("notification registered {}", registration);
    return registration;
  }

  /**
   * Delivers one mutation to every matching registration on the calling thread.
   *
   * @return number of handlers invoked
   */
  public int notify(String resource, Operation operation, String state, byte[] payload) {
    final Notification notification = new Notification(resource, operation, state, payload);
    int delivered = 0;
    // the list iterator is a snapshot, so handlers may register or remove while we deliver
    for (NotificationRegistration registration : registrations) {
      if (!registration.matches(
          notification.resource(), notification.operation(), notification.state())) {
        continue;
      }
      delivered++;
      try {
        final boolean result = registration.handler().handle(notification);
        logger.debug(
            "notification delivered resource={} operation={} result={}",
            resource,
            operation,
            result);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        logger.warn(
            "notification handler interrupted resource={} operation={}", resource, operation, ex);
      } catch (Exception ex) {
        logger.warn(
            "notification handler failed resource={} operation={} state={}",
            resource,
            operation,
            notification.state(),
            ex);
      }
    }
    metrics.recordNotificationDelivered(delivered);
    return delivered;
  }

  /** Removes every registration of {@code handler}, compared by identity. */
  public int removeNotificationHandler(NotificationHandler handler) {
    final List<NotificationRegistration> removed = new ArrayList<>();
    for (NotificationRegistration registration : registrations) {
      if (registration.handler() == handler) {
        removed.add(registration);
      }
    }
    int count = 0;
    for (NotificationRegistration registration : removed) {
      if (registrations.remove(registration)) {
        count++;
      }
    }
    return count;
  }

  public boolean removeNotification(NotificationRegistration registration) {
    return registrations.remove(registration);
  }
}
