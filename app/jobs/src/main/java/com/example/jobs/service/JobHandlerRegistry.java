/*
 * Where: jobs service layer
 * What: event type to handler map owned by one engine
 * Why: producers and the dispatcher share the registry without a global
 */
package com.example.jobs.service;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JobHandlerRegistry {

  private static final Logger logger = LoggerFactory.getLogger(JobHandlerRegistry.class);

  private final ConcurrentMap<String, JobHandler> handlers = new ConcurrentHashMap<>();

  public void register(String eventType, JobHandler handler) {
    Objects.requireNonNull(handler, "handler");
    final JobHandler previous = handlers.put(eventType, handler);
    if (previous != null) {
      logger.info("job handler replaced type={}", eventType);
    }
  }

  public Optional<JobHandler> find(String eventType) {
    return Optional.ofNullable(handlers.get(eventType));
  }
}
