/*
 * Where: jobs NATS relay
 * What: fires the local trigger and publishes a wake-up that other instances turn into their own round
 * Why: instances sharing the jobs table start on new work without waiting for their next poll
 */
package com.example.jobs.nats;

import com.example.jobs.config.JobNatsProperties;
import com.example.jobs.service.JobTrigger;
import com.example.jobs.service.LocalJobTrigger;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Component
@Primary
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true")
public class NatsJobTriggerRelay implements JobTrigger {

  private static final Logger logger = LoggerFactory.getLogger(NatsJobTriggerRelay.class);

  private final Connection connection;
  private final LocalJobTrigger localTrigger;
  private final JobNatsProperties properties;
  private final byte[] origin;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private Dispatcher dispatcher;

  public NatsJobTriggerRelay(
      Connection connection, LocalJobTrigger localTrigger, JobNatsProperties properties) {
    this.connection = connection;
    this.localTrigger = localTrigger;
    this.properties = properties;
    this.origin = UUID.randomUUID().toString().getBytes(StandardCharsets.UTF_8);
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      dispatcher = connection.createDispatcher(this::handleMessage);
      dispatcher.subscribe(properties.triggerSubject());
    } catch (IllegalStateException | IllegalArgumentException ex) {
      started.set(false);
      throw new IllegalStateException("failed to subscribe to job trigger subject", ex);
    }
    logger.info("job trigger relay started subject={}", properties.triggerSubject());
  }

  @PreDestroy
  public void stop() {
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
    started.set(false);
  }

  @Override
  public void fire() {
    localTrigger.fire();
    try {
      connection.publish(properties.triggerSubject(), origin);
    } catch (IllegalStateException ex) {
      // the poll still picks the job up on the other instances
      logger.warn("failed to publish job trigger subject={}", properties.triggerSubject(), ex);
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    if (Arrays.equals(origin, message.getData())) {
      return;
    }
    logger.debug("job trigger received subject={}", message.getSubject());
    localTrigger.fire();
  }
}
