package com.example.jobs.nats;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.jobs.config.JobNatsProperties;
import com.example.jobs.service.LocalJobTrigger;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NatsJobTriggerRelayTest {

  private static final String SUBJECT = "jobs.trigger";

  @Mock private Connection connection;
  @Mock private LocalJobTrigger localTrigger;
  @Mock private Dispatcher dispatcher;
  @Mock private Message message;

  private NatsJobTriggerRelay relay;

  @BeforeEach
  void setUp() {
    relay = new NatsJobTriggerRelay(connection, localTrigger, new JobNatsProperties(SUBJECT));
  }

  @Test
  void startSubscribesToTriggerSubject() {
    when(connection.createDispatcher(any(MessageHandler.class))).thenReturn(dispatcher);

    relay.start();
    relay.stop();

    verify(dispatcher).subscribe(SUBJECT);
    verify(connection).closeDispatcher(dispatcher);
  }

  @Test
  void fireRunsLocallyAndPublishesWakeUp() {
    relay.fire();

    verify(localTrigger).fire();
    verify(connection).publish(eq(SUBJECT), any(byte[].class));
  }

  @Test
  void publishFailureStillFiresLocally() {
    doThrow(new IllegalStateException("connection closed"))
        .when(connection)
        .publish(eq(SUBJECT), any(byte[].class));

    relay.fire();

    verify(localTrigger).fire();
  }

  @Test
  void wakeUpFromAnotherInstanceFiresLocalTrigger() {
    when(message.getData()).thenReturn("other-instance".getBytes(StandardCharsets.UTF_8));

    relay.handleMessage(message);

    verify(localTrigger).fire();
  }

  @Test
  void ownWakeUpIsIgnored() {
    relay.fire();
    final ArgumentCaptor<byte[]> published = ArgumentCaptor.forClass(byte[].class);
    verify(connection).publish(eq(SUBJECT), published.capture());
    when(message.getData()).thenReturn(published.getValue());

    relay.handleMessage(message);

    // only the fire() above reached the local trigger
    verify(localTrigger).fire();
  }
}
