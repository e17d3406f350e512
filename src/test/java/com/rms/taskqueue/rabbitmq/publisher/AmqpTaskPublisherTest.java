package com.rms.taskqueue.rabbitmq.publisher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rms.taskqueue.core.codec.PayloadCodec;
import com.rms.taskqueue.core.exception.NotConnectedException;
import com.rms.taskqueue.core.exception.TaskQueueException;
import com.rms.taskqueue.core.model.Destination;
import com.rms.taskqueue.core.model.MessageHeaders;
import com.rms.taskqueue.rabbitmq.connection.BrokerConnection;
import com.rms.taskqueue.rabbitmq.connection.ChannelCallback;
import com.rms.taskqueue.rabbitmq.topology.DeclaredTopology;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AmqpTaskPublisherTest {

    private static final DeclaredTopology TOPOLOGY =
            new DeclaredTopology("tasks", "tasks.main", "tasks.retry", "tasks.dlq");

    private BrokerConnection connection;
    private Channel channel;
    private AmqpTaskPublisher publisher;

    @BeforeEach
    void setUp() throws IOException {
        connection = mock(BrokerConnection.class);
        channel = mock(Channel.class);

        when(connection.isReady()).thenReturn(true);
        when(connection.topology()).thenReturn(TOPOLOGY);
        when(connection.withChannel(any())).thenAnswer(inv -> {
            ChannelCallback<?> callback = inv.getArgument(0);
            return callback.doInChannel(channel);
        });

        publisher = new AmqpTaskPublisher(connection, new PayloadCodec(new ObjectMapper()), "api", Duration.ofSeconds(5));
    }

    @Test
    void publishToMainSendsPersistentJsonWithGeneratedId() throws Exception {
        String id = publisher.publishToMain(Map.of("title", "t"));

        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(channel).basicPublish(eq("tasks"), eq("tasks.main"), props.capture(), body.capture());
        verify(channel).waitForConfirmsOrDie(5000L);

        AMQP.BasicProperties p = props.getValue();
        assertNotNull(id);
        assertEquals(id, p.getMessageId());
        assertEquals(2, p.getDeliveryMode());
        assertEquals("application/json", p.getContentType());
        assertNull(p.getExpiration());
        assertEquals(id, p.getHeaders().get(MessageHeaders.MESSAGE_ID));
        assertEquals("api", p.getHeaders().get(MessageHeaders.SOURCE));
        assertEquals("{\"title\":\"t\"}", new String(body.getValue(), StandardCharsets.UTF_8));
    }

    @Test
    void publishToRetryCarriesDelayAsExpirationAndKeepsId() throws Exception {
        String id = publisher.publishToRetry("p", Map.of(MessageHeaders.RETRY_COUNT, 1), Duration.ofMillis(30_000), "m-1");

        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq("tasks"), eq("tasks.retry"), props.capture(), any(byte[].class));

        assertEquals("m-1", id);
        assertEquals("30000", props.getValue().getExpiration());
        assertEquals(1, props.getValue().getHeaders().get(MessageHeaders.RETRY_COUNT));
        assertEquals("m-1", props.getValue().getHeaders().get(MessageHeaders.MESSAGE_ID));
    }

    @Test
    void publishToDeadLetterUsesDeadLetterRoutingKey() throws Exception {
        publisher.publish(Destination.DEAD_LETTER, "p", null, null, "m-2");

        verify(channel).basicPublish(eq("tasks"), eq("tasks.dlq"), any(AMQP.BasicProperties.class), any(byte[].class));
    }

    @Test
    void connectsOnDemandWhenNotReady() {
        when(connection.isReady()).thenReturn(false);

        publisher.publishToMain("p");

        verify(connection).connect();
    }

    @Test
    void failsWhenConnectFails() throws Exception {
        when(connection.isReady()).thenReturn(false);
        doThrow(new NotConnectedException("Failed to connect to RabbitMQ")).when(connection).connect();

        assertThrows(NotConnectedException.class, () -> publisher.publishToMain("p"));
        verify(channel, never()).basicPublish(anyString(), anyString(), any(), any());
    }

    @Test
    void failsWhenTopologyIsMissing() {
        when(connection.topology()).thenReturn(null);

        assertThrows(NotConnectedException.class, () -> publisher.publishToMain("p"));
    }

    @Test
    void missingConfirmSurfacesAsPublishFailure() throws Exception {
        doThrow(new TimeoutException()).when(channel).waitForConfirmsOrDie(anyLong());

        TaskQueueException e = assertThrows(TaskQueueException.class, () -> publisher.publishToMain("p"));

        assertTrue(e.getMessage().contains("MAIN"));
        assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    void enqueueEmitsMessageId() {
        StepVerifier.create(publisher.enqueue(Map.of("title", "t")))
                .assertNext(id -> assertFalse(id.isBlank()))
                .verifyComplete();
    }

    @Test
    void enqueueErrorsWhenPublishFails() throws Exception {
        doThrow(new IOException("channel closed")).when(channel)
                .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));

        StepVerifier.create(publisher.enqueue("p"))
                .expectError(TaskQueueException.class)
                .verify(Duration.ofSeconds(5));
    }
}
