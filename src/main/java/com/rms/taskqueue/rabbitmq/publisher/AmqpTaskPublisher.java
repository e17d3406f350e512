package com.rms.taskqueue.rabbitmq.publisher;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import com.rms.taskqueue.core.codec.PayloadCodec;
import com.rms.taskqueue.core.exception.NotConnectedException;
import com.rms.taskqueue.core.exception.TaskQueueException;
import com.rms.taskqueue.core.model.Destination;
import com.rms.taskqueue.core.model.TaskMessage;
import com.rms.taskqueue.core.publisher.TaskPublisher;
import com.rms.taskqueue.rabbitmq.connection.BrokerConnection;
import com.rms.taskqueue.rabbitmq.topology.DeclaredTopology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * RabbitMQ implementation of {@link TaskPublisher}.
 *
 * <h2>Wire format</h2>
 * <ul>
 *   <li>Body: the payload as JSON ({@code application/json}, UTF-8).</li>
 *   <li>Delivery mode 2 (persistent); the AMQP {@code message-id} property equals the
 *       {@code message_id} header.</li>
 *   <li>{@code expiration}: per-message TTL in milliseconds, only when a delay is given.</li>
 * </ul>
 *
 * <h2>Acknowledgement</h2>
 * The channel runs in confirm mode. A publish returns only after the broker confirmed it, so a
 * main queue rejecting publishes on overflow surfaces here as an error instead of a silent drop.
 *
 * <h2>Threading / Reactive behavior</h2>
 * {@link #publish} blocks for one network round trip. {@link #enqueue(Object)} moves it onto
 * {@link Schedulers#boundedElastic()} so it never runs on a WebFlux event-loop thread.
 */
public class AmqpTaskPublisher implements TaskPublisher {

    private static final Logger log = LoggerFactory.getLogger(AmqpTaskPublisher.class);

    private static final int PERSISTENT = 2;

    private final BrokerConnection connection;
    private final PayloadCodec codec;
    private final String source;
    private final Duration confirmTimeout;

    public AmqpTaskPublisher(BrokerConnection connection, PayloadCodec codec, String source, Duration confirmTimeout) {
        this.connection = connection;
        this.codec = codec;
        this.source = source;
        this.confirmTimeout = confirmTimeout;
    }

    @Override
    public String publish(Destination destination,
                          Object payload,
                          Map<String, Object> headers,
                          Duration expiration,
                          String messageId) {
        if (!connection.isReady()) {
            // The only self-healing point on the publishing side.
            connection.connect();
        }
        DeclaredTopology topology = connection.topology();
        if (topology == null) {
            throw new NotConnectedException("RabbitMQ topology is not declared");
        }

        TaskMessage message = TaskMessage.of(payload, headers, expiration, messageId, source);
        byte[] body = codec.encode(message.payload());
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(PayloadCodec.CONTENT_TYPE)
                .deliveryMode(PERSISTENT)
                .messageId(message.messageId())
                .headers(message.headers())
                .expiration(message.expiration() == null ? null : String.valueOf(message.expiration().toMillis()))
                .build();

        String routingKey = topology.routingKey(destination);
        try {
            connection.withChannel(ch -> {
                ch.basicPublish(topology.exchange(), routingKey, properties, body);
                awaitConfirm(ch);
                return null;
            });
        } catch (IOException | ShutdownSignalException e) {
            throw new TaskQueueException("Publish to " + destination + " failed: " + e.getMessage(), e);
        }

        log.info("Published message_id={} destination={} routing_key={}", message.messageId(), destination, routingKey);
        return message.messageId();
    }

    @Override
    public Mono<String> enqueue(Object payload) {
        return Mono.fromCallable(() -> publishToMain(payload))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void awaitConfirm(Channel ch) throws IOException {
        try {
            ch.waitForConfirmsOrDie(confirmTimeout.toMillis());
        } catch (TimeoutException e) {
            throw new IOException("Publisher confirm not received within " + confirmTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException iioe = new InterruptedIOException("Interrupted while waiting for publisher confirm");
            iioe.initCause(e);
            throw iioe;
        }
    }
}
