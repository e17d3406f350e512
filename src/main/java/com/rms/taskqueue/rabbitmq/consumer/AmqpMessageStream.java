package com.rms.taskqueue.rabbitmq.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.rms.taskqueue.consumer.MessageStream;
import com.rms.taskqueue.core.exception.ConsumerStreamException;
import com.rms.taskqueue.core.model.InboundMessage;
import com.rms.taskqueue.rabbitmq.connection.BrokerConnection;
import com.rms.taskqueue.rabbitmq.connection.ChannelCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Push-to-pull adapter over one basic.consume subscription.
 *
 * <p>The client library pushes deliveries on its dispatch thread into a bounded buffer; the
 * consumer loop takes them out with {@link #poll(Duration)}. Prefetch caps what the broker sends,
 * so the buffer never holds more than {@code prefetch} deliveries.</p>
 *
 * <p>Delivery tags are only valid on the channel that delivered them. Acknowledgements are refused
 * once the connection's channel has been replaced, and the stream reports itself broken.</p>
 */
class AmqpMessageStream implements MessageStream {

    private static final Logger log = LoggerFactory.getLogger(AmqpMessageStream.class);

    private final BrokerConnection connection;
    private final Channel channel;
    private final BlockingQueue<Delivery> buffer;
    private final AtomicReference<String> failure = new AtomicReference<>();

    private volatile String consumerTag;

    AmqpMessageStream(BrokerConnection connection, Channel channel, int bufferSize) {
        this.connection = connection;
        this.channel = channel;
        this.buffer = new LinkedBlockingQueue<>(bufferSize);
    }

    void subscribe(String queue) throws IOException {
        consumerTag = channel.basicConsume(queue, false, new BufferingConsumer(channel));
    }

    String consumerTag() {
        return consumerTag;
    }

    @Override
    public InboundMessage poll(Duration timeout) throws InterruptedException {
        checkOpen();
        Delivery delivery = buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (delivery == null) {
            checkOpen();
            return null;
        }
        AMQP.BasicProperties props = delivery.getProperties();
        return InboundMessage.from(
                props == null ? null : props.getHeaders(),
                props == null ? null : props.getMessageId(),
                delivery.getEnvelope().getDeliveryTag(),
                delivery.getBody());
    }

    @Override
    public void ack(InboundMessage message) {
        onOwnChannel("ack", ch -> {
            ch.basicAck(message.deliveryTag(), false);
            return null;
        });
    }

    @Override
    public void requeue(InboundMessage message) {
        onOwnChannel("nack", ch -> {
            ch.basicNack(message.deliveryTag(), false, true);
            return null;
        });
    }

    /**
     * Cancels the subscription (unless the broker already did) and nacks with requeue every
     * delivery still in the buffer, so none of them stays unacknowledged on the open channel.
     */
    @Override
    public void close() {
        if (!channel.isOpen()) {
            buffer.clear();
            return;
        }
        String tag = consumerTag;
        if (tag != null && failure.get() == null) {
            try {
                onOwnChannel("cancel", ch -> {
                    ch.basicCancel(tag);
                    return null;
                });
            } catch (RuntimeException e) {
                log.debug("Consumer cancel failed (ignored): {}", e.toString());
            }
        }
        returnBuffered();
    }

    private void returnBuffered() {
        Delivery delivery;
        while ((delivery = buffer.poll()) != null) {
            long deliveryTag = delivery.getEnvelope().getDeliveryTag();
            try {
                onOwnChannel("nack", ch -> {
                    ch.basicNack(deliveryTag, false, true);
                    return null;
                });
            } catch (RuntimeException e) {
                log.warn("Could not return buffered delivery delivery_tag={}: {}", deliveryTag, e.toString());
            }
        }
    }

    private void checkOpen() {
        String reason = failure.get();
        if (reason != null) {
            throw new ConsumerStreamException(reason);
        }
    }

    private void onOwnChannel(String operation, ChannelCallback<Void> callback) {
        try {
            connection.withChannel(ch -> {
                if (ch != channel) {
                    throw new IOException("channel was replaced since the delivery");
                }
                return callback.doInChannel(ch);
            });
        } catch (IOException | RuntimeException e) {
            throw new ConsumerStreamException("Failed to " + operation + " delivery: " + e.getMessage(), e);
        }
    }

    private final class BufferingConsumer extends DefaultConsumer {

        BufferingConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            try {
                buffer.put(new Delivery(envelope, properties, body));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failure.compareAndSet(null, "interrupted while buffering a delivery");
            }
        }

        @Override
        public void handleCancel(String consumerTag) {
            failure.compareAndSet(null, "consumer cancelled by broker (consumer_tag=" + consumerTag + ")");
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            failure.compareAndSet(null, "channel shut down: " + sig.getMessage());
        }
    }
}
