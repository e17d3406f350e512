package com.rms.taskqueue.consumer;

import com.rms.taskqueue.core.model.InboundMessage;

import java.time.Duration;

/**
 * Receive handle on the main destination, opened by a {@link MessageSource}.
 *
 * <p>Any broken-stream condition (consumer cancelled by the broker, channel closed, acknowledgement
 * rejected) surfaces as {@link com.rms.taskqueue.core.exception.ConsumerStreamException}.</p>
 */
public interface MessageStream extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next delivery.
     *
     * @return the delivery, or {@code null} if none arrived in time
     */
    InboundMessage poll(Duration timeout) throws InterruptedException;

    void ack(InboundMessage message);

    /**
     * Negatively acknowledges a delivery and asks the broker to queue it again.
     */
    void requeue(InboundMessage message);

    /**
     * Stops receiving. Deliveries not yet acknowledged go back to the broker. Never throws.
     */
    @Override
    void close();
}
