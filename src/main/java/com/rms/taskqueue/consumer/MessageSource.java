package com.rms.taskqueue.consumer;

/**
 * Opens message streams on the main destination.
 */
public interface MessageSource {

    /**
     * @throws com.rms.taskqueue.core.exception.NotConnectedException when the broker is unreachable
     * @throws com.rms.taskqueue.core.exception.ConsumerStreamException when the subscription fails
     */
    MessageStream open();
}
