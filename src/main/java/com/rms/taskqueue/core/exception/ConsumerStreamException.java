package com.rms.taskqueue.core.exception;

/**
 * The consumer's message stream broke mid-iteration (consumer cancelled, channel closed,
 * acknowledgement rejected).
 *
 * <p>Recoverable: the consumer loop pauses briefly and reopens the stream.</p>
 */
public class ConsumerStreamException extends TaskQueueException {

    public ConsumerStreamException(String message) {
        super(message);
    }

    public ConsumerStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
