package com.rms.taskqueue.core.exception;

/**
 * A message body could not be decoded into a JSON payload.
 *
 * <p>Never retried: the same bytes will fail the same way on every delivery.</p>
 */
public class PayloadParseException extends TaskQueueException {

    public PayloadParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
