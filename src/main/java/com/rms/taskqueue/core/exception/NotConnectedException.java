package com.rms.taskqueue.core.exception;

/**
 * The broker connection could not be established, or is not ready for the attempted operation.
 *
 * <p>Fatal to the single call that raised it. Nothing retries internally; the caller decides
 * whether to retry the whole operation.</p>
 */
public class NotConnectedException extends TaskQueueException {

    public NotConnectedException(String message) {
        super(message);
    }

    public NotConnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
