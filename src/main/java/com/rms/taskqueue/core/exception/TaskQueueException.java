package com.rms.taskqueue.core.exception;

/**
 * Base type for task queue failures.
 *
 * <p>Unchecked: callers that can do something about a failure catch the specific subtype,
 * everything else propagates to the nearest boundary (HTTP handler, consumer loop, supervisor).</p>
 */
public class TaskQueueException extends RuntimeException {

    public TaskQueueException(String message) {
        super(message);
    }

    public TaskQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
