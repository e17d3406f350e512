package com.rms.taskqueue.core.handler;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Application callback that processes one task.
 *
 * <p>Returning normally means the task is done and the delivery is acknowledged. Throwing any
 * exception marks the attempt as failed; the message is then retried with backoff or, once the
 * retry budget is spent, dead-lettered. The exception's simple class name is recorded as the
 * failure reason.</p>
 *
 * <p>Handlers must be idempotent: delivery is at-least-once.</p>
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * @param payload decoded JSON body
     * @param headers normalized message headers, including retry metadata
     * @throws Exception to signal a failed attempt
     */
    void handle(JsonNode payload, Map<String, Object> headers) throws Exception;
}
