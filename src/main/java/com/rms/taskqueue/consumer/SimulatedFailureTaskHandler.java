package com.rms.taskqueue.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.taskqueue.core.handler.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Handler used when the application registers none.
 *
 * <p>Logs each task. A payload carrying {@code "should_fail": true} fails on every attempt, which
 * makes the retry chain and the dead-letter path observable end to end.</p>
 */
public class SimulatedFailureTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(SimulatedFailureTaskHandler.class);

    static final String SHOULD_FAIL = "should_fail";

    @Override
    public void handle(JsonNode payload, Map<String, Object> headers) {
        if (payload.path(SHOULD_FAIL).asBoolean(false)) {
            throw new IllegalStateException("Simulated task failure");
        }
        log.info("Task processed title={}", payload.path("title").asText(""));
    }
}
