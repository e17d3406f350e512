package com.rms.taskqueue.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An outgoing message, assembled per publish call.
 *
 * <p>Construction enforces the publishing invariant: the header map always carries
 * {@link MessageHeaders#MESSAGE_ID} and {@link MessageHeaders#SOURCE}. Values already present in the
 * caller's headers win, so a republished message keeps the identity it was first given.</p>
 *
 * @param payload    value serialized to JSON bytes
 * @param headers    immutable header map including message id and source
 * @param messageId  final message id (generated when none was supplied)
 * @param durable    persistent delivery flag
 * @param expiration optional per-message TTL; {@code null} means none
 */
public record TaskMessage(
        Object payload,
        Map<String, Object> headers,
        String messageId,
        boolean durable,
        Duration expiration
) {

    public static TaskMessage of(Object payload,
                                 Map<String, Object> headers,
                                 Duration expiration,
                                 String messageId,
                                 String source) {
        String finalId = (messageId == null || messageId.isBlank())
                ? UUID.randomUUID().toString()
                : messageId;

        Map<String, Object> map = new LinkedHashMap<>();
        if (headers != null) {
            map.putAll(headers);
        }
        map.putIfAbsent(MessageHeaders.MESSAGE_ID, finalId);
        map.putIfAbsent(MessageHeaders.SOURCE, source);

        if (expiration != null && expiration.isNegative()) {
            throw new IllegalArgumentException("expiration must not be negative: " + expiration);
        }

        return new TaskMessage(payload, Collections.unmodifiableMap(map), finalId, true, expiration);
    }
}
