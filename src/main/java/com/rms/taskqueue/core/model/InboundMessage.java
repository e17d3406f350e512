package com.rms.taskqueue.core.model;

import java.util.Map;
import java.util.UUID;

/**
 * A delivery as seen by the consumer, with headers already normalized and retry metadata parsed.
 *
 * @param messageId   logical message id, stable across retry and dead-letter hops
 * @param headers     normalized header map
 * @param retryState  retry metadata read from {@code headers}
 * @param deliveryTag broker delivery tag used for acknowledgement
 * @param body        raw message body
 */
public record InboundMessage(
        String messageId,
        Map<String, Object> headers,
        RetryState retryState,
        long deliveryTag,
        byte[] body
) {

    /**
     * Builds the inbound view from wire data.
     *
     * <p>Message id resolution order: {@code message_id} header, then the AMQP {@code message-id}
     * property, then a fresh UUID so a message without identity can still be routed.</p>
     */
    public static InboundMessage from(Map<String, Object> rawHeaders,
                                      String propertyMessageId,
                                      long deliveryTag,
                                      byte[] body) {
        Map<String, Object> headers = MessageHeaders.normalize(rawHeaders);

        String id = MessageHeaders.getString(headers, MessageHeaders.MESSAGE_ID);
        if (id == null && propertyMessageId != null && !propertyMessageId.isBlank()) {
            id = propertyMessageId;
        }
        if (id == null) {
            id = UUID.randomUUID().toString();
        }

        return new InboundMessage(id, headers, RetryState.fromHeaders(headers), deliveryTag,
                body == null ? new byte[0] : body);
    }
}
