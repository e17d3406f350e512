package com.rms.taskqueue.core.publisher;

import com.rms.taskqueue.core.model.Destination;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * =====================================================================
 * TaskPublisher
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Defines the **transport-facing contract** for putting task messages
 * onto one of the three logical destinations.
 *
 * The primary implementation targets **RabbitMQ**, but this interface
 * keeps the retry policy and the consumer loop free of broker types,
 * which is what makes them testable without a running broker.
 *
 * ROLE IN ARCHITECTURE
 * --------------------
 *
 *   [ HTTP enqueue ]   [ RetryPolicy ]
 *          │                 │
 *          ▼                 ▼
 *       [ TaskPublisher ]  ← YOU ARE HERE
 *                │
 *                ▼
 *   [ exchange → main / retry / dead-letter ]
 *
 * It deliberately knows NOTHING about:
 *  - Retry counting
 *  - Consumer acknowledgements
 *
 * IDENTITY
 * --------
 * Implementations MUST:
 *  - Generate a message id when the caller supplies none
 *  - Stamp {@code message_id} and {@code source} headers when absent
 *  - Return the final message id
 *
 * FAILURE SEMANTICS
 * -----------------
 * - Returns normally: the broker accepted the publish
 * - Throws {@link com.rms.taskqueue.core.exception.NotConnectedException}:
 *   no connection could be made; nothing was sent
 *
 * There is no internal retry. Retrying a failed publish is the caller's call.
 *
 * THREAD SAFETY
 * -------------
 * Implementations MUST be safe to call from many producer threads.
 */
public interface TaskPublisher {

    /**
     * Publishes a single persistent message.
     *
     * @param destination logical destination
     * @param payload     value serialized to JSON
     * @param headers     optional headers (may be {@code null})
     * @param expiration  optional per-message TTL (may be {@code null})
     * @param messageId   optional message id (may be {@code null})
     * @return the final message id
     */
    String publish(Destination destination,
                   Object payload,
                   Map<String, Object> headers,
                   Duration expiration,
                   String messageId);

    default String publishToMain(Object payload) {
        return publish(Destination.MAIN, payload, null, null, null);
    }

    /**
     * Publishes to the retry destination. The delay is carried as message expiration; when it
     * elapses the broker dead-letters the message back to main.
     */
    default String publishToRetry(Object payload, Map<String, Object> headers, Duration delay, String messageId) {
        return publish(Destination.RETRY, payload, headers, delay, messageId);
    }

    default String publishToDeadLetter(Object payload, Map<String, Object> headers, String messageId) {
        return publish(Destination.DEAD_LETTER, payload, headers, null, messageId);
    }

    /**
     * Non-blocking variant of {@link #publishToMain(Object)} for reactive callers.
     *
     * @return a Mono emitting the final message id once the broker accepted the message
     */
    Mono<String> enqueue(Object payload);
}
