package com.rms.taskqueue.core.model;

import java.util.Locale;

/**
 * The three logical delivery targets of the task queue.
 *
 * <p>Each destination is a durable queue bound to the shared direct exchange with its own
 * queue name as routing key. The concrete names come from configuration; this enum only
 * captures the role a queue plays in the retry/dead-letter flow.</p>
 *
 * <ul>
 *   <li>{@link #MAIN}: where producers publish and the consumer reads.</li>
 *   <li>{@link #RETRY}: holding area; expired messages are dead-lettered back to {@link #MAIN}.</li>
 *   <li>{@link #DEAD_LETTER}: terminal destination for messages that exhausted their retries.</li>
 * </ul>
 */
public enum Destination {

    MAIN,
    RETRY,
    DEAD_LETTER;

    /**
     * Lenient parsing used by the admin surface ({@code main}, {@code retry}, {@code dlq}, {@code dead-letter}).
     */
    public static Destination parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("destination is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "main" -> MAIN;
            case "retry" -> RETRY;
            case "dlq", "dead-letter", "dead_letter", "deadletter" -> DEAD_LETTER;
            default -> throw new IllegalArgumentException("Unsupported destination: " + value);
        };
    }
}
