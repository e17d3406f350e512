package com.rms.taskqueue.core.retry;

import com.rms.taskqueue.core.model.Destination;

import java.time.Duration;

/**
 * Outcome of routing a failed message.
 *
 * @param destination {@link Destination#RETRY} or {@link Destination#DEAD_LETTER}
 * @param retryCount  for a retry, the count stamped on the republished message; for a
 *                    dead-letter, the total number of retries the message went through
 * @param delay       backoff applied as message expiration; {@link Duration#ZERO} for dead-letter
 */
public record RetryDecision(Destination destination, int retryCount, Duration delay) {

    public static RetryDecision retry(int nextRetryCount, Duration delay) {
        return new RetryDecision(Destination.RETRY, nextRetryCount, delay);
    }

    public static RetryDecision deadLetter(int totalRetryCount) {
        return new RetryDecision(Destination.DEAD_LETTER, totalRetryCount, Duration.ZERO);
    }

    public boolean isRetry() {
        return destination == Destination.RETRY;
    }
}
