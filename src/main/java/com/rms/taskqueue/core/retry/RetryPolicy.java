package com.rms.taskqueue.core.retry;

import com.rms.taskqueue.core.model.InboundMessage;
import com.rms.taskqueue.core.model.MessageHeaders;
import com.rms.taskqueue.core.model.RetryState;
import com.rms.taskqueue.core.publisher.TaskPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exponential backoff retry policy with a dead-letter terminal state.
 *
 * <h2>Backoff</h2>
 * {@code delay(n) = baseDelay * 2^n} where {@code n} is the retry count carried by the failed
 * message. No jitter and no cap, so the schedule is deterministic: with a 30s base the five
 * retries of a message wait 30s, 60s, 120s, 240s and 480s. Very high retry counts produce very
 * large delays; a count whose delay no longer fits in a {@code long} is rejected.
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li>{@code retryCount < maxRetries}: republish to the retry destination with the count
 *       incremented, the failure reason and a timestamp, using the delay as expiration.</li>
 *   <li>otherwise: republish to the dead-letter destination with the final reason, a timestamp
 *       and the total retry count.</li>
 * </ul>
 * Every failure ends up in exactly one of the two; nothing is dropped. The original message id
 * is kept on both paths so a message can be traced across hops. Routing the same message twice
 * produces the same decision, though the broker may then hold two copies (at-least-once).
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final TaskPublisher publisher;
    private final long baseDelayMs;
    private final int maxRetries;
    private final Clock clock;

    public RetryPolicy(TaskPublisher publisher, long baseDelayMs, int maxRetries, Clock clock) {
        if (baseDelayMs <= 0) throw new IllegalArgumentException("baseDelayMs must be positive");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be non-negative");
        this.publisher = publisher;
        this.baseDelayMs = baseDelayMs;
        this.maxRetries = maxRetries;
        this.clock = clock;
    }

    /**
     * @param retryCount retries already performed, {@code >= 0}
     * @return {@code baseDelay * 2^retryCount}
     * @throws ArithmeticException if the delay overflows
     */
    public Duration computeBackoff(int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative: " + retryCount);
        }
        if (retryCount >= Long.SIZE - 1) {
            throw new ArithmeticException("Backoff overflows for retryCount=" + retryCount);
        }
        return Duration.ofMillis(Math.multiplyExact(baseDelayMs, 1L << retryCount));
    }

    public RetryDecision decide(RetryState state) {
        int current = state.retryCount();
        if (current < maxRetries) {
            return RetryDecision.retry(current + 1, computeBackoff(current));
        }
        return RetryDecision.deadLetter(current);
    }

    /**
     * Routes a failed message to retry or dead-letter.
     *
     * @param payload decoded payload to republish
     * @param message the failed delivery
     * @param reason  failure cause, recorded in headers
     * @return the decision that was applied
     */
    public RetryDecision routeFailure(Object payload, InboundMessage message, String reason) {
        RetryDecision decision = decide(message.retryState());
        String messageId = message.messageId();
        long now = clock.instant().getEpochSecond();

        if (decision.isRetry()) {
            Map<String, Object> headers = new LinkedHashMap<>(message.headers());
            headers.put(MessageHeaders.RETRY_COUNT, decision.retryCount());
            headers.put(MessageHeaders.RETRY_REASON, reason);
            headers.put(MessageHeaders.RETRY_TIMESTAMP, now);

            publisher.publishToRetry(payload, headers, decision.delay(), messageId);
            log.warn("Message sent to retry message_id={} retry_count={} delay_ms={} reason={}",
                    messageId, decision.retryCount(), decision.delay().toMillis(), reason);
            return decision;
        }

        publishDeadLetter(payload, message, reason, decision.retryCount(), now);
        return decision;
    }

    /**
     * Dead-letters a message without going through the retry stage.
     *
     * <p>Used for failures that can never succeed on redelivery, such as an undecodable body.</p>
     */
    public RetryDecision routeToDeadLetter(Object payload, InboundMessage message, String reason) {
        int total = message.retryState().retryCount();
        publishDeadLetter(payload, message, reason, total, clock.instant().getEpochSecond());
        return RetryDecision.deadLetter(total);
    }

    private void publishDeadLetter(Object payload, InboundMessage message, String reason, int totalRetries, long now) {
        Map<String, Object> headers = new LinkedHashMap<>(message.headers());
        headers.put(MessageHeaders.FINAL_FAILURE_REASON, reason);
        headers.put(MessageHeaders.FINAL_FAILURE_TIMESTAMP, now);
        headers.put(MessageHeaders.TOTAL_RETRY_COUNT, totalRetries);

        publisher.publishToDeadLetter(payload, headers, message.messageId());
        log.error("Message sent to dead-letter message_id={} final_reason={} total_retries={}",
                message.messageId(), reason, totalRetries);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }
}
