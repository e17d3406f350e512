package com.rms.taskqueue.core.model;

import java.util.Map;

/**
 * Typed view of the retry metadata carried in message headers.
 *
 * <p>{@code retryCount} is never negative: missing, negative or unparseable values all read as zero.
 * {@code retryReason} and {@code retryTimestamp} are {@code null} for a message that has not failed yet.</p>
 *
 * @param retryCount     number of retry publications so far
 * @param retryReason    cause of the last failure
 * @param retryTimestamp epoch seconds of the last retry publication
 */
public record RetryState(int retryCount, String retryReason, Long retryTimestamp) {

    public RetryState {
        if (retryCount < 0) {
            retryCount = 0;
        }
    }

    public static RetryState fromHeaders(Map<String, Object> headers) {
        Long count = MessageHeaders.getLong(headers, MessageHeaders.RETRY_COUNT);
        int retryCount = count == null ? 0 : (int) Math.max(0, Math.min(Integer.MAX_VALUE, count));
        return new RetryState(
                retryCount,
                MessageHeaders.getString(headers, MessageHeaders.RETRY_REASON),
                MessageHeaders.getLong(headers, MessageHeaders.RETRY_TIMESTAMP)
        );
    }

    public boolean isRetried() {
        return retryCount > 0;
    }
}
