package com.rms.taskqueue.core.model;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire-level header names and header map helpers.
 *
 * <p>Headers stay an untyped map at the broker boundary. Retry metadata is read out of it
 * once, on receipt, into a {@link RetryState}.</p>
 */
public final class MessageHeaders {

    public static final String MESSAGE_ID = "message_id";
    public static final String SOURCE = "source";

    public static final String RETRY_COUNT = "x-retry-count";
    public static final String RETRY_REASON = "x-retry-reason";
    public static final String RETRY_TIMESTAMP = "x-retry-timestamp";

    public static final String FINAL_FAILURE_REASON = "x-final-failure-reason";
    public static final String FINAL_FAILURE_TIMESTAMP = "x-final-failure-timestamp";
    public static final String TOTAL_RETRY_COUNT = "x-total-retry-count";

    private MessageHeaders() {
    }

    /**
     * Copies AMQP header values into a plain map.
     *
     * <p>The AMQP client hands string values back as {@code LongString}; those are converted with
     * {@code toString()} so handlers only ever see JDK types. Numbers, booleans and timestamps are
     * kept as they are; arrays and tables (such as the broker's {@code x-death}) keep their shape,
     * with their elements converted the same way.</p>
     */
    public static Map<String, Object> normalize(Map<String, ?> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (raw == null) {
            return out;
        }
        raw.forEach((k, v) -> out.put(k, normalizeValue(v)));
        return out;
    }

    private static Object normalizeValue(Object v) {
        if (v == null || v instanceof Number || v instanceof Boolean || v instanceof String || v instanceof Date) {
            return v;
        }
        if (v instanceof Map<?, ?> table) {
            Map<String, Object> out = new LinkedHashMap<>();
            table.forEach((k, value) -> out.put(String.valueOf(k), normalizeValue(value)));
            return out;
        }
        if (v instanceof List<?> array) {
            List<Object> out = new ArrayList<>(array.size());
            array.forEach(value -> out.add(normalizeValue(value)));
            return out;
        }
        // LongString, byte[] and anything else the client decodes
        if (v instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return v.toString();
    }

    public static String getString(Map<String, Object> headers, String name) {
        Object v = headers == null ? null : headers.get(name);
        if (v == null) {
            return null;
        }
        String s = v.toString();
        return s.isBlank() ? null : s;
    }

    /**
     * Reads an integral header, accepting numbers or numeric strings.
     *
     * @return the value, or {@code null} when absent or not a number
     */
    public static Long getLong(Map<String, Object> headers, String name) {
        Object v = headers == null ? null : headers.get(name);
        if (v == null) {
            return null;
        }
        if (v instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(v.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
