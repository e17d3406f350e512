package com.rms.taskqueue.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.taskqueue.core.exception.PayloadParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * JSON encoding of task payloads, backed by the application's {@link ObjectMapper}.
 */
public class PayloadCodec {

    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper mapper;

    public PayloadCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(Object payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes a message body.
     *
     * @throws PayloadParseException if the body is empty or not valid JSON
     */
    public JsonNode decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new PayloadParseException("Empty message body", null);
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new PayloadParseException("Empty message body", null);
            }
            return node;
        } catch (IOException e) {
            throw new PayloadParseException("Invalid JSON payload: " + e.getMessage(), e);
        }
    }

    /**
     * Wraps an undecodable body so it can still be dead-lettered as JSON.
     * Malformed UTF-8 sequences are replaced rather than rejected.
     */
    public static Map<String, Object> rawEnvelope(byte[] body) {
        String text = body == null ? "" : new String(body, StandardCharsets.UTF_8);
        return Map.of("raw", text);
    }
}
