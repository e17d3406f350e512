package com.rms.taskqueue.rabbitmq.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rms.taskqueue.core.codec.PayloadCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Single JSON mapper for the HTTP layer and the message bodies.
 *
 * <ul>
 *   <li>{@link JavaTimeModule}: {@code java.time} values in payloads and admin responses.</li>
 *   <li>{@code WRITE_DATES_AS_TIMESTAMPS = false}: ISO-8601 strings on the wire.</li>
 * </ul>
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Message bodies are encoded with the same mapper as HTTP responses, so a payload accepted by
     * the enqueue endpoint reaches the handler unchanged.
     */
    @Bean
    public PayloadCodec payloadCodec(ObjectMapper mapper) {
        return new PayloadCodec(mapper);
    }
}
