package com.rms.taskqueue.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.taskqueue.core.model.Destination;
import com.rms.taskqueue.core.publisher.TaskPublisher;
import com.rms.taskqueue.rabbitmq.connection.BrokerConnection;
import com.rms.taskqueue.rabbitmq.connection.DestinationStats;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints for inspecting queue depths and injecting messages into any destination,
 * e.g. to replay a dead-lettered task or to exercise the retry path by hand.
 *
 * Disabled by default; enable via:
 *   taskqueue.admin.enabled=true
 */
@RestController
@RequestMapping(path = "/admin/queue", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "taskqueue.admin", name = "enabled", havingValue = "true", matchIfMissing = false)
public class QueueAdminController {

    private final TaskPublisher publisher;
    private final BrokerConnection connection;

    public QueueAdminController(TaskPublisher publisher, BrokerConnection connection) {
        this.publisher = publisher;
        this.connection = connection;
    }

    @GetMapping("/destinations")
    public Mono<List<Map<String, Object>>> destinations() {
        return Mono.fromCallable(() -> {
                    List<Map<String, Object>> out = new ArrayList<>();
                    for (Destination d : Destination.values()) {
                        DestinationStats stats = connection.inspect(d);
                        Map<String, Object> row = new LinkedHashMap<>();
                        row.put("destination", d.name());
                        row.put("queue", stats.queue());
                        row.put("messages", stats.messageCount());
                        row.put("consumers", stats.consumerCount());
                        out.add(row);
                    }
                    return out;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Publish a message directly to a destination.
     * - If messageId is omitted, a random UUID is used.
     * - delayMs only makes sense for the retry destination, where it becomes the message TTL.
     */
    @PostMapping(path = "/publish", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> publish(@RequestBody PublishRequest req) {
        Destination destination = Destination.parse(req.destination());
        Duration delay = req.delayMs() == null ? null : Duration.ofMillis(req.delayMs());
        return Mono.fromCallable(() ->
                        publisher.publish(destination, req.payload(), req.headers(), delay, req.messageId()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(id -> {
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("destination", destination.name());
                    out.put("messageId", id);
                    return out;
                });
    }

    public record PublishRequest(String destination, JsonNode payload, Map<String, Object> headers,
                                 Long delayMs, String messageId) {
        public PublishRequest {
            if (destination == null || destination.isBlank()) throw new IllegalArgumentException("destination is required");
            if (payload == null) throw new IllegalArgumentException("payload is required");
            if (delayMs != null && delayMs < 0) throw new IllegalArgumentException("delayMs must be >= 0");
        }
    }
}
