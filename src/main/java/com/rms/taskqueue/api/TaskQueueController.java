package com.rms.taskqueue.api;

import com.rms.taskqueue.core.publisher.TaskPublisher;
import com.rms.taskqueue.rabbitmq.connection.BrokerConnection;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
@RequestMapping(path = "/tasks", produces = MediaType.APPLICATION_JSON_VALUE)
public class TaskQueueController {

    private static final Logger log = LoggerFactory.getLogger(TaskQueueController.class);

    private final TaskPublisher publisher;
    private final BrokerConnection connection;

    public TaskQueueController(TaskPublisher publisher, BrokerConnection connection) {
        this.publisher = publisher;
        this.connection = connection;
    }

    /**
     * Publishes the task to the main queue. 202 with the message id once the broker confirmed it,
     * 500 with the error text otherwise.
     */
    @PostMapping(path = "/enqueue", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> enqueue(@Valid @RequestBody EnqueueTaskRequest req) {
        return publisher.enqueue(req)
                .map(id -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.<String, Object>of("message_id", id)))
                .onErrorResume(e -> {
                    log.error("Enqueue failed: {}", e.toString());
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(Map.of("detail", String.valueOf(e.getMessage()))));
                });
    }

    @GetMapping("/queue/health")
    public Mono<Map<String, String>> queueHealth() {
        return Mono.fromCallable(connection::ping)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ok -> Map.of("rabbitmq", ok ? "connected" : "disconnected"));
    }
}
