package com.rms.taskqueue.rabbitmq.topology;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.ShutdownSignalException;
import com.rms.taskqueue.core.exception.TopologyConflictException;
import com.rms.taskqueue.rabbitmq.config.TaskQueueProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * =====================================================================
 * TopologyManager
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Ensures that the exchange and the three task queues exist and are
 * bound, so publishers and the consumer can rely on them.
 *
 *   exchange (direct, durable)
 *     ├── tasks.dlq    routing key = tasks.dlq
 *     ├── tasks.retry  routing key = tasks.retry
 *     │                x-dead-letter-exchange    = exchange
 *     │                x-dead-letter-routing-key = tasks.main
 *     └── tasks.main   routing key = tasks.main
 *
 * The retry queue has no consumer. A message published to it with an
 * expiration sits there until the TTL elapses, then the broker
 * dead-letters it to the main queue. That is the whole delay mechanism.
 *
 * WHEN THIS RUNS
 * --------------
 * - Inside BrokerConnection.connect(), under its lock
 * - AFTER the connection and channel are open
 * - Exactly once per established connection
 *
 * EXISTING RESOURCES
 * ------------------
 * Topology may be provisioned outside this service, possibly with other
 * arguments (e.g. an x-message-ttl on the retry queue). Declaring with
 * different arguments fails with a channel-level PRECONDITION_FAILED
 * (406) and the broker closes the channel. In that case:
 *  - permissive (default): reopen the channel, declare passively
 *    (existence check only) and log the drift as a warning
 *  - strict: fail with TopologyConflictException
 *
 * Only reply code 406 triggers the fallback. Missing permissions,
 * connectivity problems and every other error propagate unchanged.
 *
 * IDEMPOTENCE
 * -----------
 * Re-declaring identical resources is a no-op on the broker, so running
 * this twice against the same broker state creates nothing new.
 */
public class TopologyManager {

    private static final Logger log = LoggerFactory.getLogger(TopologyManager.class);

    static final String ARG_DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    static final String ARG_DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    static final String ARG_OVERFLOW = "x-overflow";

    private final TaskQueueProperties props;

    public TopologyManager(TaskQueueProperties props) {
        this.props = props;
    }

    /**
     * Declares the exchange, then each queue with its binding.
     *
     * <p>The exchange goes first because every binding references it.</p>
     *
     * @param channels channel to declare on, replaced after a precondition failure
     * @return handle describing the declared topology
     */
    public DeclaredTopology declare(ChannelSource channels) throws IOException {
        String exchange = require(props.getExchange(), "exchange");
        String mainQueue = require(props.getMainQueue(), "mainQueue");
        String retryQueue = require(props.getRetryQueue(), "retryQueue");
        String deadLetterQueue = require(props.getDeadLetterQueue(), "deadLetterQueue");

        declareExchange(channels, exchange);

        declareQueue(channels, deadLetterQueue, Map.of());
        channels.current().queueBind(deadLetterQueue, exchange, deadLetterQueue);

        declareQueue(channels, retryQueue, Map.of(
                ARG_DEAD_LETTER_EXCHANGE, exchange,
                ARG_DEAD_LETTER_ROUTING_KEY, mainQueue
        ));
        channels.current().queueBind(retryQueue, exchange, retryQueue);

        Map<String, Object> mainArgs = (props.getMainQueueOverflow() == null || props.getMainQueueOverflow().isBlank())
                ? Map.of()
                : Map.of(ARG_OVERFLOW, props.getMainQueueOverflow());
        declareQueue(channels, mainQueue, mainArgs);
        channels.current().queueBind(mainQueue, exchange, mainQueue);

        log.info("RabbitMQ topology declared: exchange={} mainQueue={} retryQueue={} deadLetterQueue={}",
                exchange, mainQueue, retryQueue, deadLetterQueue);

        return new DeclaredTopology(exchange, mainQueue, retryQueue, deadLetterQueue);
    }

    private void declareExchange(ChannelSource channels, String exchange) throws IOException {
        try {
            channels.current().exchangeDeclare(exchange, BuiltinExchangeType.DIRECT, true);
        } catch (IOException e) {
            onConflict(e, "exchange " + exchange);
            channels.reopen().exchangeDeclarePassive(exchange);
        }
    }

    private void declareQueue(ChannelSource channels, String queue, Map<String, Object> arguments) throws IOException {
        try {
            channels.current().queueDeclare(queue, true, false, false, arguments);
        } catch (IOException e) {
            onConflict(e, "queue " + queue);
            channels.reopen().queueDeclarePassive(queue);
        }
    }

    /**
     * Rethrows anything that is not a precondition failure, or any conflict in strict mode.
     * Returns normally when the caller should fall back to a passive declaration.
     */
    private void onConflict(IOException e, String resource) throws IOException {
        if (!isPreconditionFailed(e)) {
            throw e;
        }
        if (props.isFailOnTopologyMismatch()) {
            throw new TopologyConflictException(resource, e);
        }
        log.warn("{} exists with different arguments; using passive declaration (exchange={})",
                resource, props.getExchange());
    }

    /**
     * True when the broker closed the channel with reply code 406 {@code PRECONDITION_FAILED}.
     */
    static boolean isPreconditionFailed(IOException e) {
        Throwable cause = e.getCause();
        if (!(cause instanceof ShutdownSignalException sse) || sse.isHardError()) {
            return false;
        }
        return sse.getReason() instanceof AMQP.Channel.Close close
                && close.getReplyCode() == AMQP.PRECONDITION_FAILED;
    }

    private static String require(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " is required");
        }
        return value;
    }
}
