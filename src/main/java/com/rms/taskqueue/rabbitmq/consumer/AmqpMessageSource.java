package com.rms.taskqueue.rabbitmq.consumer;

import com.rms.taskqueue.consumer.MessageSource;
import com.rms.taskqueue.consumer.MessageStream;
import com.rms.taskqueue.core.exception.ConsumerStreamException;
import com.rms.taskqueue.rabbitmq.connection.BrokerConnection;
import com.rms.taskqueue.rabbitmq.topology.DeclaredTopology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Subscribes to the main queue with manual acknowledgement.
 *
 * <p>Connects on demand, so reopening a stream after a broker outage also re-establishes the
 * connection and redeclares the topology.</p>
 */
public class AmqpMessageSource implements MessageSource {

    private static final Logger log = LoggerFactory.getLogger(AmqpMessageSource.class);

    private final BrokerConnection connection;
    private final int bufferSize;

    public AmqpMessageSource(BrokerConnection connection, int prefetchCount) {
        this.connection = connection;
        this.bufferSize = Math.max(1, prefetchCount);
    }

    @Override
    public MessageStream open() {
        if (!connection.isReady()) {
            connection.connect();
        }
        DeclaredTopology topology = connection.topology();
        if (topology == null) {
            throw new ConsumerStreamException("RabbitMQ topology is not declared");
        }
        try {
            AmqpMessageStream stream = connection.withChannel(ch -> {
                AmqpMessageStream s = new AmqpMessageStream(connection, ch, bufferSize);
                s.subscribe(topology.mainQueue());
                return s;
            });
            log.info("Subscribed queue={} consumer_tag={}", topology.mainQueue(), stream.consumerTag());
            return stream;
        } catch (ConsumerStreamException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ConsumerStreamException("Failed to subscribe to " + topology.mainQueue() + ": " + e.getMessage(), e);
        }
    }
}
