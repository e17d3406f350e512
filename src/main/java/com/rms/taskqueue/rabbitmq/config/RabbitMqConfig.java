package com.rms.taskqueue.rabbitmq.config;

import com.rabbitmq.client.ConnectionFactory;
import com.rms.taskqueue.consumer.ConsumerLoop;
import com.rms.taskqueue.consumer.ConsumerSupervisor;
import com.rms.taskqueue.consumer.MessageSource;
import com.rms.taskqueue.consumer.SimulatedFailureTaskHandler;
import com.rms.taskqueue.core.codec.PayloadCodec;
import com.rms.taskqueue.core.handler.TaskHandler;
import com.rms.taskqueue.core.publisher.TaskPublisher;
import com.rms.taskqueue.core.retry.RetryPolicy;
import com.rms.taskqueue.rabbitmq.connection.BrokerConnection;
import com.rms.taskqueue.rabbitmq.consumer.AmqpMessageSource;
import com.rms.taskqueue.rabbitmq.publisher.AmqpTaskPublisher;
import com.rms.taskqueue.rabbitmq.topology.TopologyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration that wires up:
 * - the RabbitMQ {@link ConnectionFactory} and the shared {@link BrokerConnection}
 * - topology declaration, publisher and retry policy
 * - the consumer loop and its supervisor (toggle: {@code taskqueue.consumer.enabled})
 *
 * <h2>Connection factory</h2>
 * <ul>
 *   <li>Broker address, credentials and virtual host come from {@code taskqueue.broker-url}.</li>
 *   <li>Connect and handshake are bounded by {@code taskqueue.connect-timeout}.</li>
 *   <li>Automatic recovery is disabled: {@link BrokerConnection} reconnects on demand and
 *       redeclares the topology itself.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * The connection bean is declared with {@code destroyMethod="close"}. The supervisor closes it as
 * well after stopping the consumer; closing twice is harmless.
 */
@Configuration
@EnableConfigurationProperties(TaskQueueProperties.class)
public class RabbitMqConfig {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqConfig.class);

    @Bean
    public ConnectionFactory rabbitConnectionFactory(TaskQueueProperties props) throws Exception {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setUri(props.getBrokerUrl());
        factory.setConnectionTimeout((int) props.getConnectTimeout().toMillis());
        factory.setHandshakeTimeout((int) props.getConnectTimeout().toMillis());
        factory.setRequestedHeartbeat((int) props.getHeartbeat().toSeconds());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);

        // Never log the URL itself: it carries the password.
        log.info("RabbitMQ connection factory host={} port={} vhost={} user={}",
                factory.getHost(), factory.getPort(), factory.getVirtualHost(), mask(factory.getUsername()));
        return factory;
    }

    @Bean
    public TopologyManager topologyManager(TaskQueueProperties props) {
        return new TopologyManager(props);
    }

    @Bean(destroyMethod = "close")
    public BrokerConnection brokerConnection(ConnectionFactory factory,
                                             TopologyManager topologyManager,
                                             TaskQueueProperties props) {
        return new BrokerConnection(factory, topologyManager, props);
    }

    @Bean
    public TaskPublisher taskPublisher(BrokerConnection connection, PayloadCodec codec, TaskQueueProperties props) {
        return new AmqpTaskPublisher(connection, codec, props.getSource(), props.getPublishConfirmTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(TaskPublisher publisher, TaskQueueProperties props, Clock clock) {
        return new RetryPolicy(publisher, props.getRetryDelayMs(), props.getMaxRetries(), clock);
    }

    /**
     * Fallback handler; any {@link TaskHandler} bean defined by the application replaces it.
     */
    @Bean
    @ConditionalOnMissingBean(TaskHandler.class)
    public TaskHandler taskHandler() {
        return new SimulatedFailureTaskHandler();
    }

    @Bean
    @ConditionalOnProperty(prefix = "taskqueue.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MessageSource messageSource(BrokerConnection connection, TaskQueueProperties props) {
        return new AmqpMessageSource(connection, props.getPrefetchCount());
    }

    @Bean
    @ConditionalOnProperty(prefix = "taskqueue.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ConsumerLoop consumerLoop(MessageSource source,
                                     TaskHandler handler,
                                     RetryPolicy retryPolicy,
                                     PayloadCodec codec,
                                     TaskQueueProperties props) {
        return new ConsumerLoop(source, handler, retryPolicy, codec, props.getPollInterval(), props.getStreamErrorPause());
    }

    @Bean
    @ConditionalOnProperty(prefix = "taskqueue.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ConsumerSupervisor consumerSupervisor(BrokerConnection connection,
                                                 ConsumerLoop loop,
                                                 TaskQueueProperties props) {
        return new ConsumerSupervisor(connection, loop, props.getShutdownTimeout());
    }

    /**
     * Example: "guest" becomes "g***t". Not cryptographic; keeps raw identifiers out of logs.
     */
    static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
