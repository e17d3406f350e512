package com.rms.taskqueue.health;

import com.rms.taskqueue.consumer.ConsumerSupervisor;
import com.rms.taskqueue.rabbitmq.connection.BrokerConnection;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator contributor {@code broker}.
 *
 * UP when the broker answers a ping. Details carry the connection state and, when the consumer
 * is enabled, whether its thread is alive.
 */
@Component
public class BrokerHealthIndicator implements HealthIndicator {

    private final BrokerConnection connection;
    private final ObjectProvider<ConsumerSupervisor> supervisor;

    public BrokerHealthIndicator(BrokerConnection connection, ObjectProvider<ConsumerSupervisor> supervisor) {
        this.connection = connection;
        this.supervisor = supervisor;
    }

    @Override
    public Health health() {
        boolean reachable = connection.ping();
        Health.Builder builder = reachable ? Health.up() : Health.down();
        builder.withDetail("connection", connection.getState().name());

        ConsumerSupervisor s = supervisor.getIfAvailable();
        if (s != null) {
            builder.withDetail("consumerRunning", s.isRunning());
            builder.withDetail("consumerState", s.state().name());
        }
        return builder.build();
    }
}
