package com.rms.taskqueue;

import com.rms.taskqueue.admin.QueueAdminController;
import com.rms.taskqueue.consumer.ConsumerSupervisor;
import com.rms.taskqueue.consumer.SimulatedFailureTaskHandler;
import com.rms.taskqueue.core.handler.TaskHandler;
import com.rms.taskqueue.core.publisher.TaskPublisher;
import com.rms.taskqueue.core.retry.RetryPolicy;
import com.rms.taskqueue.rabbitmq.connection.BrokerConnection;
import com.rms.taskqueue.rabbitmq.publisher.AmqpTaskPublisher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring check with the consumer disabled, so no broker is contacted.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "taskqueue.consumer.enabled=false",
                "taskqueue.admin.enabled=true",
                "taskqueue.max-retries=7",
                "taskqueue.retry-delay-ms=1500"
        })
class TaskQueueApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextWiresPublisherPolicyAndDefaultHandler() {
        assertTrue(context.getBean(TaskPublisher.class) instanceof AmqpTaskPublisher);
        assertTrue(context.getBean(TaskHandler.class) instanceof SimulatedFailureTaskHandler);
        assertFalse(context.getBean(BrokerConnection.class).isReady());
        assertNotNull(context.getBean(QueueAdminController.class));
        assertTrue(context.getBeansOfType(ConsumerSupervisor.class).isEmpty());

        RetryPolicy policy = context.getBean(RetryPolicy.class);
        assertEquals(7, policy.getMaxRetries());
        assertEquals(1500, policy.getBaseDelayMs());
    }
}
