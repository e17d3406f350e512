package com.rms.taskqueue.rabbitmq.topology;

import com.rms.taskqueue.core.model.Destination;

/**
 * Handle to a declared topology: the exchange and the queue behind each destination.
 * Queue names are also the routing keys.
 */
public record DeclaredTopology(String exchange, String mainQueue, String retryQueue, String deadLetterQueue) {

    public String queueFor(Destination destination) {
        return switch (destination) {
            case MAIN -> mainQueue;
            case RETRY -> retryQueue;
            case DEAD_LETTER -> deadLetterQueue;
        };
    }

    public String routingKey(Destination destination) {
        return queueFor(destination);
    }
}
