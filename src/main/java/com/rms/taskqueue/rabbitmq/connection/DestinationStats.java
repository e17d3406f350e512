package com.rms.taskqueue.rabbitmq.connection;

import com.rms.taskqueue.core.model.Destination;

/**
 * Point-in-time view of a destination queue, as reported by a passive declaration.
 */
public record DestinationStats(Destination destination, String queue, long messageCount, long consumerCount) {
}
