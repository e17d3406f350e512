package com.rms.taskqueue.rabbitmq.topology;

import com.rabbitmq.client.Channel;

import java.io.IOException;

/**
 * Gives topology declaration access to the channel being set up, and a way to replace it.
 *
 * <p>A channel-level error such as {@code PRECONDITION_FAILED} makes the broker close the channel,
 * so a fallback declaration has to run on a fresh one. The owner of the connection decides how
 * a replacement channel is configured (prefetch, listeners).</p>
 */
public interface ChannelSource {

    Channel current();

    /**
     * Opens a replacement channel on the same connection; it becomes {@link #current()}.
     */
    Channel reopen() throws IOException;
}
