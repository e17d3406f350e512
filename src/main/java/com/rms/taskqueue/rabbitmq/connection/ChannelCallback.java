package com.rms.taskqueue.rabbitmq.connection;

import com.rabbitmq.client.Channel;

import java.io.IOException;

/**
 * An operation run against the shared channel while holding its monitor.
 */
@FunctionalInterface
public interface ChannelCallback<T> {

    T doInChannel(Channel channel) throws IOException;
}
