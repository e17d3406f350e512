package com.rms.taskqueue.rabbitmq.connection;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rms.taskqueue.core.exception.NotConnectedException;
import com.rms.taskqueue.core.exception.TaskQueueException;
import com.rms.taskqueue.core.model.ConnectionState;
import com.rms.taskqueue.core.model.Destination;
import com.rms.taskqueue.rabbitmq.config.TaskQueueProperties;
import com.rms.taskqueue.rabbitmq.topology.ChannelSource;
import com.rms.taskqueue.rabbitmq.topology.DeclaredTopology;
import com.rms.taskqueue.rabbitmq.topology.TopologyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * =====================================================================
 * BrokerConnection
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Owns the single AMQP connection and channel of this process, together
 * with the topology declared on them.
 *
 * The publisher, the consumer's message source, the health check and the
 * admin endpoints all go through this object. It is the only place that
 * changes {@link ConnectionState}.
 *
 * RECONNECTION
 * ------------
 * There is no background reconnect. The client library's automatic
 * recovery is switched off in the {@link ConnectionFactory}; callers ask
 * {@link #isReady()} and call {@link #connect()} when they need the
 * broker. A dropped connection therefore heals on the next publish or on
 * the consumer's next stream reopen.
 *
 * THREADING
 * ---------
 * - connect() and close() are serialized by a lock
 * - every channel operation runs under the channel monitor
 *   ({@link #withChannel(ChannelCallback)}), since an AMQP channel must
 *   not be used by two threads at once
 */
public class BrokerConnection {

    private static final Logger log = LoggerFactory.getLogger(BrokerConnection.class);

    private static final String CONNECTION_NAME = "task-queue";

    private final ConnectionFactory factory;
    private final TopologyManager topologyManager;
    private final int prefetchCount;
    private final Duration closeTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final Object channelMonitor = new Object();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Connection connection;
    private volatile Channel channel;
    private volatile DeclaredTopology topology;

    public BrokerConnection(ConnectionFactory factory, TopologyManager topologyManager, TaskQueueProperties props) {
        this.factory = factory;
        this.topologyManager = topologyManager;
        this.prefetchCount = props.getPrefetchCount();
        this.closeTimeout = props.getCloseTimeout();
    }

    /**
     * Opens connection and channel and declares the topology, unless already ready.
     *
     * <p>On failure everything opened so far is closed again and the state returns to
     * {@link ConnectionState#DISCONNECTED}, so the next call starts from scratch.</p>
     *
     * @throws NotConnectedException when the broker cannot be reached or set up
     * @throws com.rms.taskqueue.core.exception.TopologyConflictException in strict topology mode
     */
    public void connect() {
        lock.lock();
        try {
            if (isReady()) {
                return;
            }
            // Leftovers of a half-dead connection (e.g. channel closed by the broker).
            releaseHandles();

            state = ConnectionState.CONNECTING;
            try {
                connection = factory.newConnection(CONNECTION_NAME);
                channel = openChannel(connection);
                topology = topologyManager.declare(new ReopeningChannelSource());
                state = ConnectionState.READY;

                log.info("Connected to RabbitMQ host={} port={} prefetch={}",
                        factory.getHost(), factory.getPort(), prefetchCount);
            } catch (TaskQueueException e) {
                releaseHandles();
                throw e;
            } catch (IOException | TimeoutException | RuntimeException e) {
                releaseHandles();
                throw new NotConnectedException("Failed to connect to RabbitMQ: " + e.getMessage(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * True iff connection and channel are open and the topology has been declared.
     */
    public boolean isReady() {
        Connection c = connection;
        Channel ch = channel;
        return c != null && c.isOpen()
                && ch != null && ch.isOpen()
                && topology != null;
    }

    public ConnectionState getState() {
        if (isReady()) {
            return ConnectionState.READY;
        }
        return state == ConnectionState.CONNECTING ? ConnectionState.CONNECTING : ConnectionState.DISCONNECTED;
    }

    /**
     * @return the declared topology, or {@code null} when not connected
     */
    public DeclaredTopology topology() {
        return isReady() ? topology : null;
    }

    /**
     * Runs a channel operation while holding the channel monitor.
     *
     * @throws NotConnectedException when not ready; this method never connects
     */
    public <T> T withChannel(ChannelCallback<T> callback) throws IOException {
        Channel ch = channel;
        if (!isReady()) {
            throw new NotConnectedException("RabbitMQ connection is not ready");
        }
        synchronized (channelMonitor) {
            return callback.doInChannel(ch);
        }
    }

    /**
     * Connects on demand, then passively declares the main queue.
     *
     * @return {@code true} when the broker answered; {@code false} on any failure
     */
    public boolean ping() {
        try {
            connect();
            withChannel(ch -> ch.queueDeclarePassive(topology.mainQueue()));
            return true;
        } catch (Exception e) {
            log.warn("RabbitMQ ping failed: {}", e.toString());
            return false;
        }
    }

    /**
     * Reports depth and consumer count of a destination queue. Connects on demand.
     *
     * @throws NotConnectedException when the connection was closed again before the queue could be inspected
     */
    public DestinationStats inspect(Destination destination) throws IOException {
        connect();
        DeclaredTopology t = topology();
        if (t == null) {
            throw new NotConnectedException("RabbitMQ topology is not declared");
        }
        String queue = t.queueFor(destination);
        AMQP.Queue.DeclareOk ok = withChannel(ch -> ch.queueDeclarePassive(queue));
        return new DestinationStats(destination, queue, ok.getMessageCount(), ok.getConsumerCount());
    }

    /**
     * Closes channel, then connection. Idempotent and never throws.
     *
     * <p>Each close is bounded by the configured close timeout; a timeout or close error is
     * logged and otherwise ignored. Afterwards the state is always
     * {@link ConnectionState#DISCONNECTED}, so {@link #connect()} can be called again.</p>
     */
    public void close() {
        lock.lock();
        try {
            if (connection == null && channel == null) {
                state = ConnectionState.DISCONNECTED;
                return;
            }
            releaseHandles();
            log.info("RabbitMQ connection closed");
        } finally {
            lock.unlock();
        }
    }

    private Channel openChannel(Connection c) throws IOException {
        Channel ch = c.createChannel();
        if (ch == null) {
            throw new IOException("No channel available on connection");
        }
        ch.basicQos(prefetchCount);
        ch.confirmSelect();
        return ch;
    }

    private void releaseHandles() {
        Channel ch = channel;
        Connection c = connection;
        channel = null;
        connection = null;
        topology = null;
        state = ConnectionState.DISCONNECTED;

        if (ch != null && ch.isOpen()) {
            closeBounded("channel", () -> {
                ch.close();
                return null;
            });
        }
        if (c != null && c.isOpen()) {
            try {
                c.close((int) closeTimeout.toMillis());
            } catch (IOException | RuntimeException e) {
                log.warn("RabbitMQ connection close failed: {}", e.toString());
            }
        }
    }

    private void closeBounded(String name, Callable<Void> closer) {
        CompletableFuture<Void> future = CompletableFuture.supplyAsync(() -> {
            try {
                return closer.call();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        try {
            future.get(closeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("RabbitMQ {} close timed out after {} ms", name, closeTimeout.toMillis());
        } catch (ExecutionException e) {
            log.warn("RabbitMQ {} close failed: {}", name, e.getCause().toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing RabbitMQ {}", name);
        }
    }

    /**
     * Hands the topology manager the channel being set up. A reopened channel gets the same
     * prefetch and confirm mode and replaces the current one.
     */
    private final class ReopeningChannelSource implements ChannelSource {

        @Override
        public Channel current() {
            return channel;
        }

        @Override
        public Channel reopen() throws IOException {
            Channel ch = openChannel(connection);
            channel = ch;
            return ch;
        }
    }
}
