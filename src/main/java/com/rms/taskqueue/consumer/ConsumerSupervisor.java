package com.rms.taskqueue.consumer;

import com.rms.taskqueue.rabbitmq.connection.BrokerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the {@link ConsumerLoop} for the lifetime of the application.
 *
 * <h2>Startup</h2>
 * Runs after the context is refreshed. The initial broker connection is made synchronously, so a
 * broker that is down (or a strict topology conflict) fails application startup. Once connected,
 * the loop is subscribed on {@link Schedulers#boundedElastic()}, since it blocks on the broker.
 *
 * <h2>Shutdown</h2>
 * <ol>
 *   <li>Raise the stop signal and wait up to the shutdown timeout for the loop to return.</li>
 *   <li>On timeout, dispose the subscription (interrupting the consumer thread) and wait a bounded
 *       time for the loop to exit.</li>
 *   <li>Close the broker connection.</li>
 * </ol>
 * Errors along the way are logged; shutdown never throws into the container.
 */
public class ConsumerSupervisor implements ApplicationRunner, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ConsumerSupervisor.class);

    private final BrokerConnection connection;
    private final ConsumerLoop loop;
    private final Duration shutdownTimeout;

    private final AtomicReference<Running> running = new AtomicReference<>();

    public ConsumerSupervisor(BrokerConnection connection, ConsumerLoop loop, Duration shutdownTimeout) {
        this.connection = connection;
        this.loop = loop;
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public void run(ApplicationArguments args) {
        start();
    }

    /**
     * Connects and subscribes the consumer loop. Calling it again while running is a no-op.
     */
    public synchronized void start() {
        if (running.get() != null) {
            return;
        }
        connection.connect();

        StopSignal signal = new StopSignal();
        CountDownLatch exited = new CountDownLatch(1);
        Disposable subscription = Mono.fromRunnable(() -> {
                    try {
                        loop.run(signal);
                    } finally {
                        exited.countDown();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        v -> { },
                        err -> log.error("Consumer task ended with failure: {}", err.toString())
                );
        running.set(new Running(signal, subscription, exited));
        log.info("Consumer supervisor started");
    }

    public boolean isRunning() {
        Running r = running.get();
        return r != null && r.exited().getCount() > 0;
    }

    public ConsumerState state() {
        return loop.state();
    }

    /**
     * Stops the consumer and closes the broker connection. Idempotent.
     */
    public void shutdown() {
        Running r = running.getAndSet(null);
        if (r != null) {
            loop.markStopping();
            r.signal().raise();
            awaitStop(r);
        }

        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("Error closing RabbitMQ connection on shutdown: {}", e.toString());
        }
        log.info("Consumer supervisor stopped");
    }

    @Override
    public void destroy() {
        shutdown();
    }

    private void awaitStop(Running r) {
        try {
            if (r.exited().await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
            log.warn("Consumer did not stop within {} ms; cancelling", shutdownTimeout.toMillis());
            r.subscription().dispose();
            if (!r.exited().await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Consumer thread still alive after cancellation");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            r.subscription().dispose();
        }
    }

    private record Running(StopSignal signal, Disposable subscription, CountDownLatch exited) {
    }
}
