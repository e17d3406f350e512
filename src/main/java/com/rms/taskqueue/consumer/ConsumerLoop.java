package com.rms.taskqueue.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.taskqueue.core.codec.PayloadCodec;
import com.rms.taskqueue.core.exception.ConsumerStreamException;
import com.rms.taskqueue.core.exception.NotConnectedException;
import com.rms.taskqueue.core.exception.PayloadParseException;
import com.rms.taskqueue.core.exception.TaskQueueException;
import com.rms.taskqueue.core.handler.TaskHandler;
import com.rms.taskqueue.core.model.InboundMessage;
import com.rms.taskqueue.core.model.MessageHeaders;
import com.rms.taskqueue.core.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * =====================================================================
 * ConsumerLoop
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Pulls messages from the main destination one at a time, hands them to
 * the {@link TaskHandler} and makes sure every delivery ends up either
 * acknowledged or re-routed through the {@link RetryPolicy}.
 *
 * PER-DELIVERY OUTCOMES
 * ---------------------
 *   body not JSON      → dead-letter ("invalid-payload"), ack
 *   handler succeeds   → ack
 *   handler throws     → retry or dead-letter (reason = exception class), ack
 *   re-route fails     → nack with requeue, stream reopened
 *   stop raised        → leave unacknowledged, return
 *
 * A delivery is acknowledged only after its retry/dead-letter copy was
 * confirmed by the broker, so a crash in between duplicates the message
 * rather than losing it.
 *
 * STREAM ERRORS
 * -------------
 * A broken stream (broker outage, consumer cancelled, channel closed) is
 * logged, followed by a short pause and a fresh stream. Anything else is
 * logged and rethrown to the caller.
 *
 * STOPPING
 * --------
 * {@link StopSignal} is checked between deliveries; polling uses a short
 * timeout so a raised signal is seen within one poll interval. A thread
 * interrupt ends the loop immediately and leaves the in-flight delivery
 * unacknowledged.
 */
public class ConsumerLoop {

    private static final Logger log = LoggerFactory.getLogger(ConsumerLoop.class);

    static final String INVALID_PAYLOAD = "invalid-payload";

    private final MessageSource source;
    private final TaskHandler handler;
    private final RetryPolicy retryPolicy;
    private final PayloadCodec codec;
    private final Duration pollInterval;
    private final Duration streamErrorPause;

    private final AtomicReference<ConsumerState> state = new AtomicReference<>(ConsumerState.NOT_RUNNING);

    public ConsumerLoop(MessageSource source,
                        TaskHandler handler,
                        RetryPolicy retryPolicy,
                        PayloadCodec codec,
                        Duration pollInterval,
                        Duration streamErrorPause) {
        this.source = source;
        this.handler = handler;
        this.retryPolicy = retryPolicy;
        this.codec = codec;
        this.pollInterval = pollInterval;
        this.streamErrorPause = streamErrorPause;
    }

    /**
     * Consumes until {@code stop} is raised or the thread is interrupted.
     *
     * @throws IllegalStateException if the loop is already running
     */
    public void run(StopSignal stop) {
        if (!state.compareAndSet(ConsumerState.NOT_RUNNING, ConsumerState.RUNNING)
                && !state.compareAndSet(ConsumerState.STOPPED, ConsumerState.RUNNING)) {
            throw new IllegalStateException("Consumer loop is already running");
        }
        log.info("Consumer started");

        try {
            while (!stop.isRaised()) {
                try (MessageStream stream = source.open()) {
                    consume(stream, stop);
                } catch (NotConnectedException | ConsumerStreamException e) {
                    if (stop.isRaised()) {
                        log.info("Consumer stopped during stream error: {}", e.getMessage());
                        break;
                    }
                    log.warn("Error in message stream; reopening after {} ms: {}",
                            streamErrorPause.toMillis(), e.toString());
                    stop.await(streamErrorPause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Consumer interrupted; in-flight message left unacknowledged");
        } catch (RuntimeException e) {
            log.error("Unexpected error in consumer", e);
            throw e;
        } finally {
            state.set(ConsumerState.STOPPED);
            log.info("Consumer stopped");
        }
    }

    /**
     * Marks the loop as stopping. The caller still has to raise the {@link StopSignal}.
     */
    public void markStopping() {
        state.compareAndSet(ConsumerState.RUNNING, ConsumerState.STOPPING);
    }

    public ConsumerState state() {
        return state.get();
    }

    private void consume(MessageStream stream, StopSignal stop) throws InterruptedException {
        while (!stop.isRaised()) {
            InboundMessage message = stream.poll(pollInterval);
            if (message == null) {
                continue;
            }
            if (stop.isRaised()) {
                log.info("Stop requested; leaving message_id={} for redelivery", message.messageId());
                return;
            }
            process(stream, message);
        }
    }

    void process(MessageStream stream, InboundMessage message) throws InterruptedException {
        MDC.put(MessageHeaders.MESSAGE_ID, message.messageId());
        try {
            if (message.retryState().isRetried()) {
                log.info("Retry attempt retry_count={} last_reason={}",
                        message.retryState().retryCount(), message.retryState().retryReason());
            }
            JsonNode payload;
            try {
                payload = codec.decode(message.body());
            } catch (PayloadParseException e) {
                log.warn("Invalid JSON payload; sending to dead-letter: {}", e.getMessage());
                reroute(stream, message, () ->
                        retryPolicy.routeToDeadLetter(PayloadCodec.rawEnvelope(message.body()), message, INVALID_PAYLOAD));
                return;
            }

            try {
                handler.handle(payload, message.headers());
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Processing failed; routing to retry/dead-letter retry_count={} error={}",
                        message.retryState().retryCount(), e.toString());
                reroute(stream, message, () ->
                        retryPolicy.routeFailure(payload, message, e.getClass().getSimpleName()));
                return;
            }

            stream.ack(message);
            log.info("Message processed retry_count={}", message.retryState().retryCount());
        } finally {
            MDC.remove(MessageHeaders.MESSAGE_ID);
        }
    }

    private void reroute(MessageStream stream, InboundMessage message, Runnable route) {
        try {
            route.run();
        } catch (TaskQueueException e) {
            log.error("Re-routing failed; requeueing message: {}", e.toString());
            try {
                stream.requeue(message);
            } catch (ConsumerStreamException requeueFailure) {
                e.addSuppressed(requeueFailure);
            }
            throw new ConsumerStreamException("Failed to re-route message " + message.messageId(), e);
        }
        stream.ack(message);
    }
}
