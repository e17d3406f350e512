package com.rms.taskqueue.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.taskqueue.core.codec.PayloadCodec;
import com.rms.taskqueue.core.handler.TaskHandler;
import com.rms.taskqueue.core.model.Destination;
import com.rms.taskqueue.core.model.InboundMessage;
import com.rms.taskqueue.core.model.MessageHeaders;
import com.rms.taskqueue.core.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class ConsumerLoopTest {

    private static final int MAX_RETRIES = 3;

    private InMemoryBroker broker;
    private StopSignal stop;
    private CompletableFuture<Void> running;

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
        stop = new StopSignal();
    }

    @AfterEach
    void tearDown() throws Exception {
        stop.raise();
        if (running != null) {
            running.get(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void successfulMessageIsAcknowledged() throws Exception {
        List<JsonNode> handled = new CopyOnWriteArrayList<>();
        ConsumerLoop loop = start((payload, headers) -> handled.add(payload));

        broker.deliverJson("{\"title\":\"a\"}", Map.of(MessageHeaders.MESSAGE_ID, "m-1"));

        awaitUntil(() -> broker.acked.size() == 1);
        assertEquals("a", handled.get(0).get("title").asText());
        assertTrue(broker.published.isEmpty());
        assertEquals(ConsumerState.RUNNING, loop.state());
    }

    @Test
    void handlerFailureIsRoutedToRetryAndAcknowledged() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        start((payload, headers) -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("first attempt fails");
            }
        });

        broker.deliverJson("{\"title\":\"a\"}", Map.of(MessageHeaders.MESSAGE_ID, "m-2"));

        awaitUntil(() -> broker.acked.size() == 2);
        List<InMemoryBroker.Published> retries = broker.publishedTo(Destination.RETRY);
        assertEquals(1, retries.size());
        assertEquals("m-2", retries.get(0).messageId());
        assertEquals(1, retries.get(0).headers().get(MessageHeaders.RETRY_COUNT));
        assertEquals("IllegalStateException", retries.get(0).headers().get(MessageHeaders.RETRY_REASON));
        assertEquals(Duration.ofMillis(1000), retries.get(0).expiration());
        // The redelivered copy carries the retry count of its previous failures.
        assertEquals(1, broker.acked.get(1).retryState().retryCount());
        assertTrue(broker.publishedTo(Destination.DEAD_LETTER).isEmpty());
    }

    @Test
    @DisplayName("fewer failures than the retry budget: acknowledged eventually, never dead-lettered")
    void transientFailuresRecover() throws Exception {
        int failures = MAX_RETRIES - 1;
        AtomicInteger calls = new AtomicInteger();
        Map<Integer, Object> seenRetryCounts = new ConcurrentHashMap<>();
        start((payload, headers) -> {
            int call = calls.incrementAndGet();
            seenRetryCounts.put(call, headers.getOrDefault(MessageHeaders.RETRY_COUNT, 0));
            if (call <= failures) {
                throw new RuntimeException("transient");
            }
        });

        broker.deliverJson("{}", Map.of(MessageHeaders.MESSAGE_ID, "m-3"));

        awaitUntil(() -> calls.get() == failures + 1 && broker.acked.size() == failures + 1);
        assertEquals(failures, Integer.parseInt(seenRetryCounts.get(failures + 1).toString()));
        assertTrue(broker.publishedTo(Destination.DEAD_LETTER).isEmpty());
        assertEquals(failures, broker.publishedTo(Destination.RETRY).size());
    }

    @Test
    @DisplayName("always failing: dead-lettered exactly once after the retry budget, id preserved")
    void permanentFailureEndsInDeadLetter() throws Exception {
        start((payload, headers) -> {
            throw new UnsupportedOperationException("never works");
        });

        broker.deliverJson("{\"n\":1}", Map.of(MessageHeaders.MESSAGE_ID, "m-4"));

        awaitUntil(() -> broker.publishedTo(Destination.DEAD_LETTER).size() == 1 && broker.pending() == 0
                && broker.acked.size() == MAX_RETRIES + 1);

        List<InMemoryBroker.Published> retries = broker.publishedTo(Destination.RETRY);
        assertEquals(List.of(Duration.ofMillis(1000), Duration.ofMillis(2000), Duration.ofMillis(4000)),
                retries.stream().map(InMemoryBroker.Published::expiration).toList());
        retries.forEach(r -> assertEquals("m-4", r.messageId()));

        InMemoryBroker.Published dead = broker.publishedTo(Destination.DEAD_LETTER).get(0);
        assertEquals("m-4", dead.messageId());
        assertEquals(MAX_RETRIES, dead.headers().get(MessageHeaders.TOTAL_RETRY_COUNT));
        assertEquals("UnsupportedOperationException", dead.headers().get(MessageHeaders.FINAL_FAILURE_REASON));
    }

    @Test
    void invalidPayloadIsDeadLetteredWithoutRetries() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        start((payload, headers) -> calls.incrementAndGet());

        broker.deliverRaw("{broken".getBytes(StandardCharsets.UTF_8), Map.of(MessageHeaders.MESSAGE_ID, "m-5"));

        awaitUntil(() -> broker.acked.size() == 1);
        assertEquals(0, calls.get());
        assertTrue(broker.publishedTo(Destination.RETRY).isEmpty());

        InMemoryBroker.Published dead = broker.publishedTo(Destination.DEAD_LETTER).get(0);
        assertEquals(Map.of("raw", "{broken"), dead.payload());
        assertEquals("invalid-payload", dead.headers().get(MessageHeaders.FINAL_FAILURE_REASON));
        assertEquals(0, dead.headers().get(MessageHeaders.TOTAL_RETRY_COUNT));
    }

    @Test
    void failedRerouteRequeuesAndReopensStream() throws Exception {
        broker.failingPublishes.set(1);
        AtomicInteger calls = new AtomicInteger();
        start((payload, headers) -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("fail once");
            }
        });

        broker.deliverJson("{}", Map.of(MessageHeaders.MESSAGE_ID, "m-6"));

        awaitUntil(() -> broker.requeued.size() == 1 && broker.opens.get() >= 2);
        assertTrue(broker.acked.isEmpty());
        assertEquals("m-6", broker.requeued.get(0).messageId());
    }

    @Test
    void streamErrorsArePausedAndRecovered() throws Exception {
        broker.failingPolls.set(2);
        start((payload, headers) -> { });

        broker.deliverJson("{}", Map.of());

        awaitUntil(() -> broker.acked.size() == 1);
        assertEquals(3, broker.opens.get());
    }

    @Test
    void stopSignalEndsRunWithinOnePollInterval() throws Exception {
        ConsumerLoop loop = start((payload, headers) -> { });
        awaitUntil(() -> broker.opens.get() == 1);

        long started = System.nanoTime();
        stop.raise();
        running.get(2, TimeUnit.SECONDS);

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 1000);
        assertEquals(ConsumerState.STOPPED, loop.state());
    }

    @Test
    void deliveryReceivedAfterStopIsLeftUnacknowledged() {
        broker.deliverJson("{}", Map.of(MessageHeaders.MESSAGE_ID, "m-8"));
        MessageStream inner = broker.open();
        MessageStream stopsWhilePolling = new MessageStream() {
            @Override
            public InboundMessage poll(Duration timeout) throws InterruptedException {
                InboundMessage message = inner.poll(timeout);
                stop.raise();
                return message;
            }

            @Override
            public void ack(InboundMessage message) {
                inner.ack(message);
            }

            @Override
            public void requeue(InboundMessage message) {
                inner.requeue(message);
            }

            @Override
            public void close() {
            }
        };
        AtomicInteger calls = new AtomicInteger();
        ConsumerLoop loop = new ConsumerLoop(() -> stopsWhilePolling, (p, h) -> calls.incrementAndGet(),
                new RetryPolicy(broker, 1000, MAX_RETRIES, Clock.systemUTC()),
                new PayloadCodec(new ObjectMapper()), Duration.ofMillis(20), Duration.ofMillis(10));

        loop.run(stop);

        assertEquals(0, calls.get());
        assertTrue(broker.acked.isEmpty());
        assertTrue(broker.published.isEmpty());
        assertEquals(ConsumerState.STOPPED, loop.state());
    }

    @Test
    void unexpectedErrorsAreRethrown() {
        ConsumerLoop loop = new ConsumerLoop(() -> {
            throw new IllegalStateException("bug");
        }, (p, h) -> { }, new RetryPolicy(broker, 1000, MAX_RETRIES, Clock.systemUTC()),
                new PayloadCodec(new ObjectMapper()), Duration.ofMillis(20), Duration.ofMillis(10));

        assertThrows(IllegalStateException.class, () -> loop.run(stop));
        assertEquals(ConsumerState.STOPPED, loop.state());
    }

    @Test
    void messageIdIsInMdcWhileHandling() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        start((payload, headers) -> seen.add(MDC.get(MessageHeaders.MESSAGE_ID)));

        broker.deliverJson("{}", Map.of(MessageHeaders.MESSAGE_ID, "m-7"));

        awaitUntil(() -> broker.acked.size() == 1);
        assertEquals(List.of("m-7"), seen);
    }

    @Test
    void runningTwiceConcurrentlyIsRejected() throws Exception {
        ConsumerLoop loop = start((payload, headers) -> { });
        awaitUntil(() -> loop.state() == ConsumerState.RUNNING);

        assertThrows(IllegalStateException.class, () -> loop.run(new StopSignal()));
    }

    @Test
    @DisplayName("id generated at publish time is kept on every retry and on the dead-letter copy")
    void generatedMessageIdSurvivesEveryHop() throws Exception {
        start((payload, headers) -> {
            throw new IllegalStateException("always fails");
        });

        String id = broker.publishToMain(Map.of("title", "no id given"));

        awaitUntil(() -> broker.publishedTo(Destination.DEAD_LETTER).size() == 1 && broker.pending() == 0
                && broker.acked.size() == MAX_RETRIES + 1);

        assertNotNull(id);
        assertFalse(id.isBlank());
        assertEquals(id, broker.publishedTo(Destination.MAIN).get(0).messageId());

        List<InMemoryBroker.Published> retries = broker.publishedTo(Destination.RETRY);
        assertEquals(MAX_RETRIES, retries.size());
        for (InMemoryBroker.Published retry : retries) {
            assertEquals(id, retry.messageId());
            assertEquals(id, retry.headers().get(MessageHeaders.MESSAGE_ID));
        }

        InMemoryBroker.Published dead = broker.publishedTo(Destination.DEAD_LETTER).get(0);
        assertEquals(id, dead.messageId());
        assertEquals(id, dead.headers().get(MessageHeaders.MESSAGE_ID));
        broker.acked.forEach(m -> assertEquals(id, m.messageId()));
    }

    private ConsumerLoop start(TaskHandler handler) {
        ConsumerLoop loop = newLoop(handler);
        running = CompletableFuture.runAsync(() -> loop.run(stop));
        return loop;
    }

    private ConsumerLoop newLoop(TaskHandler handler) {
        RetryPolicy policy = new RetryPolicy(broker, 1000, MAX_RETRIES, Clock.systemUTC());
        return new ConsumerLoop(broker, handler, policy, new PayloadCodec(new ObjectMapper()),
                Duration.ofMillis(20), Duration.ofMillis(10));
    }

    private static void awaitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
