package com.myorg.eventbus.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.contracts.core.exception.EventBusNonRetryableException;
import com.myorg.eventbus.kafka.dlq.DeadLetterPublisher;
import com.myorg.eventbus.kafka.exception.ConsumeParseException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class RetryingRecordListenerTest {

    private static final String VALID = """
            {"id":"evt-1","type":"order.created","source":"order-service",
             "time":"2024-03-01T10:00:00Z","data":{"orderId":"o-1"}}""";

    private final EnvelopeCodec codec = new EnvelopeCodec(new ObjectMapper());
    private final DeadLetterPublisher deadLetters = mock(DeadLetterPublisher.class);
    private final List<Long> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private RetryingRecordListener listener(MessageHandler handler, boolean strict, boolean deadLetterOnFailure, Sleeper sleeper) {
        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(3);
        backOff.setInitialInterval(200);
        backOff.setMultiplier(2.0);
        return new RetryingRecordListener("orders", handler, codec, deadLetters, backOff, 3,
                strict, deadLetterOnFailure, sleeper, MessageBusMetrics.noop());
    }

    private RetryingRecordListener listener(MessageHandler handler) {
        return listener(handler, true, true, recordingSleeper);
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("orders", 0, 42L, "evt-1", value);
    }

    @Test
    void alwaysFailingHandler_isRetriedThreeTimesWithExponentialBackoff_thenDeadLettered() {
        AtomicInteger invocations = new AtomicInteger();
        ConsumerRecord<String, String> rec = record(VALID);

        listener((r, e, t) -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("downstream unavailable");
        }).onMessage(rec);

        assertThat(invocations).hasValue(4);
        assertThat(sleeps).containsExactly(200L, 400L, 800L);
        verify(deadLetters).send(eq(rec), eq("orders"), any(IllegalStateException.class), eq("RETRY_EXHAUSTED"));
    }

    @Test
    void handlerSucceedingOnThirdAttempt_isNotDeadLettered() {
        AtomicInteger invocations = new AtomicInteger();

        listener((r, e, t) -> {
            if (invocations.incrementAndGet() < 3) throw new IllegalStateException("flaky");
        }).onMessage(record(VALID));

        assertThat(invocations).hasValue(3);
        assertThat(sleeps).containsExactly(200L, 400L);
        verifyNoInteractions(deadLetters);
    }

    @Test
    void handlerReceivesDecodedEnvelopeAndTopic() {
        AtomicReference<EventEnvelope> seen = new AtomicReference<>();
        AtomicReference<String> seenTopic = new AtomicReference<>();

        listener((r, e, t) -> {
            seen.set(e);
            seenTopic.set(t);
        }).onMessage(record(VALID));

        assertThat(seen.get().getId()).isEqualTo("evt-1");
        assertThat(seen.get().getData().get("orderId").asText()).isEqualTo("o-1");
        assertThat(seenTopic.get()).isEqualTo("orders");
    }

    @Test
    void unparseableValue_goesStraightToDlq_withoutInvokingHandler() {
        AtomicInteger invocations = new AtomicInteger();
        ConsumerRecord<String, String> rec = record("{not json");

        listener((r, e, t) -> invocations.incrementAndGet()).onMessage(rec);

        assertThat(invocations).hasValue(0);
        assertThat(sleeps).isEmpty();
        verify(deadLetters).send(eq(rec), eq("orders"), any(ConsumeParseException.class), eq("DESERIALIZATION"));
    }

    @Test
    void envelopeMissingRequiredFields_isRejectedInStrictMode_butAcceptedLeniently() {
        String partial = "{\"type\":\"order.created\",\"data\":{}}";
        AtomicInteger invocations = new AtomicInteger();

        listener((r, e, t) -> invocations.incrementAndGet()).onMessage(record(partial));
        assertThat(invocations).hasValue(0);
        verify(deadLetters).send(any(), eq("orders"), any(ConsumeParseException.class), eq("DESERIALIZATION"));

        listener((r, e, t) -> invocations.incrementAndGet(), false, true, recordingSleeper).onMessage(record(partial));
        assertThat(invocations).hasValue(1);
    }

    @Test
    void nonRetryableFailure_skipsRetries_andUsesItsReason() {
        AtomicInteger invocations = new AtomicInteger();

        listener((r, e, t) -> {
            invocations.incrementAndGet();
            throw new EventBusNonRetryableException("PAYLOAD_INVALID", "orderId missing");
        }).onMessage(record(VALID));

        assertThat(invocations).hasValue(1);
        assertThat(sleeps).isEmpty();
        verify(deadLetters).send(any(), eq("orders"), any(EventBusNonRetryableException.class), eq("PAYLOAD_INVALID"));
    }

    @Test
    void interruptedDuringBackoff_deadLettersAndRestoresInterruptFlag() {
        AtomicInteger invocations = new AtomicInteger();
        Sleeper interrupting = millis -> {
            throw new InterruptedException("shutdown");
        };

        listener((r, e, t) -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("boom");
        }, true, true, interrupting).onMessage(record(VALID));

        assertThat(invocations).hasValue(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        verify(deadLetters).send(any(), eq("orders"), any(IllegalStateException.class), eq("INTERRUPTED"));
    }

    @Test
    void dlqConsumer_doesNotDeadLetterItsOwnFailures() {
        listener((r, e, t) -> {
            throw new IllegalStateException("still broken");
        }, false, false, recordingSleeper).onMessage(record(VALID));

        assertThat(sleeps).hasSize(3);
        verify(deadLetters, never()).send(any(), anyString(), any(), anyString());
    }

    @Test
    void mdcIsPopulatedDuringHandling_andClearedAfterwards() {
        AtomicReference<String> topicInMdc = new AtomicReference<>();
        AtomicReference<String> eventIdInMdc = new AtomicReference<>();

        listener((r, e, t) -> {
            topicInMdc.set(MDC.get(EventBusMdc.TOPIC));
            eventIdInMdc.set(MDC.get(EventBusMdc.EVENT_ID));
        }).onMessage(record(VALID));

        assertThat(topicInMdc.get()).isEqualTo("orders");
        assertThat(eventIdInMdc.get()).isEqualTo("evt-1");
        assertThat(MDC.get(EventBusMdc.TOPIC)).isNull();
        assertThat(MDC.get(EventBusMdc.EVENT_ID)).isNull();
    }

    @Test
    void realBackoff_waitsAtLeastTheSumOfDelays() {
        long started = System.nanoTime();

        listener((r, e, t) -> {
            throw new IllegalStateException("boom");
        }, true, true, Sleeper.threadSleep()).onMessage(record(VALID));

        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        assertThat(elapsedMs).isGreaterThanOrEqualTo(1400);
    }
}
