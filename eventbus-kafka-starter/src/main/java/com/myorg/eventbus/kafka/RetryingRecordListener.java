package com.myorg.eventbus.kafka;

import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.contracts.core.exception.EventBusNonRetryableException;
import com.myorg.eventbus.kafka.dlq.DeadLetterPublisher;
import com.myorg.eventbus.kafka.dlq.DlqReason;
import com.myorg.eventbus.kafka.exception.ConsumeParseException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

/**
 * Per-record pipeline: decode, invoke the handler with in-place retries, dead-letter on give-up.
 * Retries block the partition; nothing escapes to the container so the offset always advances.
 */
@Slf4j
public class RetryingRecordListener implements MessageListener<String, String> {

    private final String topic;
    private final MessageHandler handler;
    private final EnvelopeCodec codec;
    private final DeadLetterPublisher deadLetters;
    private final BackOff backOff;
    private final int maxRetries;
    private final boolean strictEnvelope;
    // false for DLQ consumers: a failing dead letter is logged, not re-dead-lettered
    private final boolean deadLetterOnFailure;
    private final Sleeper sleeper;
    private final MessageBusMetrics metrics;

    public RetryingRecordListener(String topic,
                                  MessageHandler handler,
                                  EnvelopeCodec codec,
                                  DeadLetterPublisher deadLetters,
                                  BackOff backOff,
                                  int maxRetries,
                                  boolean strictEnvelope,
                                  boolean deadLetterOnFailure,
                                  Sleeper sleeper,
                                  MessageBusMetrics metrics) {
        this.topic = topic;
        this.handler = handler;
        this.codec = codec;
        this.deadLetters = deadLetters;
        this.backOff = backOff;
        this.maxRetries = maxRetries;
        this.strictEnvelope = strictEnvelope;
        this.deadLetterOnFailure = deadLetterOnFailure;
        this.sleeper = sleeper != null ? sleeper : Sleeper.threadSleep();
        this.metrics = metrics != null ? metrics : MessageBusMetrics.noop();
    }

    @Override
    public void onMessage(ConsumerRecord<String, String> record) {
        EventBusMdc.put(record);
        try {
            EventEnvelope event;
            try {
                event = codec.decode(record.value(), strictEnvelope);
            } catch (ConsumeParseException e) {
                log.error("Failed to parse message from {} partition={} offset={}: {}",
                        topic, record.partition(), record.offset(), e.getMessage());
                giveUp(record, e, DlqReason.DESERIALIZATION.code());
                return;
            }
            EventBusMdc.put(event);
            process(record, event);
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing message from {}", topic, e);
            giveUp(record, e, DlqReason.UNKNOWN.code());
        } finally {
            EventBusMdc.clear();
        }
    }

    private void process(ConsumerRecord<String, String> record, EventEnvelope event) {
        BackOffExecution execution = backOff.start();
        int retry = 0;
        while (true) {
            try {
                handler.handle(record, event, topic);
                return;
            } catch (EventBusNonRetryableException e) {
                log.error("Non-retryable failure for event {} type={} reason={}: {}",
                        event.getId(), event.getType(), e.getReason(), e.getMessage());
                giveUp(record, e, e.getReason());
                return;
            } catch (Exception e) {
                long delay = execution.nextBackOff();
                if (delay == BackOffExecution.STOP) {
                    log.error("Failed to process event {} type={} after {} retries", event.getId(), event.getType(), retry, e);
                    giveUp(record, e, DlqReason.RETRY_EXHAUSTED.code());
                    return;
                }
                retry++;
                metrics.retry();
                log.warn("Retrying event {} type={} ({}/{}) in {}ms: {}",
                        event.getId(), event.getType(), retry, maxRetries, delay, e.toString());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while backing off event {}, giving up", event.getId());
                    giveUp(record, e, DlqReason.INTERRUPTED.code());
                    return;
                }
            }
        }
    }

    private void giveUp(ConsumerRecord<String, String> record, Throwable error, String reason) {
        if (!deadLetterOnFailure) {
            log.error("Skipping message from {} partition={} offset={} reason={}",
                    topic, record.partition(), record.offset(), reason, error);
            return;
        }
        deadLetters.send(record, topic, error, reason);
    }

    public String getTopic() {
        return topic;
    }
}
