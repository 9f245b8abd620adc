package com.myorg.eventbus.kafka.dlq;

import com.myorg.eventbus.contracts.core.envelope.ErrorInfo;
import com.myorg.eventbus.kafka.EnvelopeCodec;
import com.myorg.eventbus.kafka.MessageBusMetrics;
import com.myorg.eventbus.kafka.exception.DlqPublishException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.springframework.kafka.core.KafkaTemplate;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort publishing of failed records to {@code <topic><suffix>}. Never throws: a failed
 * DLQ send is logged and counted, then the original record is considered done.
 * <p>
 * Sends bypass the circuit breaker.
 */
@Slf4j
public class DeadLetterPublisher {

    private static final int MAX_HEADER_MESSAGE = 512;
    private static final int MAX_STACK = 8192;

    private final KafkaTemplate<String, String> template;
    private final EnvelopeCodec codec;
    private final String serviceName;
    private final String suffix;
    private final Duration sendTimeout;
    private final MessageBusMetrics metrics;
    private final Clock clock;

    private volatile boolean enabled;

    public DeadLetterPublisher(KafkaTemplate<String, String> template,
                               EnvelopeCodec codec,
                               String serviceName,
                               String suffix,
                               Duration sendTimeout,
                               boolean enabled,
                               MessageBusMetrics metrics,
                               Clock clock) {
        this.template = template;
        this.codec = codec;
        this.serviceName = serviceName;
        this.suffix = suffix;
        this.sendTimeout = sendTimeout;
        this.enabled = enabled;
        this.metrics = metrics != null ? metrics : MessageBusMetrics.noop();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public String dlqTopicOf(String topic) {
        return topic + suffix;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void send(ConsumerRecord<String, String> record, String originalTopic, Throwable error, DlqReason reason) {
        send(record, originalTopic, error, reason.code());
    }

    public void send(ConsumerRecord<String, String> record, String originalTopic, Throwable error, String reasonCode) {
        if (!enabled) {
            log.warn("DLQ disabled, dropping failed message topic={} partition={} offset={} reason={}",
                    originalTopic, record.partition(), record.offset(), reasonCode);
            return;
        }

        String dlqTopic = dlqTopicOf(originalTopic);
        String errorTime = clock.instant().toString();
        String message = messageOf(error);
        try {
            ErrorInfo info = ErrorInfo.builder()
                    .code(reasonCode)
                    .message(message)
                    .stack(truncate(stackOf(error), MAX_STACK))
                    .time(errorTime)
                    .build();
            String body = codec.deadLetterBody(record.value(), info, serviceName, originalTopic);

            ProducerRecord<String, String> out = new ProducerRecord<>(dlqTopic, null, record.key(), body);
            for (Header h : record.headers()) {
                out.headers().add(h.key(), h.value());
            }
            putHeader(out.headers(), DlqHeaders.ERROR_MESSAGE, truncate(message, MAX_HEADER_MESSAGE));
            putHeader(out.headers(), DlqHeaders.ERROR_TIME, errorTime);
            putHeader(out.headers(), DlqHeaders.ORIGINAL_TOPIC, originalTopic);
            putHeader(out.headers(), DlqHeaders.PROCESSING_SERVICE, serviceName);
            putHeader(out.headers(), DlqHeaders.REASON, reasonCode);

            template.send(out).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);

            metrics.deadLettered(reasonCode);
            log.info("Sent failed message to DLQ {} key={} reason={} error={}", dlqTopic, record.key(), reasonCode, message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed(dlqTopic, e);
        } catch (Exception e) {
            failed(dlqTopic, e);
        }
    }

    private void failed(String dlqTopic, Exception cause) {
        metrics.dlqPublishFailed();
        DlqPublishException ex = new DlqPublishException(dlqTopic, cause);
        log.error(ex.getMessage(), ex);
    }

    private static void putHeader(Headers headers, String key, String value) {
        headers.remove(key);
        if (value != null) {
            headers.add(key, value.getBytes(StandardCharsets.UTF_8));
        }
    }

    private static String messageOf(Throwable error) {
        if (error == null) return "unknown error";
        String m = error.getMessage();
        return (m == null || m.isBlank()) ? error.getClass().getName() : m;
    }

    private static String stackOf(Throwable error) {
        if (error == null) return null;
        StringWriter sw = new StringWriter();
        error.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
