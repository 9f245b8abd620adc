package com.myorg.eventbus.kafka;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

// Producer gửi JSON string; retry tầng transport do chính Kafka client đảm nhận
@AutoConfiguration(
        after = EventBusKafkaAutoConfiguration.class,
        before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@ConditionalOnClass(KafkaTemplate.class)
public class EventBusProducerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "eventBusProducerFactory")
    public ProducerFactory<String, String> eventBusProducerFactory(EventBusKafkaProperties props) {
        return new DefaultKafkaProducerFactory<>(producerConfigs(props));
    }

    @Bean
    @ConditionalOnMissingBean(name = "eventBusKafkaTemplate")
    public KafkaTemplate<String, String> eventBusKafkaTemplate(ProducerFactory<String, String> eventBusProducerFactory) {
        return new KafkaTemplate<>(eventBusProducerFactory);
    }

    static Map<String, Object> producerConfigs(EventBusKafkaProperties props) {
        EventBusKafkaProperties.Producer producer = props.getProducer();
        EventBusKafkaProperties.Retry retry = props.getRetry();

        Map<String, Object> p = new HashMap<>();
        p.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        p.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        p.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        if (StringUtils.hasText(props.getClientId())) {
            p.put(ProducerConfig.CLIENT_ID_CONFIG, props.getClientId());
        }
        if (StringUtils.hasText(props.getSchemaRegistryUrl())) {
            // passthrough, only read by schema-aware serializers
            p.put("schema.registry.url", props.getSchemaRegistryUrl());
        }

        p.put(ProducerConfig.RETRIES_CONFIG, retry.getRetries());
        p.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, retry.getInitialRetryTime().toMillis());
        p.put(ProducerConfig.RECONNECT_BACKOFF_MS_CONFIG, retry.getInitialRetryTime().toMillis());
        p.put(ProducerConfig.RECONNECT_BACKOFF_MAX_MS_CONFIG, retry.getMaxRetryTime().toMillis());

        // idempotence cần retries > 0 và acks=all
        boolean idempotence = producer.isIdempotence() && retry.getRetries() > 0 && "all".equals(producer.getAcks());
        p.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
        p.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, idempotence);
        p.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, producer.getCompression());
        p.put(ProducerConfig.LINGER_MS_CONFIG, producer.getLingerMs());
        p.put(ProducerConfig.BATCH_SIZE_CONFIG, producer.getBatchSize());
        p.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, producer.getMaxBlock().toMillis());
        p.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) producer.getRequestTimeout().toMillis());
        // delivery.timeout.ms phải >= linger.ms + request.timeout.ms
        p.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG,
                (int) Math.max(120_000L, producer.getRequestTimeout().toMillis() + producer.getLingerMs()));
        return p;
    }
}
