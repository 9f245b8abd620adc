package com.myorg.eventbus.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Base consumer config. Group id, offset reset, auto-commit, fetch size and session timeout are
 * set per subscription by {@link KafkaMessageBusClient}.
 */
@AutoConfiguration(
        after = EventBusKafkaAutoConfiguration.class,
        before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@ConditionalOnClass(KafkaTemplate.class)
public class EventBusConsumerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "eventBusConsumerFactory")
    public ConsumerFactory<String, String> eventBusConsumerFactory(EventBusKafkaProperties props) {
        return new DefaultKafkaConsumerFactory<>(consumerConfigs(props));
    }

    static Map<String, Object> consumerConfigs(EventBusKafkaProperties props) {
        EventBusKafkaProperties.Consumer consumer = props.getConsumer();
        Map<String, Object> p = new HashMap<>();
        p.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        p.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        // parse lỗi được xử lý ở listener (gửi DLQ), không ở deserializer
        p.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        if (StringUtils.hasText(props.getClientId())) {
            p.put(ConsumerConfig.CLIENT_ID_CONFIG, props.getClientId());
        }
        p.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, consumer.isAutoCommit());
        p.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, consumer.isFromBeginning() ? "earliest" : "latest");
        p.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, (int) consumer.getSessionTimeout().toMillis());
        p.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, consumer.getMaxPollRecords());
        p.put(ConsumerConfig.RECONNECT_BACKOFF_MS_CONFIG, props.getRetry().getInitialRetryTime().toMillis());
        p.put(ConsumerConfig.RECONNECT_BACKOFF_MAX_MS_CONFIG, props.getRetry().getMaxRetryTime().toMillis());
        return p;
    }
}
