package com.myorg.eventbus.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Shared building blocks: properties, JSON codec, admin and metrics.
 */
@AutoConfiguration(before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@EnableConfigurationProperties(EventBusKafkaProperties.class)
public class EventBusKafkaAutoConfiguration {

    // Marker bean để test starter đã được auto-config và binding properties đúng
    public record EventBusKafkaMarker(String bootstrapServers, String serviceName) {}

    @Bean
    @ConditionalOnMissingBean
    public EventBusKafkaMarker eventBusKafkaMarker(EventBusKafkaProperties props, Environment env) {
        return new EventBusKafkaMarker(String.join(",", props.getBootstrapServers()), serviceName(props, env));
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeCodec envelopeCodec(ObjectProvider<ObjectMapper> mapper) {
        return new EnvelopeCodec(mapper.getIfAvailable(ObjectMapper::new));
    }

    /**
     * KafkaAdmin wired to eventbus.kafka.bootstrap-servers so NewTopic beans and the admin helpers
     * talk to the same cluster as the client (Boot's default one reads spring.kafka.*).
     */
    @Bean
    @ConditionalOnMissingBean
    public KafkaAdmin kafkaAdmin(EventBusKafkaProperties props) {
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        if (StringUtils.hasText(props.getClientId())) {
            cfg.put(AdminClientConfig.CLIENT_ID_CONFIG, props.getClientId() + "-admin");
        }
        cfg.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, (int) props.getAdmin().getOperationTimeout().toMillis());
        return new KafkaAdmin(cfg);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageBusMetrics messageBusMetrics(ObjectProvider<MeterRegistry> registry,
                                               EventBusKafkaProperties props,
                                               Environment env) {
        MessageBusMetrics metrics = new MessageBusMetrics(registry.getIfAvailable(), serviceName(props, env));
        metrics.preRegisterBaseMeters();
        return metrics;
    }

    static String serviceName(EventBusKafkaProperties props, Environment env) {
        if (StringUtils.hasText(props.getServiceName())) return props.getServiceName();
        return env.getProperty("spring.application.name", "unknown-service");
    }
}
