package com.myorg.eventbus.kafka;

import com.myorg.eventbus.kafka.health.CircuitBreakerHealthIndicator;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;

@AutoConfiguration(after = {
        EventBusKafkaAutoConfiguration.class,
        EventBusProducerAutoConfiguration.class,
        EventBusConsumerAutoConfiguration.class
})
@ConditionalOnClass(KafkaTemplate.class)
public class MessageBusAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MessageBusClient.class)
    public KafkaMessageBusClient messageBusClient(EventBusKafkaProperties props,
                                                  Environment env,
                                                  KafkaTemplate<String, String> eventBusKafkaTemplate,
                                                  ConsumerFactory<String, String> eventBusConsumerFactory,
                                                  KafkaAdmin kafkaAdmin,
                                                  EnvelopeCodec codec,
                                                  MessageBusMetrics metrics) {
        return new KafkaMessageBusClient(props, EventBusKafkaAutoConfiguration.serviceName(props, env),
                eventBusKafkaTemplate, eventBusConsumerFactory, kafkaAdmin, codec, metrics, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "eventbus.kafka.lifecycle", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MessageBusLifecycle messageBusLifecycle(MessageBusClient client) {
        return new MessageBusLifecycle(client);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "messageBusHealthIndicator")
        public CircuitBreakerHealthIndicator messageBusHealthIndicator(MessageBusClient client) {
            return new CircuitBreakerHealthIndicator(client.getCircuitBreaker());
        }
    }
}
