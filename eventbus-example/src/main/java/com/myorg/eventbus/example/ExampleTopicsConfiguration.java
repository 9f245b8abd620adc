package com.myorg.eventbus.example;

import com.myorg.eventbus.eventing.EventingProperties;
import com.myorg.eventbus.kafka.EventBusKafkaProperties;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

/**
 * Declares the example topics so the app also runs against brokers with auto topic creation off.
 * Uses the KafkaAdmin bean from eventbus-kafka-starter.
 */
@Configuration
public class ExampleTopicsConfiguration {

    @Bean
    public KafkaAdmin.NewTopics exampleTopics(EventBusKafkaProperties props) {
        String suffix = props.getDlq().getSuffix();
        return new KafkaAdmin.NewTopics(
                topic(ExampleTopics.TENANT_EVENTS),
                topic(ExampleTopics.TENANT_EVENTS + suffix),
                topic(ExampleTopics.BILLING_EVENTS),
                topic(ExampleTopics.BILLING_EVENTS + suffix),
                topic(ExampleTopics.NOTIFICATION_EVENTS)
        );
    }

    @Bean
    public NewTopic eventStoreTopic(EventingProperties props) {
        return topic(props.getEventStore().getTopic());
    }

    private static NewTopic topic(String name) {
        return TopicBuilder.name(name)
                .partitions(2)
                .replicas(1)
                .build();
    }
}
