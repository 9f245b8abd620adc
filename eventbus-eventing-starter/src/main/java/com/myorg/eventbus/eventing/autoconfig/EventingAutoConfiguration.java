package com.myorg.eventbus.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.eventbus.eventing.ConsumeTopicsSubscriber;
import com.myorg.eventbus.eventing.DefaultEventDispatcher;
import com.myorg.eventbus.eventing.EventDispatcher;
import com.myorg.eventbus.eventing.EventingProperties;
import com.myorg.eventbus.eventing.HandlerRegistry;
import com.myorg.eventbus.eventing.store.EventStore;
import com.myorg.eventbus.kafka.MessageBusAutoConfiguration;
import com.myorg.eventbus.kafka.MessageBusClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = MessageBusAutoConfiguration.class)
@EnableConfigurationProperties(EventingProperties.class)
public class EventingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry() {
        return new HandlerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(name = "eventBusHandlerScanner")
    public EventBusHandlerScanner eventBusHandlerScanner(ConfigurableListableBeanFactory beanFactory,
                                                                HandlerRegistry handlerRegistry,
                                                                ObjectProvider<ObjectMapper> mapper) {
        return new EventBusHandlerScanner(beanFactory, handlerRegistry, mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean(EventDispatcher.class)
    public DefaultEventDispatcher eventDispatcher(HandlerRegistry handlerRegistry, EventingProperties props) {
        return new DefaultEventDispatcher(handlerRegistry, props.isIgnoreUnknownEventType());
    }

    @Bean
    @ConditionalOnBean(MessageBusClient.class)
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "eventbus.eventing.listener", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ConsumeTopicsSubscriber consumeTopicsSubscriber(MessageBusClient client,
                                                           EventDispatcher dispatcher,
                                                           EventingProperties props) {
        return new ConsumeTopicsSubscriber(client, dispatcher, props.getConsumeTopics(), props.getGroupId());
    }

    @Bean
    @ConditionalOnBean(MessageBusClient.class)
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "eventbus.eventing.event-store", name = "enabled", havingValue = "true")
    public EventStore eventStore(MessageBusClient client, EventingProperties props) {
        return new EventStore(client, props.getEventStore().getTopic(), props.getEventStore().getGroupId());
    }
}
