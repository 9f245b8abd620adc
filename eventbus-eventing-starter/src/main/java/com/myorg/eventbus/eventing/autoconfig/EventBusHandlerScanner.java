package com.myorg.eventbus.eventing.autoconfig;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.eventbus.contracts.core.registry.EventTypeRegistry;
import com.myorg.eventbus.eventing.EventBusHandler;
import com.myorg.eventbus.eventing.HandlerMethodInvoker;
import com.myorg.eventbus.eventing.HandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.framework.AopProxyUtils;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;

import java.lang.reflect.Method;
import java.util.Map;

/**
 * Registers every {@link EventBusHandler} method of the context's singletons once they are all
 * created. Annotations are read from the ultimate target class so proxied beans are found too.
 */
@Slf4j
@RequiredArgsConstructor
public class EventBusHandlerScanner implements SmartInitializingSingleton {

    private final ConfigurableListableBeanFactory beanFactory;
    private final HandlerRegistry registry;
    private final ObjectMapper mapper;

    @Override
    public void afterSingletonsInstantiated() {
        for (String name : beanFactory.getBeanNamesForType(Object.class, false, false)) {
            // chỉ quét singleton đã tạo, không ép init bean lazy
            if (!beanFactory.containsSingleton(name)) continue;
            scan(beanFactory.getBean(name));
        }
        log.info("Registered event handlers for types {}", registry.eventTypes());
    }

    void scan(Object bean) {
        Class<?> targetClass = AopProxyUtils.ultimateTargetClass(bean);

        Map<Method, EventBusHandler> methods = MethodIntrospector.selectMethods(
                targetClass,
                (MethodIntrospector.MetadataLookup<EventBusHandler>) m ->
                        AnnotatedElementUtils.findMergedAnnotation(m, EventBusHandler.class));

        methods.forEach((method, ann) -> {
            // quan trọng: chọn method invocable trên proxy class
            Method invocable = AopUtils.selectInvocableMethod(method, bean.getClass());
            registry.register(ann.value(), new HandlerMethodInvoker(bean, invocable, payloadClass(ann), mapper));
            log.debug("Handler {}#{} -> {}", targetClass.getSimpleName(), method.getName(), ann.value());
        });
    }

    private static Class<?> payloadClass(EventBusHandler ann) {
        if (ann.payload() != Void.class) return ann.payload();
        return EventTypeRegistry.payloadTypeOf(ann.value()).orElse(JsonNode.class);
    }
}
