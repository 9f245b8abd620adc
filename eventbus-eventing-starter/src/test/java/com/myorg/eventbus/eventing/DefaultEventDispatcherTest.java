package com.myorg.eventbus.eventing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.contracts.core.exception.EventBusNonRetryableException;
import com.myorg.eventbus.contracts.tenant.TenantCreatedEventData;
import com.myorg.eventbus.eventing.exception.UnknownEventTypeException;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultEventDispatcherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HandlerRegistry registry = new HandlerRegistry();
    private final TenantHandlers handlers = new TenantHandlers();

    static class TenantHandlers {
        final List<String> created = new ArrayList<>();
        final List<String> envelopes = new ArrayList<>();

        public void onCreated(EventEnvelope env, TenantCreatedEventData data) {
            created.add(data.getId() + "/" + data.getName());
        }

        public void onAnything(EventEnvelope env) {
            envelopes.add(env.getType());
        }

        public void failing(TenantCreatedEventData data) {
            throw new IllegalStateException("mail server down");
        }
    }

    private void register(String type, String methodName, Class<?>... params) throws Exception {
        Method m = TenantHandlers.class.getMethod(methodName, params);
        registry.register(type, new HandlerMethodInvoker(handlers, m, TenantCreatedEventData.class, mapper));
    }

    private EventEnvelope tenantCreated(String type) {
        return EventEnvelope.builder()
                .id("evt-1")
                .type(type)
                .data(mapper.createObjectNode().put("id", "t1").put("name", "Acme"))
                .build();
    }

    @Test
    void dispatchesToHandlerOfMatchingType_withConvertedPayload() throws Exception {
        register("tenant.created", "onCreated", EventEnvelope.class, TenantCreatedEventData.class);

        new DefaultEventDispatcher(registry, true).dispatch(tenantCreated("tenant.created"));

        assertThat(handlers.created).containsExactly("t1/Acme");
    }

    @Test
    void envelopeOnlyHandler_receivesEnvelope() throws Exception {
        register("tenant.suspended", "onAnything", EventEnvelope.class);

        new DefaultEventDispatcher(registry, true).dispatch(tenantCreated("tenant.suspended"));

        assertThat(handlers.envelopes).containsExactly("tenant.suspended");
    }

    @Test
    void unknownType_isIgnoredByDefault() {
        assertThatCode(() -> new DefaultEventDispatcher(registry, true).dispatch(tenantCreated("tenant.archived")))
                .doesNotThrowAnyException();
    }

    @Test
    void unknownType_isNonRetryableWhenNotIgnored() {
        assertThatThrownBy(() -> new DefaultEventDispatcher(registry, false).dispatch(tenantCreated("tenant.archived")))
                .isInstanceOf(UnknownEventTypeException.class)
                .isInstanceOf(EventBusNonRetryableException.class)
                .extracting(e -> ((EventBusNonRetryableException) e).getReason())
                .isEqualTo("UNKNOWN_EVENT_TYPE");
    }

    @Test
    void handlerExceptionPropagatesUnwrapped() throws Exception {
        register("tenant.created", "failing", TenantCreatedEventData.class);

        assertThatThrownBy(() -> new DefaultEventDispatcher(registry, true).dispatch(tenantCreated("tenant.created")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("mail server down");
    }

    @Test
    void unconvertiblePayload_isNonRetryable() throws Exception {
        register("tenant.created", "onCreated", EventEnvelope.class, TenantCreatedEventData.class);
        EventEnvelope bad = EventEnvelope.builder()
                .id("evt-2").type("tenant.created")
                .data(mapper.createArrayNode().add(1))
                .build();

        assertThatThrownBy(() -> new DefaultEventDispatcher(registry, true).dispatch(bad))
                .isInstanceOf(EventBusNonRetryableException.class)
                .extracting(e -> ((EventBusNonRetryableException) e).getReason())
                .isEqualTo("PAYLOAD_CONVERSION");
    }

    @Test
    void duplicateRegistrationForSameType_isRejected() throws Exception {
        register("tenant.created", "onCreated", EventEnvelope.class, TenantCreatedEventData.class);

        assertThatThrownBy(() -> register("tenant.created", "failing", TenantCreatedEventData.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate handler");
    }
}
