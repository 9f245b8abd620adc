package com.myorg.eventbus.contracts.core;

import com.myorg.eventbus.contracts.billing.BillingEventType;
import com.myorg.eventbus.contracts.billing.PaymentSucceededEventData;
import com.myorg.eventbus.contracts.core.conventions.EventTypeFormat;
import com.myorg.eventbus.contracts.core.registry.EventTypeRegistry;
import com.myorg.eventbus.contracts.tenant.TenantEventType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventTypeRegistryTest {

    @Test
    void find_shouldResolveWireValueToEnumConstant() {
        assertThat(EventTypeRegistry.find("tenant.created")).contains(TenantEventType.CREATED);
        assertThat(EventTypeRegistry.find("billing.payment_succeeded")).contains(BillingEventType.PAYMENT_SUCCEEDED);
    }

    @Test
    void unknownType_shouldResolveToEmpty_notThrow() {
        assertThat(EventTypeRegistry.find("tenant.exploded")).isEmpty();
        assertThat(EventTypeRegistry.find(null)).isEmpty();
        assertThat(EventTypeRegistry.isKnown("crm.contact_created")).isFalse();
    }

    @Test
    void payloadTypeOf_shouldExposeDocumentedShapes() {
        assertThat(EventTypeRegistry.payloadTypeOf("billing.payment_succeeded"))
                .contains(PaymentSucceededEventData.class);
        // known type without a pinned payload shape
        assertThat(EventTypeRegistry.payloadTypeOf("billing.payment_failed")).isEmpty();
    }

    @Test
    void everyRegisteredType_shouldFollowDottedFormat() {
        assertThat(EventTypeRegistry.all()).isNotEmpty();
        EventTypeRegistry.all().keySet().forEach(type ->
                assertThat(EventTypeFormat.isValid(type)).as(type).isTrue());
    }

    @Test
    void domainOf_shouldReturnFirstSegment() {
        assertThat(EventTypeFormat.domainOf("notification.in_app_read")).isEqualTo("notification");
        assertThat(EventTypeFormat.domainOf("nodots")).isNull();
    }
}
