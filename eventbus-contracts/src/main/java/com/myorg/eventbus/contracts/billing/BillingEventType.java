package com.myorg.eventbus.contracts.billing;

import com.myorg.eventbus.contracts.core.registry.EventType;

public enum BillingEventType implements EventType {
    INVOICE_CREATED("billing.invoice_created", null),
    PAYMENT_SUCCEEDED("billing.payment_succeeded", PaymentSucceededEventData.class),
    PAYMENT_FAILED("billing.payment_failed", null),
    SUBSCRIPTION_RENEWED("billing.subscription_renewed", null),
    SUBSCRIPTION_CANCELLED("billing.subscription_cancelled", null);

    private final String value;
    private final Class<?> payloadType;

    BillingEventType(String value, Class<?> payloadType) {
        this.value = value;
        this.payloadType = payloadType;
    }

    @Override
    public String value() {
        return value;
    }

    @Override
    public Class<?> payloadType() {
        return payloadType;
    }
}
