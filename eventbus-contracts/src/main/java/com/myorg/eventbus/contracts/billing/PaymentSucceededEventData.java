package com.myorg.eventbus.contracts.billing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PaymentSucceededEventData {
    private String id;
    private String tenantId;
    private String invoiceId;
    private BigDecimal amount;
    private String currency;
    private String paymentMethod;
    private String paymentId;
    private String paidAt;
}
