package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ProviderRefundRequest {

    String externalPaymentId;
    /** Null means full refund. */
    BigDecimal amount;
    String currency;
    String reason;
    String idempotencyKey;
}
