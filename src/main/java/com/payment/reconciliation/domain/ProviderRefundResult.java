package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ProviderRefundResult {

    String externalRefundId;
    RefundStatus status;
    BigDecimal amount;
    String currency;
}
