package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Input of payment creation. {@code currency} defaults to the tenant's
 * currency and {@code idempotencyKey} is generated when absent.
 */
@Value
@Builder(toBuilder = true)
public class CreatePaymentCommand {

    PaymentEntityType entityType;
    String entityId;
    PaymentTargetType targetType;
    String targetId;
    PaymentProviderType provider;
    BigDecimal amount;
    String currency;
    String description;
    CustomerData customer;
    Map<String, Object> metadata;
    String returnUrl;
    String cancelUrl;
    String idempotencyKey;
}
