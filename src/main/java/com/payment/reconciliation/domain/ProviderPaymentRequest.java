package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Provider-agnostic payment creation request handed to an adapter.
 */
@Value
@Builder(toBuilder = true)
public class ProviderPaymentRequest {

    BigDecimal amount;
    String currency;
    String description;
    /** Merchant-side order reference; adapters fall back to a generated id. */
    String orderId;
    CustomerData customer;
    Map<String, Object> metadata;
    String returnUrl;
    String cancelUrl;
    String idempotencyKey;
}
