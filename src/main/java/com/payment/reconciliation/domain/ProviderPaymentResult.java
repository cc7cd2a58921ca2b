package com.payment.reconciliation.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * What the provider returned for a new payment. Serializable to the idempotency cache.
 */
@Value
@Builder
@JsonDeserialize(builder = ProviderPaymentResult.ProviderPaymentResultBuilder.class)
@JsonPOJOBuilder(withPrefix = "")
public class ProviderPaymentResult {

    String externalId;
    PaymentStatus status;
    /** Where to send the payer (redirect page, hosted checkout, crypto payment URI). */
    String paymentUrl;
    BigDecimal amount;
    String currency;
    Instant expiresAt;
    Map<String, Object> metadata;
}
