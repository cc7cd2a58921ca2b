package com.payment.reconciliation.core;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What an idempotency key already produced: enough to return the existing
 * payment instead of calling the provider again.
 */
@Value
@Builder
@JsonDeserialize(builder = IdempotencyRecord.IdempotencyRecordBuilder.class)
@JsonPOJOBuilder(withPrefix = "")
public class IdempotencyRecord {

    String paymentId;
    PaymentProviderType provider;
    String externalId;
    PaymentStatus status;
    Instant createdAt;
}
