package com.payment.reconciliation.messaging;

import com.payment.reconciliation.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Emitted after a payment state change has been committed. Keyed by payment
 * id on the topic, so consumers see one payment's events in order.
 */
@Value
@Builder
@Jacksonized
public class PaymentDomainEvent {

    String eventId;
    PaymentEventType eventType;
    String paymentId;
    String externalId;
    String provider;
    String entityType;
    String entityId;
    String targetType;
    String targetId;
    PaymentStatus status;
    PaymentStatus previousStatus;
    BigDecimal amount;
    BigDecimal refundedAmount;
    String currency;
    String reason;
    boolean testMode;
    Instant timestamp;
}
