package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Canonical form of a verified provider notification.
 */
@Value
@Builder
public class WebhookData {

    String event;
    String externalId;
    /**
     * Secondary provider id linked to the payment (e.g. the payment intent
     * behind a checkout session); may be used to find the payment.
     */
    String providerReference;
    /** Our own idempotency key echoed back by the provider, used as a last-resort lookup. */
    String merchantReference;
    PaymentStatus status;
    BigDecimal amount;
    Map<String, Object> metadata;
    /** Raw payload retained for audit. */
    Map<String, Object> rawPayload;
    /**
     * Body the provider expects back to stop redelivering; null means the
     * default JSON acknowledgment.
     */
    String acknowledgment;
}
