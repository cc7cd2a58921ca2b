package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Authoritative status of a payment as reported by the provider.
 */
@Value
@Builder
public class ProviderStatusInfo {

    String externalId;
    String providerReference;
    PaymentStatus status;
    /** The provider's own status code, kept for diagnostics. */
    String providerStatus;
    BigDecimal amount;
    String currency;
    Instant paidAt;
    Map<String, Object> metadata;
}
