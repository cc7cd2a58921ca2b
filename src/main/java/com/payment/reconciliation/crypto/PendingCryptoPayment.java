package com.payment.reconciliation.crypto;

import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read-only view of an on-chain payment, derived from its {@code Payment} row.
 * Never stored separately.
 */
@Value
@Builder
public class PendingCryptoPayment {

    String paymentId;
    String externalId;
    PaymentEntityType entityType;
    String entityId;
    PaymentStatus status;
    String walletAddress;
    boolean testnet;
    BigDecimal expectedAmount;
    BigDecimal tolerancePercent;
    BigDecimal originalAmount;
    String originalCurrency;
    BigDecimal exchangeRate;
    Instant createdAt;
    Instant expiresAt;
    String transactionId;

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /** Watched addresses are grouped per network so testnet and mainnet never share a lookup. */
    public String watchKey() {
        return (testnet ? "nile:" : "main:") + walletAddress;
    }
}
