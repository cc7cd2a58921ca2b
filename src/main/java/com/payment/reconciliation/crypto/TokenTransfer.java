package com.payment.reconciliation.crypto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A confirmed incoming token transfer reported by the blockchain explorer.
 */
@Value
@Builder
public class TokenTransfer {

    String transactionId;
    String from;
    String to;
    /** Token units, already scaled by the token's decimals. */
    BigDecimal value;
    Instant blockTimestamp;
}
