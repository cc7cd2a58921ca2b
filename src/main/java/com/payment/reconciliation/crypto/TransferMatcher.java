package com.payment.reconciliation.crypto;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Amount-based correlation of transfers to invoices. A transfer of value V
 * matches expected amount E iff |E - V| <= E * t / 100.
 */
public final class TransferMatcher {

    /** Allowed skew between our clock and block timestamps. */
    static final Duration CLOCK_SKEW = Duration.ofSeconds(60);

    private TransferMatcher() {}

    public static BigDecimal toleranceWindow(BigDecimal expected, BigDecimal tolerancePercent) {
        return expected.multiply(tolerancePercent).divide(BigDecimal.valueOf(100), 8, RoundingMode.HALF_UP);
    }

    public static boolean matches(BigDecimal expected, BigDecimal value, BigDecimal tolerancePercent) {
        if (expected == null || value == null || tolerancePercent == null) {
            return false;
        }
        return expected.subtract(value).abs().compareTo(toleranceWindow(expected, tolerancePercent)) <= 0;
    }

    /**
     * Earliest unclaimed transfer that matches the payment, made after it was
     * created and no later than its expiry.
     */
    public static Optional<TokenTransfer> findMatch(PendingCryptoPayment payment,
                                                    Collection<TokenTransfer> transfers,
                                                    Predicate<String> claimed) {
        return transfers.stream()
                .filter(t -> t.getTransactionId() != null && !claimed.test(t.getTransactionId()))
                .filter(t -> withinLifetime(payment, t.getBlockTimestamp()))
                .filter(t -> matches(payment.getExpectedAmount(), t.getValue(), payment.getTolerancePercent()))
                .min(Comparator.comparing(TokenTransfer::getBlockTimestamp,
                        Comparator.nullsLast(Comparator.naturalOrder())));
    }

    private static boolean withinLifetime(PendingCryptoPayment payment, Instant at) {
        if (at == null) {
            return true;
        }
        if (payment.getCreatedAt() != null && at.isBefore(payment.getCreatedAt().minus(CLOCK_SKEW))) {
            return false;
        }
        return payment.getExpiresAt() == null || !at.isAfter(payment.getExpiresAt());
    }
}
