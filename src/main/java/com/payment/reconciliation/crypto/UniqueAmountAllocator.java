package com.payment.reconciliation.crypto;

import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mints perturbed expected amounts so concurrent invoices on one address are
 * distinguishable by amount alone. The offset is a random 4-decimal value in
 * (0, maxOffset]. A candidate is accepted only if its match window does not
 * overlap the window of any other pending invoice on the address:
 * {@code |E1 - E2| > E1*t/100 + E2*t/100}.
 * <p>
 * Amounts handed out are also held in memory until their invoice expires,
 * covering the gap before the new row is visible as pending.
 */
@Slf4j
@Component
public class UniqueAmountAllocator {

    static final int SCALE = 4;
    private static final int MAX_ATTEMPTS = 64;

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;
    private final Map<String, Map<BigDecimal, Instant>> reservations = new ConcurrentHashMap<>();

    public UniqueAmountAllocator(Clock clock) {
        this.clock = clock;
    }

    public BigDecimal allocate(String watchKey, BigDecimal baseAmount, BigDecimal tolerancePercent,
                               BigDecimal maxOffset, Collection<BigDecimal> pendingAmounts, Instant expiresAt) {
        Map<BigDecimal, Instant> reserved = reservations.computeIfAbsent(watchKey, k -> new ConcurrentHashMap<>());
        synchronized (reserved) {
            Instant now = clock.instant();
            reserved.values().removeIf(until -> until.isBefore(now));

            List<BigDecimal> taken = new ArrayList<>(pendingAmounts);
            taken.addAll(reserved.keySet());

            long maxSteps = maxOffset.movePointRight(SCALE).longValue();
            BigDecimal base = baseAmount.setScale(SCALE, RoundingMode.HALF_UP);
            for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
                long steps = 1 + (long) (random.nextDouble() * maxSteps);
                BigDecimal candidate = base.add(BigDecimal.valueOf(steps, SCALE));
                if (isDistinct(candidate, taken, tolerancePercent)) {
                    reserved.put(candidate, expiresAt);
                    return candidate;
                }
            }
        }
        log.warn("No distinct crypto amount available: watchKey={} base={} pending={}",
                watchKey, baseAmount, pendingAmounts.size());
        throw new PaymentException(PaymentErrorCode.PROVIDER_ERROR,
                "Too many pending invoices on this wallet for a distinct amount; retry later",
                PaymentProviderType.CRYPTO_TRC20);
    }

    static boolean isDistinct(BigDecimal candidate, Collection<BigDecimal> taken, BigDecimal tolerancePercent) {
        BigDecimal candidateWindow = TransferMatcher.toleranceWindow(candidate, tolerancePercent);
        for (BigDecimal other : taken) {
            BigDecimal combined = candidateWindow.add(TransferMatcher.toleranceWindow(other, tolerancePercent));
            if (candidate.subtract(other).abs().compareTo(combined) <= 0) {
                return false;
            }
        }
        return true;
    }
}
