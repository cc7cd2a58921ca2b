package com.payment.reconciliation.domain;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/**
 * Number of fraction digits a provider can charge in each currency.
 * Amounts finer than that would be rounded on the wire, so they are rejected
 * before a provider is called.
 */
public final class CurrencyPrecision {

    private static final Set<String> ZERO_DECIMAL = Set.of("JPY", "KRW", "VND");
    private static final String USDT = "USDT";

    private CurrencyPrecision() {
    }

    public static boolean isZeroDecimal(String currency) {
        return currency != null && ZERO_DECIMAL.contains(currency.toUpperCase(Locale.ROOT));
    }

    public static int fractionDigits(String currency) {
        if (isZeroDecimal(currency)) {
            return 0;
        }
        return USDT.equalsIgnoreCase(currency) ? 4 : 2;
    }

    public static boolean fits(BigDecimal amount, String currency) {
        return amount.stripTrailingZeros().scale() <= fractionDigits(currency);
    }

    /** Throws INVALID_AMOUNT when {@code amount} has more fraction digits than {@code currency} allows. */
    public static void requireFits(BigDecimal amount, String currency) {
        if (!fits(amount, currency)) {
            int digits = fractionDigits(currency);
            throw new PaymentException(PaymentErrorCode.INVALID_AMOUNT,
                    "Amount " + amount.toPlainString() + " has more than " + digits
                            + (digits == 1 ? " decimal place" : " decimal places") + " for " + currency);
        }
    }
}
