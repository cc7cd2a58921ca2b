package com.payment.reconciliation.crypto;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A fiat to USDT conversion: {@code tokenAmount = fiatAmount / rate}, where
 * {@code rate = baseRate * (1 + markup/100)} in fiat per USDT.
 */
@Value
public class ExchangeQuote {

    BigDecimal fiatAmount;
    String fiatCurrency;
    BigDecimal baseRate;
    BigDecimal rate;
    BigDecimal tokenAmount;
    String source;
}
