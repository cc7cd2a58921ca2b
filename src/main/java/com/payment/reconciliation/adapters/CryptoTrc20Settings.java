package com.payment.reconciliation.adapters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the USDT TRC-20 rail.
 * <p>
 * {@code maxAmountOffset} and {@code amountTolerancePercent} form one tuned pair:
 * each invoice's expected amount is the converted amount plus a random offset in
 * (0, maxAmountOffset], and a transfer matches when it lies within
 * tolerance percent of that amount. At {@link #REFERENCE_AMOUNT} the offset range
 * must fit at least {@link #MIN_DISTINCT_WINDOWS} non-overlapping match windows,
 * otherwise concurrent invoices on one address could not be told apart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CryptoTrc20Settings implements ProviderSettings {

    public static final BigDecimal REFERENCE_AMOUNT = new BigDecimal("100");
    public static final int MIN_DISTINCT_WINDOWS = 10;
    public static final BigDecimal DEFAULT_TOLERANCE_PERCENT = new BigDecimal("0.01");
    public static final BigDecimal DEFAULT_MAX_OFFSET = new BigDecimal("1.0");

    @NotBlank(message = "walletAddress is required")
    @Pattern(regexp = "^T[a-zA-Z0-9]{33}$", message = "walletAddress must be a TRON address (T + 33 characters)")
    private String walletAddress;

    @Builder.Default
    @Min(value = 5, message = "expirationMinutes must be between 5 and 1440")
    @Max(value = 1440, message = "expirationMinutes must be between 5 and 1440")
    private Integer expirationMinutes = 60;

    @DecimalMin(value = "0.0001", message = "amountTolerancePercent must be between 0.0001 and 5")
    @DecimalMax(value = "5", message = "amountTolerancePercent must be between 0.0001 and 5")
    private BigDecimal amountTolerancePercent;

    @DecimalMin(value = "0.01", message = "maxAmountOffset must be between 0.01 and 10")
    @DecimalMax(value = "10", message = "maxAmountOffset must be between 0.01 and 10")
    private BigDecimal maxAmountOffset;

    @Builder.Default
    private Boolean useTestnet = false;

    private String tronGridApiKey;

    @Builder.Default
    @Pattern(regexp = "^(binance|coingecko|coinbase|kraken|manual)$",
            message = "exchangeRateSource must be one of binance, coingecko, coinbase, kraken, manual")
    private String exchangeRateSource = "coingecko";

    @DecimalMin(value = "0", inclusive = false, message = "manualExchangeRate must be positive")
    private BigDecimal manualExchangeRate;

    @DecimalMin(value = "-10", message = "exchangeRateMarkup must be between -10 and 10")
    @DecimalMax(value = "10", message = "exchangeRateMarkup must be between -10 and 10")
    private BigDecimal exchangeRateMarkup;

    public BigDecimal effectiveTolerancePercent() {
        return amountTolerancePercent != null ? amountTolerancePercent : DEFAULT_TOLERANCE_PERCENT;
    }

    public BigDecimal effectiveMaxOffset() {
        return maxAmountOffset != null ? maxAmountOffset : DEFAULT_MAX_OFFSET;
    }

    @Override
    public boolean isSandboxCredentials() {
        return Boolean.TRUE.equals(useTestnet);
    }

    @Override
    public List<String> crossFieldErrors() {
        List<String> errors = new ArrayList<>();
        if ("manual".equals(exchangeRateSource) && manualExchangeRate == null) {
            errors.add("manualExchangeRate is required when exchangeRateSource is manual");
        }
        BigDecimal windowWidth = REFERENCE_AMOUNT
                .multiply(effectiveTolerancePercent())
                .multiply(BigDecimal.valueOf(2))
                .divide(BigDecimal.valueOf(100), 8, RoundingMode.HALF_UP);
        if (windowWidth.signum() > 0) {
            BigDecimal windows = effectiveMaxOffset().divide(windowWidth, 0, RoundingMode.DOWN);
            if (windows.intValue() < MIN_DISTINCT_WINDOWS) {
                errors.add("maxAmountOffset " + effectiveMaxOffset().toPlainString()
                        + " is too small for amountTolerancePercent " + effectiveTolerancePercent().toPlainString()
                        + ": at least " + MIN_DISTINCT_WINDOWS + " distinct amounts are required at "
                        + REFERENCE_AMOUNT.toPlainString() + " USDT");
            }
        }
        return errors;
    }
}
