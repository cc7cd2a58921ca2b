package com.payment.reconciliation.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Tenant-wide payment settings, independent of any provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentModuleSettings {

    @Builder.Default
    @Pattern(regexp = "^(RUB|USD|EUR|GBP|USDT)$", message = "currency must be one of RUB, USD, EUR, GBP, USDT")
    private String currency = "RUB";

    @DecimalMin(value = "0", message = "minAmount must not be negative")
    private BigDecimal minAmount;

    @DecimalMin(value = "0", message = "maxAmount must not be negative")
    private BigDecimal maxAmount;

    @Builder.Default
    private List<String> supportedPaymentMethods = new ArrayList<>(List.of("card", "sbp"));

    public static PaymentModuleSettings defaults() {
        return PaymentModuleSettings.builder().build();
    }
}
