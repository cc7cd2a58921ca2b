package com.payment.reconciliation.adapters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StripeSettings implements ProviderSettings {

    @NotBlank(message = "publishableKey is required")
    @Pattern(regexp = "^pk_(test|live)_.+", message = "publishableKey must start with pk_test_ or pk_live_")
    private String publishableKey;

    @NotBlank(message = "secretKey is required")
    @Pattern(regexp = "^sk_(test|live)_.+", message = "secretKey must start with sk_test_ or sk_live_")
    private String secretKey;

    @Pattern(regexp = "^whsec_.+", message = "webhookSecret must start with whsec_")
    private String webhookSecret;

    /** Connected account receiving the transfer, for platform payments. */
    @Pattern(regexp = "^acct_.+", message = "accountId must start with acct_")
    private String accountId;

    @DecimalMin(value = "0", message = "applicationFeePercent must be between 0 and 100")
    @DecimalMax(value = "100", message = "applicationFeePercent must be between 0 and 100")
    private BigDecimal applicationFeePercent;

    @Override
    public boolean isSandboxCredentials() {
        return secretKey != null && secretKey.startsWith("sk_test_");
    }

    @Override
    public List<String> crossFieldErrors() {
        List<String> errors = new ArrayList<>();
        if (publishableKey != null && secretKey != null) {
            boolean publishableTest = publishableKey.startsWith("pk_test_");
            if (publishableTest != isSandboxCredentials()) {
                errors.add("publishableKey and secretKey must both be test keys or both be live keys");
            }
        }
        return errors;
    }
}
