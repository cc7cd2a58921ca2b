package com.payment.reconciliation.adapters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class YooKassaSettings implements ProviderSettings {

    @NotBlank(message = "shopId is required")
    @Pattern(regexp = "^\\d+$", message = "shopId must contain only digits")
    private String shopId;

    @NotBlank(message = "secretKey is required")
    @Size(min = 10, message = "secretKey must be at least 10 characters")
    private String secretKey;

    private String agentId;

    /** Tax system code for receipts, 1..6. */
    @Min(value = 1, message = "taxSystem must be between 1 and 6")
    @Max(value = 6, message = "taxSystem must be between 1 and 6")
    private Integer taxSystem;

    @Override
    public boolean isSandboxCredentials() {
        return secretKey != null && secretKey.startsWith("test_");
    }
}
