package com.payment.reconciliation.adapters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
public class TinkoffSettings implements ProviderSettings {

    @NotBlank(message = "terminalKey is required")
    @Size(min = 10, message = "terminalKey must be at least 10 characters")
    private String terminalKey;

    @NotBlank(message = "secretKey is required")
    @Size(min = 10, message = "secretKey must be at least 10 characters")
    private String secretKey;

    @Pattern(regexp = "^(osn|usn_income|usn_income_outcome|envd|esn|patent)$",
            message = "taxation must be one of osn, usn_income, usn_income_outcome, envd, esn, patent")
    private String taxation;

    @Pattern(regexp = "^(1\\.05|1\\.1|1\\.2)$", message = "ffdVersion must be 1.05, 1.1 or 1.2")
    private String ffdVersion;

    /** Demo terminals carry a {@code DEMO} suffix in their key. */
    @Override
    public boolean isSandboxCredentials() {
        return terminalKey != null && terminalKey.toUpperCase().endsWith("DEMO");
    }
}
