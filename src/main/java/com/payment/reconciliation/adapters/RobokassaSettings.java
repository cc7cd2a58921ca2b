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
public class RobokassaSettings implements ProviderSettings {

    @NotBlank(message = "merchantLogin is required")
    @Size(min = 3, message = "merchantLogin must be at least 3 characters")
    private String merchantLogin;

    /** Signs payment links. */
    @NotBlank(message = "password1 is required")
    @Size(min = 6, message = "password1 must be at least 6 characters")
    private String password1;

    /** Signs result callbacks and status queries. */
    @NotBlank(message = "password2 is required")
    @Size(min = 6, message = "password2 must be at least 6 characters")
    private String password2;

    /** Test-mode counterparts of password1/password2. */
    private String password3;
    private String password4;

    @Builder.Default
    @Pattern(regexp = "^(ru|en)$", message = "culture must be ru or en")
    private String culture = "ru";

    @Builder.Default
    private Boolean isTest = false;

    @Override
    public boolean isSandboxCredentials() {
        return Boolean.TRUE.equals(isTest);
    }
}
