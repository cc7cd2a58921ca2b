package com.payment.reconciliation.api;

import com.payment.reconciliation.domain.PaymentConfigUpdate;
import com.payment.reconciliation.domain.PaymentModuleSettings;
import jakarta.validation.Valid;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * REST request body for saving a tenant's payment config. Omitted fields keep
 * their stored value; secret fields may be sent back in their masked form.
 */
@Data
public class PaymentConfigRequestDto {

    private Boolean enabled;

    private Boolean testMode;

    @Valid
    private PaymentModuleSettings settings;

    /** Wire names of the providers to activate, e.g. {@code yookassa}. */
    private List<String> providers;

    private Map<String, Map<String, Object>> providerSettings;

    public PaymentConfigUpdate toUpdate() {
        return PaymentConfigUpdate.builder()
                .enabled(enabled)
                .testMode(testMode)
                .settings(settings)
                .providers(providers)
                .providerSettings(providerSettings)
                .build();
    }
}
