package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a tenant config; null fields keep their stored value.
 * Secret fields may be sent masked, empty or in plaintext.
 */
@Value
@Builder
public class PaymentConfigUpdate {

    Boolean enabled;
    Boolean testMode;
    PaymentModuleSettings settings;
    List<String> providers;
    Map<String, Map<String, Object>> providerSettings;
}
