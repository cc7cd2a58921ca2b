package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A tenant's payment configuration as handed out by the config service.
 * Depending on the call, secret fields in {@link #providerSettings} are
 * either masked for display or decrypted for internal use; never stored form.
 */
@Value
@Builder(toBuilder = true)
public class PaymentConfig {

    PaymentEntityType entityType;
    String entityId;
    String ownerId;
    boolean enabled;
    boolean testMode;
    PaymentModuleSettings settings;
    List<String> providers;
    Map<String, Map<String, Object>> providerSettings;
    /** Optimistic-lock version of the stored row; with {@link #updatedAt} it identifies one saved revision. */
    Long version;
    Instant createdAt;
    Instant updatedAt;
}
