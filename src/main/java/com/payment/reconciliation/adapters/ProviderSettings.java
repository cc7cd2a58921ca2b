package com.payment.reconciliation.adapters;

import java.util.List;

/**
 * Typed, bean-validated form of a provider's raw settings blob.
 */
public interface ProviderSettings {

    /** Whether the credentials themselves are sandbox credentials, regardless of the tenant's test flag. */
    default boolean isSandboxCredentials() {
        return false;
    }

    /** Rules spanning several fields, checked after bean validation. */
    default List<String> crossFieldErrors() {
        return List.of();
    }
}
