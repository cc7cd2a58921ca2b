package com.payment.reconciliation.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

/**
 * Provider name to settings blob. Secret fields inside are already encrypted
 * by the vault before they reach this converter.
 */
@Converter
public class ProviderSettingsConverter extends JsonAttributeConverter<Map<String, Map<String, Object>>> {

    public ProviderSettingsConverter() {
        super(new TypeReference<>() {});
    }
}
