package com.payment.reconciliation.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.payment.reconciliation.domain.PaymentModuleSettings;
import jakarta.persistence.Converter;

@Converter
public class ModuleSettingsConverter extends JsonAttributeConverter<PaymentModuleSettings> {

    public ModuleSettingsConverter() {
        super(new TypeReference<>() {});
    }
}
