package com.payment.reconciliation.api;

import com.payment.reconciliation.domain.CustomerData;
import com.payment.reconciliation.domain.PaymentProviderType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * REST request body for paying what a business entity currently owes.
 */
@Data
public class TargetPaymentRequestDto {

    @NotNull(message = "provider is required")
    private PaymentProviderType provider;

    private String returnUrl;

    private String cancelUrl;

    @Valid
    private CustomerData customer;

    private String idempotencyKey;
}
