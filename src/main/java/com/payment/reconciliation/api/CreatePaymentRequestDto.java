package com.payment.reconciliation.api;

import com.payment.reconciliation.domain.CreatePaymentCommand;
import com.payment.reconciliation.domain.CustomerData;
import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentTargetType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.Map;

/**
 * REST request body for creating a payment.
 */
@Data
public class CreatePaymentRequestDto {

    @NotNull(message = "entityType is required")
    private PaymentEntityType entityType;

    @NotBlank(message = "entityId is required")
    private String entityId;

    @NotNull(message = "targetType is required")
    private PaymentTargetType targetType;

    @NotBlank(message = "targetId is required")
    private String targetId;

    @NotNull(message = "provider is required")
    private PaymentProviderType provider;

    @NotNull(message = "amount is required")
    @DecimalMin(value = "0.01", message = "amount must be positive")
    private BigDecimal amount;

    /** Defaults to the tenant's configured currency. */
    @Pattern(regexp = "^[A-Za-z]{3,4}$", message = "currency must be a 3 or 4 letter code")
    private String currency;

    @Size(max = 500)
    private String description;

    @Valid
    private CustomerData customer;

    private Map<String, Object> metadata;

    private String returnUrl;

    private String cancelUrl;

    /** Client-generated key for safe retries; generated when absent. */
    private String idempotencyKey;

    public CreatePaymentCommand toCommand() {
        return CreatePaymentCommand.builder()
                .entityType(entityType)
                .entityId(entityId)
                .targetType(targetType)
                .targetId(targetId)
                .provider(provider)
                .amount(amount)
                .currency(currency)
                .description(description)
                .customer(customer)
                .metadata(metadata)
                .returnUrl(returnUrl)
                .cancelUrl(cancelUrl)
                .idempotencyKey(idempotencyKey)
                .build();
    }
}
