package com.payment.reconciliation.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

/**
 * REST request body for refunding a payment.
 */
@Data
public class RefundRequestDto {

    /** Amount to refund. If null, refunds everything not yet refunded. */
    @DecimalMin(value = "0.01", message = "amount must be positive")
    private BigDecimal amount;

    @Size(max = 500)
    private String reason;
}
