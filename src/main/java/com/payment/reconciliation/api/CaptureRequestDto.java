package com.payment.reconciliation.api;

import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class CaptureRequestDto {

    /** Amount to capture; null captures the full authorization. */
    @DecimalMin(value = "0.01", message = "amount must be positive")
    private BigDecimal amount;
}
