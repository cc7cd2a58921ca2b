package com.payment.reconciliation.domain;

import lombok.Value;

import java.util.List;

@Value
public class ValidationResult {

    boolean valid;
    List<String> errors;

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult failed(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    public static ValidationResult failed(String error) {
        return new ValidationResult(false, List.of(error));
    }
}
