package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a provider connection test, one step per check in the order run.
 */
@Value
@Builder
public class ProviderTestResult {

    String provider;
    boolean success;
    boolean testMode;
    List<Step> steps;

    @Value
    public static class Step {
        String name;
        boolean passed;
        List<String> errors;
    }
}
