package com.payment.reconciliation.adapters;

import com.payment.reconciliation.core.ProviderCallExecutor;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;

/**
 * Shared fixtures for adapter tests: a single-attempt executor and endpoints
 * pointing every provider at the mock server host.
 */
final class AdapterTestSupport {

    static final String BASE_URL = "http://provider.test";

    private AdapterTestSupport() {
    }

    static ProviderCallExecutor singleAttemptExecutor() {
        return new ProviderCallExecutor(CircuitBreakerRegistry.ofDefaults(),
                RetryRegistry.of(RetryConfig.custom().maxAttempts(1).build()));
    }

    static ProviderEndpoints endpoints() {
        return new ProviderEndpoints(BASE_URL);
    }
}
