package com.payment.reconciliation.core;

import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentProviderType;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs provider HTTP calls under the shared retry policy and a per-provider
 * circuit breaker. Retry is inside the breaker so one logical call counts once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderCallExecutor {

    public static final String RETRY_INSTANCE = "provider-call";
    private static final String BREAKER_PREFIX = "provider-";

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;

    public <T> T execute(PaymentProviderType provider, String operation, Supplier<T> call) {
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(BREAKER_PREFIX + provider.getWireName());
        Retry retry = retryRegistry.retry(RETRY_INSTANCE);

        Supplier<T> withRetry = Retry.decorateSupplier(retry, call);
        Supplier<T> withCb = CircuitBreaker.decorateSupplier(cb, withRetry);
        try {
            return withCb.get();
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open for provider={} operation={}", provider.getWireName(), operation);
            throw new PaymentException(PaymentErrorCode.PROVIDER_ERROR,
                    provider.getDisplayName() + " is temporarily unavailable", provider, true, e);
        }
    }
}
