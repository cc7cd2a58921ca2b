package com.payment.reconciliation.core;

import com.payment.reconciliation.domain.PaymentException;

import java.util.function.Predicate;

/**
 * Resilience4j exception predicate: only failures flagged retryable (network
 * errors, rate limiting) are retried or counted against a provider's circuit breaker.
 * Referenced by name from {@code application.yml}.
 */
public class RetryableProviderFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof PaymentException && ((PaymentException) throwable).isRetryable();
    }
}
