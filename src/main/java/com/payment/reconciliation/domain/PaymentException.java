package com.payment.reconciliation.domain;

import lombok.Getter;

/**
 * Typed payment failure. Carries the error code, the provider it came from
 * (null for engine-level errors) and whether the call may be retried.
 */
@Getter
public class PaymentException extends RuntimeException {

    private final PaymentErrorCode code;
    private final PaymentProviderType provider;
    private final boolean retryable;

    public PaymentException(PaymentErrorCode code, String message) {
        this(code, message, null, false, null);
    }

    public PaymentException(PaymentErrorCode code, String message, PaymentProviderType provider) {
        this(code, message, provider, false, null);
    }

    public PaymentException(PaymentErrorCode code, String message, PaymentProviderType provider,
                            boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.provider = provider;
        this.retryable = retryable;
    }

    public static PaymentException notFound(String what) {
        return new PaymentException(PaymentErrorCode.PAYMENT_NOT_FOUND, what + " not found");
    }

    public static PaymentException notSupported(PaymentProviderType provider, String capability) {
        return new PaymentException(PaymentErrorCode.NOT_SUPPORTED,
                capability + " is not supported by " + provider.getDisplayName(), provider);
    }

    public static PaymentException invalidTransition(PaymentStatus from, PaymentStatus to) {
        return new PaymentException(PaymentErrorCode.INVALID_STATE_TRANSITION,
                "Cannot move payment from " + from.getValue() + " to " + (to != null ? to.getValue() : "null"));
    }
}
