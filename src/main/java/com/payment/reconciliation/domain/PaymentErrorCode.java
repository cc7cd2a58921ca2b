package com.payment.reconciliation.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Stable, machine-readable error codes. Clients branch on these (for example
 * to suggest another payment method on {@link #PAYMENT_DECLINED}).
 */
@Getter
@RequiredArgsConstructor
public enum PaymentErrorCode {

    INVALID_CONFIG(HttpStatus.BAD_REQUEST),
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST),
    INVALID_CURRENCY(HttpStatus.BAD_REQUEST),
    PAYMENT_DECLINED(HttpStatus.PAYMENT_REQUIRED),
    PAYMENT_NOT_FOUND(HttpStatus.NOT_FOUND),
    REFUND_FAILED(HttpStatus.BAD_GATEWAY),
    WEBHOOK_VERIFICATION_FAILED(HttpStatus.UNAUTHORIZED),
    NETWORK_ERROR(HttpStatus.SERVICE_UNAVAILABLE),
    PROVIDER_ERROR(HttpStatus.BAD_GATEWAY),
    RATE_LIMIT(HttpStatus.SERVICE_UNAVAILABLE),
    /** The provider rejected the tenant's credentials; not the caller's own authentication. */
    UNAUTHORIZED(HttpStatus.BAD_GATEWAY),
    NOT_SUPPORTED(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_STATE_TRANSITION(HttpStatus.CONFLICT),
    DECRYPTION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    ACCESS_DENIED(HttpStatus.FORBIDDEN),
    UNKNOWN_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;
}
