package com.payment.reconciliation.vault;

import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;

/**
 * Thrown when a stored secret cannot be decrypted (tag mismatch, wrong key, malformed value).
 * The message never contains the value itself.
 */
public class DecryptionException extends PaymentException {

    public DecryptionException(String message) {
        super(PaymentErrorCode.DECRYPTION_FAILED, message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(PaymentErrorCode.DECRYPTION_FAILED, message, null, false, cause);
    }
}
