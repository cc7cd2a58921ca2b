package com.payment.reconciliation.core;

import com.payment.reconciliation.domain.EntityPaymentStatus;
import com.payment.reconciliation.domain.PaymentTargetType;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * What the engine needs from the business entity being paid for (an order, a
 * booking, ...). Implemented by the owning module, one bean per target type.
 */
public interface PaymentTargetGateway {

    PaymentTargetType getTargetType();

    Optional<BigDecimal> amountOwed(String targetId);

    Optional<String> ownerId(String targetId);

    /** Must be idempotent: the same status may be delivered more than once. */
    void setPaymentStatus(String targetId, String paymentId, EntityPaymentStatus status);
}
