package com.payment.reconciliation.core;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-payment locks. Every status change of one payment runs under
 * the same lock, so a webhook and a poll for that payment never interleave.
 * Locks are reentrant: an operation holding a payment's lock may run a
 * nested transition for the same payment.
 */
@Component
public class PaymentLockRegistry {

    private final ReentrantLock[] stripes;

    public PaymentLockRegistry(@Value("${payment.engine.lock-stripes:256}") int stripeCount) {
        this.stripes = new ReentrantLock[Math.max(1, stripeCount)];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String paymentId, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(paymentId.hashCode(), stripes.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
