package com.payment.reconciliation.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentStatusTest {

    @Test
    void pendingMovesForwardOnly() {
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.SUCCEEDED)).isTrue();
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.WAITING_FOR_CAPTURE)).isTrue();
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.REFUNDED)).isFalse();
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.PENDING)).isFalse();
    }

    @Test
    void succeededCannotGoBack() {
        assertThat(PaymentStatus.SUCCEEDED.canTransitionTo(PaymentStatus.PENDING)).isFalse();
        assertThat(PaymentStatus.SUCCEEDED.canTransitionTo(PaymentStatus.CANCELED)).isFalse();
        assertThat(PaymentStatus.SUCCEEDED.canTransitionTo(PaymentStatus.PARTIALLY_REFUNDED)).isTrue();
        assertThat(PaymentStatus.PARTIALLY_REFUNDED.canTransitionTo(PaymentStatus.REFUNDED)).isTrue();
    }

    @Test
    void terminalStatuses() {
        assertThat(PaymentStatus.CANCELED.isTerminal()).isTrue();
        assertThat(PaymentStatus.REFUNDED.isTerminal()).isTrue();
        assertThat(PaymentStatus.FAILED.isTerminal()).isTrue();
        assertThat(PaymentStatus.SUCCEEDED.isTerminal()).isFalse();
        assertThat(PaymentStatus.CANCELED.canTransitionTo(PaymentStatus.SUCCEEDED)).isFalse();
    }

    @Test
    void cancelableAndRefundable() {
        assertThat(PaymentStatus.WAITING_FOR_CAPTURE.isCancelable()).isTrue();
        assertThat(PaymentStatus.SUCCEEDED.isCancelable()).isFalse();
        assertThat(PaymentStatus.PARTIALLY_REFUNDED.isRefundable()).isTrue();
        assertThat(PaymentStatus.PENDING.isRefundable()).isFalse();
    }

    @Test
    void parsesWireValues() {
        assertThat(PaymentStatus.fromValue("waiting_for_capture")).isEqualTo(PaymentStatus.WAITING_FOR_CAPTURE);
        assertThat(PaymentProviderType.fromValue("crypto-trc20")).isEqualTo(PaymentProviderType.CRYPTO_TRC20);
        assertThat(PaymentEntityType.fromValue("booking-system")).isEqualTo(PaymentEntityType.BOOKING_SYSTEM);
        assertThatThrownBy(() -> PaymentProviderType.fromValue("paypal")).isInstanceOf(IllegalArgumentException.class);
    }
}
