package com.payment.reconciliation.crypto;

import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.persistence.entity.PaymentEntity;
import com.payment.reconciliation.persistence.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The set of pending on-chain invoices, recomputed from {@code payments} rows
 * on every call. There is no second store, so a restart loses nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PendingCryptoPaymentView {

    public static final String META_WALLET = "walletAddress";
    public static final String META_EXPECTED_AMOUNT = "expectedAmount";
    public static final String META_ORIGINAL_AMOUNT = "originalAmount";
    public static final String META_ORIGINAL_CURRENCY = "originalCurrency";
    public static final String META_EXCHANGE_RATE = "exchangeRate";
    public static final String META_TESTNET = "testnet";
    public static final String META_TOLERANCE = "tolerancePercent";
    public static final String META_TRANSACTION_ID = "transactionId";

    private final PaymentRepository paymentRepository;

    public List<PendingCryptoPayment> findPending() {
        return paymentRepository
                .findByProviderAndStatusOrderByCreatedAtAsc(PaymentProviderType.CRYPTO_TRC20, PaymentStatus.PENDING)
                .stream()
                .map(PendingCryptoPaymentView::from)
                .filter(p -> p.getWalletAddress() != null && p.getExpectedAmount() != null)
                .collect(Collectors.toList());
    }

    public List<BigDecimal> pendingExpectedAmounts(String watchKey) {
        return findPending().stream()
                .filter(p -> p.watchKey().equals(watchKey))
                .map(PendingCryptoPayment::getExpectedAmount)
                .collect(Collectors.toList());
    }

    public Optional<PendingCryptoPayment> findByExternalId(String externalId) {
        return paymentRepository.findByProviderAndExternalId(PaymentProviderType.CRYPTO_TRC20, externalId)
                .map(PendingCryptoPaymentView::from);
    }

    public Optional<PendingCryptoPayment> findByPaymentId(String paymentId) {
        return paymentRepository.findById(paymentId)
                .filter(p -> p.getProvider() == PaymentProviderType.CRYPTO_TRC20)
                .map(PendingCryptoPaymentView::from);
    }

    public boolean isTransactionClaimed(String transactionId) {
        return paymentRepository.existsByOnChainTransactionId(transactionId);
    }

    public static PendingCryptoPayment from(PaymentEntity payment) {
        Map<String, Object> meta = payment.getMetadata() != null ? payment.getMetadata() : Map.of();
        return PendingCryptoPayment.builder()
                .paymentId(payment.getId())
                .externalId(payment.getExternalId())
                .entityType(payment.getEntityType())
                .entityId(payment.getEntityId())
                .status(payment.getStatus())
                .walletAddress(string(meta.get(META_WALLET)))
                .testnet(Boolean.parseBoolean(string(meta.get(META_TESTNET))))
                .expectedAmount(decimal(meta.get(META_EXPECTED_AMOUNT)))
                .tolerancePercent(decimal(meta.get(META_TOLERANCE)))
                .originalAmount(decimal(meta.get(META_ORIGINAL_AMOUNT)))
                .originalCurrency(string(meta.get(META_ORIGINAL_CURRENCY)))
                .exchangeRate(decimal(meta.get(META_EXCHANGE_RATE)))
                .createdAt(payment.getCreatedAt())
                .expiresAt(payment.getExpiresAt())
                .transactionId(payment.getOnChainTransactionId())
                .build();
    }

    private static String string(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    private static BigDecimal decimal(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(String.valueOf(value));
        } catch (NumberFormatException e) {
            log.warn("Unparseable crypto payment amount in metadata: value={}", value);
            return null;
        }
    }
}
