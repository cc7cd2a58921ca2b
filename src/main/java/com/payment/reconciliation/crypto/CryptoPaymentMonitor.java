package com.payment.reconciliation.crypto;

import com.payment.reconciliation.adapters.CryptoTrc20Adapter;
import com.payment.reconciliation.core.PaymentTransactionService;
import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.persistence.entity.PaymentEntity;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Single periodic worker that settles on-chain invoices. Each tick loads the
 * pending crypto payments, groups them by watched address, reads each
 * address's confirmed USDT transfers once, and matches them to invoices by
 * amount. Matches and expiries go through {@link PaymentTransactionService};
 * the monitor never writes a payment itself.
 * <p>
 * Address lookups within a tick run concurrently, bounded by
 * {@code payment.crypto.monitor.max-parallel-lookups}. A transfer settles at
 * most one invoice: ids already stored or claimed earlier in the tick are skipped.
 * A failed lookup leaves the address's invoices for the next tick, unless the
 * tenant's crypto settings are gone or invalid: then overdue invoices are
 * still expired.
 */
@Slf4j
@Component
public class CryptoPaymentMonitor {

    private final PaymentTransactionService transactionService;
    private final PendingCryptoPaymentView pendingView;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicReference<Instant> lastTickAt = new AtomicReference<>();
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong confirmed = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();
    private final AtomicLong lookupFailures = new AtomicLong();
    private volatile int lastPendingCount;
    private volatile int lastWatchedAddresses;

    @Value("${payment.crypto.monitor.enabled:true}")
    private boolean enabled = true;

    @Value("${payment.crypto.monitor.max-parallel-lookups:4}")
    private int maxParallelLookups = 4;

    @Value("${payment.crypto.monitor.interval-ms:30000}")
    private long intervalMs = 30000;

    private ExecutorService lookupExecutor;

    public CryptoPaymentMonitor(PaymentTransactionService transactionService, PendingCryptoPaymentView pendingView, Clock clock) {
        this.transactionService = transactionService;
        this.pendingView = pendingView;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        lookupExecutor = Executors.newFixedThreadPool(Math.max(1, maxParallelLookups), r -> {
            Thread t = new Thread(r, "crypto-monitor-lookup");
            t.setDaemon(true);
            return t;
        });
        log.info("Crypto payment monitor: enabled={} intervalMs={} maxParallelLookups={}",
                enabled, intervalMs, maxParallelLookups);
    }

    @PreDestroy
    void shutdown() {
        if (lookupExecutor != null) {
            lookupExecutor.shutdownNow();
        }
    }

    @Scheduled(fixedDelayString = "${payment.crypto.monitor.interval-ms:30000}",
            initialDelayString = "${payment.crypto.monitor.initial-delay-ms:10000}")
    public void scheduledTick() {
        if (!enabled) {
            return;
        }
        tick();
    }

    /**
     * One monitoring pass. Skipped when the previous pass is still running.
     */
    public void tick() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Crypto monitor tick skipped, previous tick still running");
            return;
        }
        try {
            List<PendingCryptoPayment> pending = transactionService.findPendingCryptoPayments();
            Map<String, List<PendingCryptoPayment>> byAddress = pending.stream()
                    .collect(Collectors.groupingBy(PendingCryptoPayment::watchKey, LinkedHashMap::new, Collectors.toList()));
            lastPendingCount = pending.size();
            lastWatchedAddresses = byAddress.size();
            if (pending.isEmpty()) {
                return;
            }
            log.debug("Crypto monitor tick: pending={} addresses={}", pending.size(), byAddress.size());

            Set<String> claimed = ConcurrentHashMap.newKeySet();
            List<CompletableFuture<Void>> lookups = new ArrayList<>();
            for (Map.Entry<String, List<PendingCryptoPayment>> group : byAddress.entrySet()) {
                lookups.add(CompletableFuture.runAsync(
                        () -> processAddress(group.getKey(), group.getValue(), claimed), lookupExecutor));
            }
            CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0])).join();
        } finally {
            ticks.incrementAndGet();
            lastTickAt.set(clock.instant());
            running.set(false);
        }
    }

    /**
     * Matches one invoice right away, outside the schedule.
     */
    public PaymentEntity checkPaymentNow(String paymentId) {
        PendingCryptoPayment payment = pendingView.findByPaymentId(paymentId)
                .orElseThrow(() -> new PaymentException(PaymentErrorCode.PAYMENT_NOT_FOUND,
                        "Crypto payment " + paymentId + " not found"));
        if (payment.getStatus() != PaymentStatus.PENDING) {
            return transactionService.getPayment(paymentId);
        }
        Set<String> claimed = ConcurrentHashMap.newKeySet();
        processAddress(payment.watchKey(), List.of(payment), claimed);
        return transactionService.getPayment(paymentId);
    }

    public CryptoMonitorStats getStats() {
        return CryptoMonitorStats.builder()
                .enabled(enabled)
                .running(running.get())
                .pendingPayments(lastPendingCount)
                .watchedAddresses(lastWatchedAddresses)
                .lastTickAt(lastTickAt.get())
                .ticks(ticks.get())
                .confirmed(confirmed.get())
                .expired(expired.get())
                .lookupFailures(lookupFailures.get())
                .build();
    }

    private void processAddress(String watchKey, List<PendingCryptoPayment> payments, Set<String> claimed) {
        List<PendingCryptoPayment> ordered = new ArrayList<>(payments);
        ordered.sort(Comparator.comparing(PendingCryptoPayment::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        List<TokenTransfer> transfers;
        try {
            CryptoTrc20Adapter adapter = transactionService.cryptoAdapterFor(ordered.get(0));
            Instant since = ordered.get(0).getCreatedAt() != null
                    ? ordered.get(0).getCreatedAt().minus(TransferMatcher.CLOCK_SKEW)
                    : clock.instant().minusSeconds(86400);
            transfers = adapter.listIncomingTransfers(since);
        } catch (PaymentException e) {
            lookupFailures.incrementAndGet();
            log.warn("Crypto transfer lookup failed: watchKey={} pending={} code={} error={}",
                    watchKey, payments.size(), e.getCode(), e.getMessage());
            if (e.getCode() != PaymentErrorCode.INVALID_CONFIG) {
                return;
            }
            // no usable settings, so no later tick can match either; still expire overdue invoices
            transfers = List.of();
        }

        Instant now = clock.instant();
        for (PendingCryptoPayment payment : ordered) {
            try {
                Optional<TokenTransfer> match = TransferMatcher.findMatch(payment, transfers,
                        txId -> claimed.contains(txId) || pendingView.isTransactionClaimed(txId));
                if (match.isPresent() && claimed.add(match.get().getTransactionId())) {
                    TokenTransfer transfer = match.get();
                    PaymentEntity updated = transactionService.confirmCryptoPayment(payment.getPaymentId(),
                            transfer.getTransactionId(), transfer.getBlockTimestamp(), transfer.getValue());
                    if (updated.getStatus() == PaymentStatus.SUCCEEDED) {
                        confirmed.incrementAndGet();
                        log.info("Crypto payment confirmed: paymentId={} txId={} expected={} received={}",
                                payment.getPaymentId(), transfer.getTransactionId(),
                                payment.getExpectedAmount(), transfer.getValue());
                    }
                } else if (payment.isExpired(now)) {
                    PaymentEntity updated = transactionService.expireCryptoPayment(payment.getPaymentId());
                    if (updated.getStatus() == PaymentStatus.CANCELED) {
                        expired.incrementAndGet();
                        log.info("Crypto payment expired: paymentId={} expected={} expiresAt={}",
                                payment.getPaymentId(), payment.getExpectedAmount(), payment.getExpiresAt());
                    }
                }
            } catch (DataIntegrityViolationException e) {
                log.error("Crypto transfer already settles another payment: paymentId={} watchKey={}",
                        payment.getPaymentId(), watchKey, e);
            } catch (PaymentException e) {
                log.error("Crypto payment reconciliation failed: paymentId={} code={} error={}",
                        payment.getPaymentId(), e.getCode(), e.getMessage());
            }
        }
    }
}
