package com.payment.reconciliation.core;

import com.payment.reconciliation.adapters.CryptoTrc20Adapter;
import com.payment.reconciliation.crypto.PendingCryptoPayment;
import com.payment.reconciliation.crypto.PendingCryptoPaymentView;
import com.payment.reconciliation.domain.CreatePaymentCommand;
import com.payment.reconciliation.domain.CurrencyPrecision;
import com.payment.reconciliation.domain.CustomerData;
import com.payment.reconciliation.domain.EntityPaymentStatus;
import com.payment.reconciliation.domain.PaymentConfig;
import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentModuleSettings;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.domain.PaymentTargetType;
import com.payment.reconciliation.domain.ProviderPaymentRequest;
import com.payment.reconciliation.domain.ProviderPaymentResult;
import com.payment.reconciliation.domain.ProviderRefundRequest;
import com.payment.reconciliation.domain.ProviderRefundResult;
import com.payment.reconciliation.domain.ProviderStatusInfo;
import com.payment.reconciliation.domain.RefundStatus;
import com.payment.reconciliation.domain.WebhookData;
import com.payment.reconciliation.domain.WebhookPayload;
import com.payment.reconciliation.domain.WebhookResult;
import com.payment.reconciliation.messaging.PaymentDomainEvent;
import com.payment.reconciliation.messaging.PaymentEventPublisher;
import com.payment.reconciliation.messaging.PaymentEventType;
import com.payment.reconciliation.persistence.entity.PaymentEntity;
import com.payment.reconciliation.persistence.entity.PaymentRefundEntity;
import com.payment.reconciliation.persistence.entity.StatusHistoryEntry;
import com.payment.reconciliation.persistence.repository.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps each {@link PaymentEntity} consistent with what its provider reports.
 * <p>
 * All status changes go through one path: take the payment's lock, reload
 * it, check {@link PaymentStatus#canTransitionTo}, append to the history and
 * commit. Events and the business-entity update follow the commit, still
 * under the lock, so they are emitted in transition order.
 * <p>
 * Engine-level checks (tenant disabled, amount out of range, wrong state)
 * run before any provider call, so a rejected request has no side effect.
 */
@Slf4j
@Service
public class PaymentTransactionService {

    static final String REASON_USER_CANCEL = "canceled by user";
    static final String REASON_EXPIRED = "expired";
    static final String META_REASON = "reason";
    static final String META_REFUNDED_AMOUNT = "refundedAmount";
    static final String META_TRANSACTION_ID = "transactionId";

    private final PaymentRepository paymentRepository;
    private final PaymentConfigService configService;
    private final ProviderFactory providerFactory;
    private final ProviderAdapterCache adapterCache;
    private final IdempotencyService idempotencyService;
    private final PaymentEventPublisher eventPublisher;
    private final PaymentLockRegistry lockRegistry;
    private final PendingCryptoPaymentView pendingCryptoPaymentView;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Map<PaymentTargetType, PaymentTargetGateway> targetGateways;
    private final SecureRandom random = new SecureRandom();

    public PaymentTransactionService(PaymentRepository paymentRepository,
                                     PaymentConfigService configService,
                                     ProviderFactory providerFactory,
                                     ProviderAdapterCache adapterCache,
                                     IdempotencyService idempotencyService,
                                     PaymentEventPublisher eventPublisher,
                                     PaymentLockRegistry lockRegistry,
                                     PendingCryptoPaymentView pendingCryptoPaymentView,
                                     TransactionTemplate transactionTemplate,
                                     Clock clock,
                                     List<PaymentTargetGateway> targetGateways) {
        this.paymentRepository = paymentRepository;
        this.configService = configService;
        this.providerFactory = providerFactory;
        this.adapterCache = adapterCache;
        this.idempotencyService = idempotencyService;
        this.eventPublisher = eventPublisher;
        this.lockRegistry = lockRegistry;
        this.pendingCryptoPaymentView = pendingCryptoPaymentView;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.targetGateways = targetGateways.stream()
                .collect(Collectors.toMap(PaymentTargetGateway::getTargetType, Function.identity(), (first, second) -> first));
        log.info("Payment transaction service initialized: targetGateways={}", this.targetGateways.keySet());
    }

    // ---------------------------------------------------------------- creation

    public PaymentEntity createPayment(CreatePaymentCommand command) {
        PaymentProviderType provider = command.getProvider();
        PaymentConfig config = configService.getConfigInternal(command.getEntityType(), command.getEntityId());
        if (!config.isEnabled()) {
            throw new PaymentException(PaymentErrorCode.INVALID_CONFIG,
                    "Payments are disabled for " + command.getEntityType().getValue() + " " + command.getEntityId());
        }
        if (!config.getProviders().contains(provider.getWireName())) {
            throw new PaymentException(PaymentErrorCode.INVALID_CONFIG,
                    provider.getDisplayName() + " is not enabled for " + command.getEntityType().getValue()
                            + " " + command.getEntityId(), provider);
        }
        PaymentModuleSettings settings = config.getSettings();
        String currency = command.getCurrency() != null
                ? command.getCurrency().toUpperCase(Locale.ROOT) : settings.getCurrency();
        validateAmount(command.getAmount(), currency, settings);
        String idempotencyKey = command.getIdempotencyKey() != null
                ? command.getIdempotencyKey() : generateIdempotencyKey(provider);

        Optional<PaymentEntity> existing = findByIdempotencyKey(provider, idempotencyKey);
        if (existing.isPresent()) {
            log.info("Returning existing payment for idempotency key: paymentId={} provider={} key={}",
                    existing.get().getId(), provider.getWireName(), idempotencyKey);
            return existing.get();
        }

        Map<String, Object> entityKeys = new HashMap<>();
        entityKeys.put("entityType", command.getEntityType().getValue());
        entityKeys.put("entityId", command.getEntityId());
        entityKeys.put("targetType", command.getTargetType().getValue());
        entityKeys.put("targetId", command.getTargetId());
        Map<String, Object> requestMetadata = new HashMap<>();
        if (command.getMetadata() != null) {
            requestMetadata.putAll(command.getMetadata());
        }
        requestMetadata.putAll(entityKeys);

        String description = command.getDescription() != null ? command.getDescription()
                : "Payment for " + command.getTargetType().getValue() + " " + command.getTargetId();
        PaymentProviderAdapter adapter = adapterFor(config, provider, config.isTestMode());
        ProviderPaymentRequest request = ProviderPaymentRequest.builder()
                .amount(command.getAmount())
                .currency(currency)
                .description(description)
                .orderId(command.getTargetId())
                .customer(command.getCustomer())
                .metadata(requestMetadata)
                .returnUrl(command.getReturnUrl())
                .cancelUrl(command.getCancelUrl())
                .idempotencyKey(idempotencyKey)
                .build();
        log.info("Creating payment: provider={} entityType={} entityId={} targetType={} targetId={} amount={} currency={} testMode={}",
                provider.getWireName(), command.getEntityType().getValue(), command.getEntityId(),
                command.getTargetType().getValue(), command.getTargetId(), command.getAmount(), currency, adapter.isTestMode());
        ProviderPaymentResult result = adapter.createPayment(request);

        Instant now = clock.instant();
        Map<String, Object> metadata = new HashMap<>(requestMetadata);
        if (result.getMetadata() != null) {
            metadata.putAll(result.getMetadata());
        }
        PaymentEntity payment = PaymentEntity.builder()
                .id(UUID.randomUUID().toString())
                .externalId(result.getExternalId())
                .provider(provider)
                .idempotencyKey(idempotencyKey)
                .entityType(command.getEntityType())
                .entityId(command.getEntityId())
                .targetType(command.getTargetType())
                .targetId(command.getTargetId())
                .ownerId(config.getOwnerId())
                .amount(command.getAmount())
                .currency(currency)
                .refundedAmount(BigDecimal.ZERO)
                .status(PaymentStatus.PENDING)
                .description(description)
                .paymentUrl(result.getPaymentUrl())
                .testMode(adapter.isTestMode())
                .metadata(metadata)
                .expiresAt(result.getExpiresAt())
                .createdAt(now)
                .build();
        payment.getStatusHistory().add(StatusHistoryEntry.builder()
                .status(PaymentStatus.PENDING)
                .changedAt(now)
                .reason("created")
                .build());
        PaymentStatus initial = result.getStatus();
        if (initial != null && initial != PaymentStatus.PENDING && PaymentStatus.PENDING.canTransitionTo(initial)) {
            applyTransition(payment, initial, "initial provider status", null, now);
        }

        PaymentEntity saved;
        try {
            saved = lockRegistry.withLock(payment.getId(),
                    () -> transactionTemplate.execute(status -> paymentRepository.saveAndFlush(payment)));
        } catch (DataIntegrityViolationException e) {
            Optional<PaymentEntity> raced = findByIdempotencyKey(provider, idempotencyKey);
            if (raced.isPresent()) {
                log.info("Concurrent create resolved to existing payment: paymentId={} key={}", raced.get().getId(), idempotencyKey);
                return raced.get();
            }
            log.error("Payment could not be stored: provider={} externalId={}", provider.getWireName(), result.getExternalId(), e);
            throw new PaymentException(PaymentErrorCode.PROVIDER_ERROR,
                    "Provider returned a payment id that is already in use", provider, true, e);
        }
        idempotencyService.remember(saved);
        log.info("Payment created: paymentId={} provider={} externalId={} status={}",
                saved.getId(), provider.getWireName(), saved.getExternalId(), saved.getStatus().getValue());

        return lockRegistry.withLock(saved.getId(), () -> {
            propagateToTarget(saved);
            eventPublisher.publish(event(saved, PaymentEventType.PAYMENT_CREATED, null, null));
            if (saved.getStatus() != PaymentStatus.PENDING) {
                PaymentEventType.forStatus(saved.getStatus())
                        .ifPresent(type -> eventPublisher.publish(event(saved, type, PaymentStatus.PENDING, null)));
            }
            return saved;
        });
    }

    /**
     * Creates a payment for a business entity, charging what it currently owes.
     * The entity must belong to the tenant's owner.
     */
    public PaymentEntity createTargetPayment(PaymentEntityType entityType, String entityId,
                                             PaymentTargetType targetType, String targetId,
                                             PaymentProviderType provider, String returnUrl, String cancelUrl,
                                             CustomerData customer, String idempotencyKey) {
        PaymentTargetGateway gateway = targetGateways.get(targetType);
        if (gateway == null) {
            throw new PaymentException(PaymentErrorCode.INVALID_CONFIG,
                    "Payments are not available for " + targetType.getValue() + " targets");
        }
        BigDecimal amountOwed = gateway.amountOwed(targetId)
                .orElseThrow(() -> PaymentException.notFound(capitalize(targetType.getValue()) + " " + targetId));
        PaymentConfig config = configService.getConfigInternal(entityType, entityId);
        String targetOwner = gateway.ownerId(targetId).orElse(null);
        if (config.getOwnerId() != null && !config.getOwnerId().equals(targetOwner)) {
            log.warn("Target owner mismatch: entityType={} entityId={} targetType={} targetId={}",
                    entityType.getValue(), entityId, targetType.getValue(), targetId);
            throw new PaymentException(PaymentErrorCode.ACCESS_DENIED,
                    capitalize(targetType.getValue()) + " " + targetId + " does not belong to this "
                            + entityType.getValue());
        }
        return createPayment(CreatePaymentCommand.builder()
                .entityType(entityType)
                .entityId(entityId)
                .targetType(targetType)
                .targetId(targetId)
                .provider(provider)
                .amount(amountOwed)
                .customer(customer)
                .returnUrl(returnUrl)
                .cancelUrl(cancelUrl)
                .idempotencyKey(idempotencyKey)
                .build());
    }

    // ---------------------------------------------------------------- status changes

    /**
     * The strict mutation entry point: rejects a move the state machine does
     * not allow with INVALID_STATE_TRANSITION. Reporting the current status is a no-op.
     */
    public PaymentEntity updatePaymentStatus(PaymentProviderType provider, String externalId, PaymentStatus newStatus,
                                             String reason, Map<String, Object> metadata) {
        PaymentEntity payment = paymentRepository.findByProviderAndExternalId(provider, externalId)
                .orElseThrow(() -> PaymentException.notFound("Payment " + externalId));
        StatusChange change = new StatusChange(newStatus, reason, metadata);
        return transition(payment.getId(), change, true);
    }

    /**
     * Verifies and applies one provider notification. An unknown payment or an
     * out-of-order status is logged and acknowledged; a bad signature is not.
     */
    public WebhookResult handleWebhook(PaymentEntityType entityType, String entityId, PaymentProviderType provider,
                                       WebhookPayload payload, String signature) {
        PaymentConfig config = configService.getConfigInternal(entityType, entityId);
        PaymentProviderAdapter adapter = adapterFor(config, provider, config.isTestMode());
        WebhookData data = adapter.parseWebhook(payload, signature);
        if (data.getStatus() == null) {
            log.info("Webhook ignored, event carries no payment status: provider={} event={} entityId={}",
                    provider.getWireName(), data.getEvent(), entityId);
            return WebhookResult.ignored(data.getAcknowledgment());
        }

        Optional<PaymentEntity> found = locate(provider, data.getExternalId(), data.getProviderReference(),
                data.getMerchantReference());
        if (found.isEmpty()) {
            log.warn("Webhook for unknown payment: provider={} event={} externalId={} entityType={} entityId={}",
                    provider.getWireName(), data.getEvent(), data.getExternalId(), entityType.getValue(), entityId);
            return WebhookResult.ignored(data.getAcknowledgment());
        }
        PaymentEntity payment = found.get();
        if (payment.getEntityType() != entityType || !payment.getEntityId().equals(entityId)) {
            log.warn("Webhook entity mismatch: paymentId={} provider={} pathEntity={}:{} paymentEntity={}:{}",
                    payment.getId(), provider.getWireName(), entityType.getValue(), entityId,
                    payment.getEntityType().getValue(), payment.getEntityId());
            return WebhookResult.ignored(data.getAcknowledgment());
        }

        StatusChange change = new StatusChange(data.getStatus(), "webhook " + data.getEvent(), data.getMetadata());
        change.providerReference = data.getProviderReference();
        PaymentStatus before = payment.getStatus();
        PaymentEntity updated = transition(payment.getId(), change, false);
        boolean applied = updated.getStatus() != before;
        log.info("Webhook processed: paymentId={} provider={} event={} reported={} status={} applied={}",
                updated.getId(), provider.getWireName(), data.getEvent(), data.getStatus().getValue(),
                updated.getStatus().getValue(), applied);
        return new WebhookResult(data.getAcknowledgment(), updated.getId(), updated.getStatus(), applied);
    }

    /** Poll path: asks the provider and reconciles exactly as a webhook would. */
    public PaymentEntity checkPaymentStatus(String paymentId) {
        PaymentEntity payment = getPayment(paymentId);
        if (payment.getStatus().isTerminal()) {
            log.debug("Status check skipped, payment is terminal: paymentId={} status={}",
                    paymentId, payment.getStatus().getValue());
            return payment;
        }
        ProviderStatusInfo info = adapterFor(payment).getPaymentStatus(payment.getExternalId());
        return reconcile(payment, info, "status check");
    }

    public PaymentEntity refundPayment(String paymentId, BigDecimal amount, String reason) {
        return lockRegistry.withLock(paymentId, () -> {
            PaymentEntity payment = getPayment(paymentId);
            if (!payment.getStatus().isRefundable()) {
                throw PaymentException.invalidTransition(payment.getStatus(), PaymentStatus.REFUNDED);
            }
            BigDecimal remaining = payment.getRemainingAmount().subtract(pendingRefundTotal(payment));
            BigDecimal refundAmount = amount != null ? amount : remaining;
            if (refundAmount.signum() <= 0 || refundAmount.compareTo(remaining) > 0) {
                throw new PaymentException(PaymentErrorCode.INVALID_AMOUNT,
                        "Refund amount must be positive and at most " + remaining.max(BigDecimal.ZERO).toPlainString());
            }
            CurrencyPrecision.requireFits(refundAmount, payment.getCurrency());
            ProviderRefundResult result = adapterFor(payment).refund(ProviderRefundRequest.builder()
                    .externalPaymentId(payment.getExternalId())
                    .amount(refundAmount)
                    .currency(payment.getCurrency())
                    .reason(reason)
                    .idempotencyKey("refund_" + paymentId + "_" + payment.getRefunds().size())
                    .build());
            if (result.getStatus() == RefundStatus.FAILED) {
                log.warn("Refund declined by provider: paymentId={} provider={} amount={}",
                        paymentId, payment.getProvider().getWireName(), refundAmount);
                throw new PaymentException(PaymentErrorCode.REFUND_FAILED,
                        "Refund was declined by " + payment.getProvider().getDisplayName(), payment.getProvider());
            }
            BigDecimal refunded = result.getAmount() != null ? result.getAmount() : refundAmount;
            PaymentRefundEntity refund = PaymentRefundEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .externalRefundId(result.getExternalRefundId())
                    .amount(refunded)
                    .status(result.getStatus())
                    .reason(reason)
                    .providerReported(false)
                    .build();
            if (result.getStatus() == RefundStatus.PENDING) {
                log.info("Refund pending at provider: paymentId={} refundId={} amount={}",
                        paymentId, result.getExternalRefundId(), refunded);
                return transactionTemplate.execute(status -> {
                    PaymentEntity current = reload(paymentId);
                    current.getRefunds().add(refund);
                    return paymentRepository.save(current);
                });
            }
            BigDecimal newRemaining = payment.getRemainingAmount().subtract(refunded);
            StatusChange change = new StatusChange(
                    newRemaining.signum() <= 0 ? PaymentStatus.REFUNDED : PaymentStatus.PARTIALLY_REFUNDED,
                    reason != null ? reason : "refund", null);
            change.refund = refund;
            log.info("Refund succeeded: paymentId={} refundId={} amount={} remaining={}",
                    paymentId, result.getExternalRefundId(), refunded, newRemaining.max(BigDecimal.ZERO));
            return transition(paymentId, change, true);
        });
    }

    public PaymentEntity cancelPayment(String paymentId) {
        return lockRegistry.withLock(paymentId, () -> {
            PaymentEntity payment = getPayment(paymentId);
            if (!payment.getStatus().isCancelable()) {
                throw PaymentException.invalidTransition(payment.getStatus(), PaymentStatus.CANCELED);
            }
            ProviderStatusInfo info = adapterFor(payment).cancelPayment(payment.getExternalId());
            PaymentStatus reported = info.getStatus() != null ? info.getStatus() : PaymentStatus.CANCELED;
            if (reported != PaymentStatus.CANCELED) {
                log.warn("Provider did not confirm cancellation: paymentId={} provider={} reported={}",
                        paymentId, payment.getProvider().getWireName(), reported.getValue());
                return reconcile(payment, info, "cancel request");
            }
            StatusChange change = new StatusChange(PaymentStatus.CANCELED, REASON_USER_CANCEL, info.getMetadata());
            return transition(paymentId, change, true);
        });
    }

    public PaymentEntity capturePayment(String paymentId, BigDecimal amount) {
        return lockRegistry.withLock(paymentId, () -> {
            PaymentEntity payment = getPayment(paymentId);
            if (payment.getStatus() != PaymentStatus.WAITING_FOR_CAPTURE) {
                throw PaymentException.invalidTransition(payment.getStatus(), PaymentStatus.SUCCEEDED);
            }
            if (amount != null && (amount.signum() <= 0 || amount.compareTo(payment.getAmount()) > 0)) {
                throw new PaymentException(PaymentErrorCode.INVALID_AMOUNT,
                        "Capture amount must be positive and at most " + payment.getAmount().toPlainString());
            }
            if (amount != null) {
                CurrencyPrecision.requireFits(amount, payment.getCurrency());
            }
            ProviderStatusInfo info = adapterFor(payment).capturePayment(payment.getExternalId(), amount);
            return reconcile(payment, info, "capture");
        });
    }

    // ---------------------------------------------------------------- crypto rail

    public List<PendingCryptoPayment> findPendingCryptoPayments() {
        return pendingCryptoPaymentView.findPending();
    }

    /** Settles an on-chain invoice with the transfer that paid it. Acts only while still pending. */
    public PaymentEntity confirmCryptoPayment(String paymentId, String transactionId, Instant paidAt, BigDecimal receivedAmount) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(META_TRANSACTION_ID, transactionId);
        if (receivedAmount != null) {
            metadata.put("receivedAmount", receivedAmount.toPlainString());
        }
        if (paidAt != null) {
            metadata.put("paidAt", paidAt.toString());
        }
        StatusChange change = new StatusChange(PaymentStatus.SUCCEEDED, "on-chain transfer confirmed", metadata);
        change.paidAt = paidAt;
        return transition(paymentId, change, false);
    }

    /** Cancels an on-chain invoice whose window passed without a matching transfer. */
    public PaymentEntity expireCryptoPayment(String paymentId) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(META_REASON, REASON_EXPIRED);
        return transition(paymentId, new StatusChange(PaymentStatus.CANCELED, REASON_EXPIRED, metadata), false);
    }

    /** Adapter for the tenant and network of an on-chain invoice. */
    public CryptoTrc20Adapter cryptoAdapterFor(PendingCryptoPayment payment) {
        PaymentConfig config = configService.getConfigInternal(payment.getEntityType(), payment.getEntityId());
        return (CryptoTrc20Adapter) adapterFor(config, PaymentProviderType.CRYPTO_TRC20, payment.isTestnet());
    }

    // ---------------------------------------------------------------- queries

    public PaymentEntity getPayment(String paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> PaymentException.notFound("Payment " + paymentId));
    }

    public PaymentEntity getPaymentByExternalId(PaymentProviderType provider, String externalId) {
        return paymentRepository.findByProviderAndExternalId(provider, externalId)
                .orElseThrow(() -> PaymentException.notFound("Payment " + externalId));
    }

    public Page<PaymentEntity> getPaymentsByEntity(PaymentEntityType entityType, String entityId, PaymentStatus status,
                                                   int page, int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        return status != null
                ? paymentRepository.findByEntityTypeAndEntityIdAndStatus(entityType, entityId, status, pageable)
                : paymentRepository.findByEntityTypeAndEntityId(entityType, entityId, pageable);
    }

    public PaymentEntity getPaymentByTarget(PaymentTargetType targetType, String targetId) {
        return paymentRepository.findFirstByTargetTypeAndTargetIdOrderByCreatedAtDesc(targetType, targetId)
                .orElseThrow(() -> PaymentException.notFound("Payment for " + targetType.getValue() + " " + targetId));
    }

    // ---------------------------------------------------------------- internals

    private PaymentEntity reconcile(PaymentEntity payment, ProviderStatusInfo info, String source) {
        if (info == null || info.getStatus() == null) {
            return payment;
        }
        Map<String, Object> metadata = info.getMetadata() != null ? new HashMap<>(info.getMetadata()) : new HashMap<>();
        String reason = metadata.get(META_REASON) != null ? String.valueOf(metadata.get(META_REASON)) : source;
        StatusChange change = new StatusChange(info.getStatus(), reason, metadata);
        change.providerReference = info.getProviderReference();
        change.paidAt = info.getPaidAt();
        return transition(payment.getId(), change, false);
    }

    /**
     * Applies one status change under the payment's lock. In strict mode a
     * disallowed move throws; otherwise it is logged and the payment is
     * returned unchanged. Reporting the current status changes nothing but
     * re-delivers the status to the business entity, which is idempotent.
     */
    private PaymentEntity transition(String paymentId, StatusChange change, boolean strict) {
        return lockRegistry.withLock(paymentId, () -> {
            Outcome outcome = transactionTemplate.execute(txStatus -> {
                PaymentEntity payment = reload(paymentId);
                boolean referenceChanged = false;
                if (change.providerReference != null && payment.getProviderReference() == null) {
                    payment.setProviderReference(change.providerReference);
                    referenceChanged = true;
                }
                PaymentStatus from = payment.getStatus();
                if (change.status != from && !from.canTransitionTo(change.status)) {
                    if (strict) {
                        throw PaymentException.invalidTransition(from, change.status);
                    }
                    log.warn("Out-of-order status ignored: paymentId={} current={} reported={} reason={}",
                            paymentId, from.getValue(), change.status.getValue(), change.reason);
                    return new Outcome(referenceChanged ? paymentRepository.save(payment) : payment, null);
                }
                Instant now = clock.instant();
                BigDecimal refundedBefore = payment.getRefundedAmount();
                if (change.refund != null) {
                    payment.getRefunds().add(change.refund);
                    payment.setRefundedAmount(payment.getRefundedAmount().add(change.refund.getAmount()));
                }
                PaymentStatus to = applyProviderRefunds(payment, change.status, change.metadata);
                if (to == from) {
                    if (payment.getRefundedAmount().compareTo(refundedBefore) != 0) {
                        PaymentEntity saved = paymentRepository.saveAndFlush(payment);
                        log.info("Refund recorded: paymentId={} status={} refundedAmount={}",
                                paymentId, from.getValue(), saved.getRefundedAmount());
                        return new Outcome(saved, from);
                    }
                    log.debug("Duplicate status report ignored: paymentId={} status={}", paymentId, from.getValue());
                    return new Outcome(referenceChanged ? paymentRepository.save(payment) : payment, null);
                }
                applyTransition(payment, to, change.reason, change.metadata, change.paidAt != null ? change.paidAt : now);
                PaymentEntity saved = paymentRepository.saveAndFlush(payment);
                log.info("Payment status changed: paymentId={} provider={} from={} to={} reason={}",
                        paymentId, saved.getProvider().getWireName(), from.getValue(), to.getValue(), change.reason);
                return new Outcome(saved, from);
            });
            PaymentEntity payment = outcome.payment;
            propagateToTarget(payment);
            if (outcome.previousStatus != null) {
                PaymentEventType.forStatus(payment.getStatus()).ifPresent(type ->
                        eventPublisher.publish(event(payment, type, outcome.previousStatus, change.reason)));
            }
            return payment;
        });
    }

    /**
     * Refund amounts the provider reported. A reported full refund completes
     * {@code refundedAmount}; a reported partial refund total is recorded when
     * it exceeds what is known. Refunds still pending here are settled first,
     * oldest first, and only the rest becomes a provider-reported record.
     */
    private PaymentStatus applyProviderRefunds(PaymentEntity payment, PaymentStatus reported, Map<String, Object> metadata) {
        if (reported == PaymentStatus.PARTIALLY_REFUNDED && metadata != null && metadata.get(META_REFUNDED_AMOUNT) != null) {
            BigDecimal total = new BigDecimal(String.valueOf(metadata.get(META_REFUNDED_AMOUNT)));
            BigDecimal delta = total.min(payment.getAmount()).subtract(payment.getRefundedAmount());
            if (delta.signum() > 0) {
                settleReportedRefund(payment, delta);
            }
            if (payment.getRemainingAmount().signum() <= 0) {
                return PaymentStatus.REFUNDED;
            }
        }
        if (reported == PaymentStatus.REFUNDED && payment.getRemainingAmount().signum() > 0) {
            settleReportedRefund(payment, payment.getRemainingAmount());
        }
        return reported;
    }

    private void settleReportedRefund(PaymentEntity payment, BigDecimal amount) {
        BigDecimal unexplained = amount;
        List<PaymentRefundEntity> pending = payment.getRefunds().stream()
                .filter(refund -> refund.getStatus() == RefundStatus.PENDING)
                .sorted(Comparator.comparing(PaymentRefundEntity::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
        for (PaymentRefundEntity refund : pending) {
            if (refund.getAmount().compareTo(unexplained) > 0) {
                break;
            }
            refund.setStatus(RefundStatus.SUCCEEDED);
            payment.setRefundedAmount(payment.getRefundedAmount().add(refund.getAmount()));
            unexplained = unexplained.subtract(refund.getAmount());
            log.info("Pending refund settled by provider report: paymentId={} refundId={} amount={}",
                    payment.getId(), refund.getExternalRefundId(), refund.getAmount());
        }
        if (unexplained.signum() > 0) {
            payment.getRefunds().add(PaymentRefundEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .amount(unexplained)
                    .status(RefundStatus.SUCCEEDED)
                    .reason("reported by provider")
                    .providerReported(true)
                    .build());
            payment.setRefundedAmount(payment.getRefundedAmount().add(unexplained));
        }
    }

    private static BigDecimal pendingRefundTotal(PaymentEntity payment) {
        return payment.getRefunds().stream()
                .filter(refund -> refund.getStatus() == RefundStatus.PENDING)
                .map(PaymentRefundEntity::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private void applyTransition(PaymentEntity payment, PaymentStatus to, String reason,
                                 Map<String, Object> metadata, Instant at) {
        PaymentStatus from = payment.getStatus();
        payment.getStatusHistory().add(StatusHistoryEntry.builder()
                .status(to)
                .previousStatus(from)
                .changedAt(at)
                .reason(reason)
                .metadata(metadata != null && !metadata.isEmpty() ? new HashMap<>(metadata) : null)
                .build());
        payment.setStatus(to);
        if (to == PaymentStatus.SUCCEEDED && payment.getPaidAt() == null) {
            payment.setPaidAt(at);
        }
        if (to == PaymentStatus.CANCELED && payment.getCanceledAt() == null) {
            payment.setCanceledAt(at);
        }
        if (to == PaymentStatus.FAILED && payment.getErrorMessage() == null) {
            payment.setErrorMessage(reason);
        }
        if (metadata != null) {
            Map<String, Object> merged = payment.getMetadata() != null ? new HashMap<>(payment.getMetadata()) : new HashMap<>();
            merged.putAll(metadata);
            payment.setMetadata(merged);
            Object txId = metadata.get(META_TRANSACTION_ID);
            if (payment.getProvider() == PaymentProviderType.CRYPTO_TRC20 && txId != null
                    && payment.getOnChainTransactionId() == null) {
                payment.setOnChainTransactionId(String.valueOf(txId));
            }
        }
    }

    private Optional<PaymentEntity> locate(PaymentProviderType provider, String externalId,
                                           String providerReference, String merchantReference) {
        Optional<PaymentEntity> found = externalId != null
                ? paymentRepository.findByProviderAndExternalId(provider, externalId) : Optional.empty();
        if (found.isEmpty() && providerReference != null) {
            found = paymentRepository.findFirstByProviderAndProviderReference(provider, providerReference);
        }
        if (found.isEmpty() && merchantReference != null) {
            found = paymentRepository.findFirstByProviderAndIdempotencyKey(provider, merchantReference);
        }
        return found;
    }

    private Optional<PaymentEntity> findByIdempotencyKey(PaymentProviderType provider, String idempotencyKey) {
        return idempotencyService.find(provider, idempotencyKey)
                .flatMap(record -> paymentRepository.findById(record.getPaymentId()));
    }

    private PaymentEntity reload(String paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> PaymentException.notFound("Payment " + paymentId));
    }

    private PaymentProviderAdapter adapterFor(PaymentEntity payment) {
        PaymentConfig config = configService.getConfigInternal(payment.getEntityType(), payment.getEntityId());
        return adapterFor(config, payment.getProvider(), payment.isTestMode());
    }

    private PaymentProviderAdapter adapterFor(PaymentConfig config, PaymentProviderType provider, boolean testMode) {
        return adapterCache.get(config, provider, testMode, () -> {
            Map<String, Object> settings = config.getProviderSettings().get(provider.getWireName());
            if (settings == null || settings.isEmpty()) {
                throw new PaymentException(PaymentErrorCode.INVALID_CONFIG,
                        provider.getDisplayName() + " is not configured", provider);
            }
            return providerFactory.create(provider, settings, testMode);
        });
    }

    private void propagateToTarget(PaymentEntity payment) {
        PaymentTargetGateway gateway = targetGateways.get(payment.getTargetType());
        if (gateway == null) {
            log.debug("No target gateway for payment: paymentId={} targetType={}",
                    payment.getId(), payment.getTargetType().getValue());
            return;
        }
        gateway.setPaymentStatus(payment.getTargetId(), payment.getId(), EntityPaymentStatus.from(payment.getStatus()));
    }

    private void validateAmount(BigDecimal amount, String currency, PaymentModuleSettings settings) {
        if (amount == null || amount.signum() <= 0) {
            throw new PaymentException(PaymentErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
        CurrencyPrecision.requireFits(amount, currency);
        if (settings.getMinAmount() != null && amount.compareTo(settings.getMinAmount()) < 0) {
            throw new PaymentException(PaymentErrorCode.INVALID_AMOUNT,
                    "Amount must be at least " + settings.getMinAmount().toPlainString());
        }
        if (settings.getMaxAmount() != null && amount.compareTo(settings.getMaxAmount()) > 0) {
            throw new PaymentException(PaymentErrorCode.INVALID_AMOUNT,
                    "Amount must be at most " + settings.getMaxAmount().toPlainString());
        }
    }

    private String generateIdempotencyKey(PaymentProviderType provider) {
        return provider.getWireName() + "_" + clock.millis() + "_" + Integer.toHexString(random.nextInt() & 0x7fffffff);
    }

    private PaymentDomainEvent event(PaymentEntity payment, PaymentEventType type, PaymentStatus previous, String reason) {
        return PaymentDomainEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .paymentId(payment.getId())
                .externalId(payment.getExternalId())
                .provider(payment.getProvider().getWireName())
                .entityType(payment.getEntityType().getValue())
                .entityId(payment.getEntityId())
                .targetType(payment.getTargetType().getValue())
                .targetId(payment.getTargetId())
                .status(payment.getStatus())
                .previousStatus(previous)
                .amount(payment.getAmount())
                .refundedAmount(payment.getRefundedAmount())
                .currency(payment.getCurrency())
                .reason(reason)
                .testMode(payment.isTestMode())
                .timestamp(clock.instant())
                .build();
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private static final class StatusChange {
        private final PaymentStatus status;
        private final String reason;
        private final Map<String, Object> metadata;
        private String providerReference;
        private Instant paidAt;
        private PaymentRefundEntity refund;

        private StatusChange(PaymentStatus status, String reason, Map<String, Object> metadata) {
            this.status = status;
            this.reason = reason;
            this.metadata = metadata;
        }
    }

    private static final class Outcome {
        private final PaymentEntity payment;
        private final PaymentStatus previousStatus;

        private Outcome(PaymentEntity payment, PaymentStatus previousStatus) {
            this.payment = payment;
            this.previousStatus = previousStatus;
        }
    }
}
