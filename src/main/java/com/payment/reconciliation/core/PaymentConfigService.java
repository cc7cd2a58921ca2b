package com.payment.reconciliation.core;

import com.payment.reconciliation.domain.PaymentConfig;
import com.payment.reconciliation.domain.PaymentConfigStatus;
import com.payment.reconciliation.domain.PaymentConfigUpdate;
import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentModuleSettings;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.ProviderTestResult;
import com.payment.reconciliation.domain.ValidationResult;
import com.payment.reconciliation.persistence.entity.PaymentConfigEntity;
import com.payment.reconciliation.persistence.repository.PaymentConfigRepository;
import com.payment.reconciliation.vault.CredentialVault;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-tenant payment configuration. Secrets are encrypted before they are
 * stored, masked whenever a config leaves through {@link #getConfig}, and
 * decrypted only for internal use by the transaction service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentConfigService {

    private final PaymentConfigRepository configRepository;
    private final CredentialVault vault;
    private final ProviderFactory providerFactory;
    private final ProviderAdapterCache adapterCache;
    private final Validator validator;

    /**
     * Config with masked secrets. Creates a disabled, test-mode default owned
     * by {@code userId} on first access.
     */
    @Transactional
    public PaymentConfig getConfig(PaymentEntityType entityType, String entityId, String userId) {
        PaymentConfigEntity entity = configRepository.findByEntityTypeAndEntityId(entityType, entityId)
                .orElseGet(() -> createDefault(entityType, entityId, userId));
        checkOwner(entity, userId);
        return toConfig(entity, this::mask);
    }

    /** Config with decrypted secrets, for the engine only. */
    @Transactional(readOnly = true)
    public PaymentConfig getConfigInternal(PaymentEntityType entityType, String entityId) {
        return configRepository.findByEntityTypeAndEntityId(entityType, entityId)
                .map(entity -> toConfig(entity, this::decrypt))
                .orElseThrow(() -> new PaymentException(PaymentErrorCode.INVALID_CONFIG,
                        "Payments are not configured for " + entityType.getValue() + " " + entityId));
    }

    @Transactional
    public PaymentConfig saveConfig(PaymentEntityType entityType, String entityId, String userId, PaymentConfigUpdate update) {
        PaymentConfigEntity entity = configRepository.findByEntityTypeAndEntityId(entityType, entityId)
                .orElseGet(() -> newDefault(entityType, entityId, userId));
        checkOwner(entity, userId);
        if (entity.getOwnerId() == null) {
            entity.setOwnerId(userId);
        }

        if (update.getEnabled() != null) {
            entity.setEnabled(update.getEnabled());
        }
        if (update.getTestMode() != null) {
            entity.setTestMode(update.getTestMode());
        }
        if (update.getSettings() != null) {
            validateModuleSettings(update.getSettings());
            entity.setSettings(update.getSettings());
        }
        if (update.getProviders() != null) {
            entity.setProviders(update.getProviders().stream()
                    .map(PaymentConfigService::parseProvider)
                    .map(PaymentProviderType::getWireName)
                    .distinct()
                    .collect(Collectors.toList()));
        }

        Map<String, Map<String, Object>> stored = entity.getProviderSettings() != null
                ? new HashMap<>(entity.getProviderSettings()) : new HashMap<>();
        Set<PaymentProviderType> touched = new LinkedHashSet<>();
        if (update.getProviderSettings() != null) {
            update.getProviderSettings().forEach((name, incoming) -> {
                PaymentProviderType type = parseProvider(name);
                stored.put(type.getWireName(), vault.mergeOnUpdate(type, stored.get(type.getWireName()), incoming));
                touched.add(type);
            });
        }
        for (String name : entity.getProviders()) {
            touched.add(PaymentProviderType.fromValue(name));
        }
        for (PaymentProviderType type : touched) {
            Map<String, Object> raw = stored.get(type.getWireName());
            providerFactory.parseSettings(type, raw != null ? vault.decryptSecrets(type, raw) : null);
            stored.put(type.getWireName(), vault.encryptSecrets(type, raw));
        }
        entity.setProviderSettings(stored);

        PaymentConfigEntity saved = configRepository.save(entity);
        invalidateAfterCommit(entityType, entityId);
        log.info("Payment config saved: entityType={} entityId={} enabled={} testMode={} providers={}",
                entityType.getValue(), entityId, saved.isEnabled(), saved.isTestMode(), saved.getProviders());
        return toConfig(saved, this::mask);
    }

    @Transactional
    public void deleteConfig(PaymentEntityType entityType, String entityId, String userId) {
        configRepository.findByEntityTypeAndEntityId(entityType, entityId).ifPresent(entity -> {
            checkOwner(entity, userId);
            configRepository.delete(entity);
            invalidateAfterCommit(entityType, entityId);
            log.info("Payment config deleted: entityType={} entityId={}", entityType.getValue(), entityId);
        });
    }

    @Transactional(readOnly = true)
    public boolean isPaymentEnabled(PaymentEntityType entityType, String entityId) {
        return configRepository.findByEntityTypeAndEntityId(entityType, entityId)
                .map(PaymentConfigEntity::isEnabled)
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public List<PaymentProviderType> getEnabledProviders(PaymentEntityType entityType, String entityId) {
        return configRepository.findByEntityTypeAndEntityId(entityType, entityId)
                .filter(PaymentConfigEntity::isEnabled)
                .map(entity -> entity.getProviders().stream()
                        .map(PaymentProviderType::fromValue)
                        .collect(Collectors.toList()))
                .orElse(List.of());
    }

    /** Decrypted settings of one provider. */
    @Transactional(readOnly = true)
    public Map<String, Object> getProviderConfig(PaymentEntityType entityType, String entityId, PaymentProviderType provider) {
        PaymentConfig config = getConfigInternal(entityType, entityId);
        Map<String, Object> settings = config.getProviderSettings().get(provider.getWireName());
        if (settings == null || settings.isEmpty()) {
            throw new PaymentException(PaymentErrorCode.INVALID_CONFIG,
                    provider.getDisplayName() + " is not configured", provider);
        }
        return settings;
    }

    @Transactional(readOnly = true)
    public PaymentConfigStatus getStatus(PaymentEntityType entityType, String entityId) {
        return configRepository.findByEntityTypeAndEntityId(entityType, entityId)
                .map(entity -> PaymentConfigStatus.builder()
                        .enabled(entity.isEnabled())
                        .testMode(entity.isTestMode())
                        .providers(List.copyOf(entity.getProviders()))
                        .configuredProviders(entity.getProviderSettings().entrySet().stream()
                                .filter(e -> e.getValue() != null && !e.getValue().isEmpty())
                                .map(Map.Entry::getKey)
                                .sorted()
                                .collect(Collectors.toList()))
                        .currency(entity.getSettings() != null ? entity.getSettings().getCurrency() : null)
                        .build())
                .orElse(PaymentConfigStatus.builder()
                        .enabled(false)
                        .testMode(true)
                        .providers(List.of())
                        .configuredProviders(List.of())
                        .currency(PaymentModuleSettings.defaults().getCurrency())
                        .build());
    }

    /**
     * Connection test: stored settings present, schema valid, then one live
     * credential check against the provider. Stops at the first failing step.
     */
    public ProviderTestResult testProvider(PaymentEntityType entityType, String entityId, String userId,
                                           PaymentProviderType provider) {
        PaymentConfig config = getConfigInternal(entityType, entityId);
        if (config.getOwnerId() != null && userId != null && !config.getOwnerId().equals(userId)) {
            throw accessDenied(entityType, entityId);
        }
        List<ProviderTestResult.Step> steps = new ArrayList<>();
        Map<String, Object> raw = config.getProviderSettings().get(provider.getWireName());
        boolean configured = raw != null && !raw.isEmpty();
        steps.add(new ProviderTestResult.Step("configured", configured,
                configured ? List.of() : List.of(provider.getDisplayName() + " settings are missing")));
        if (!configured) {
            return testResult(provider, config.isTestMode(), steps);
        }

        List<String> schemaErrors = providerFactory.validationErrors(provider, raw);
        steps.add(new ProviderTestResult.Step("schema", schemaErrors.isEmpty(), schemaErrors));
        if (!schemaErrors.isEmpty()) {
            return testResult(provider, config.isTestMode(), steps);
        }

        ValidationResult connection;
        try {
            connection = providerFactory.create(provider, raw, config.isTestMode()).validateConfig();
        } catch (PaymentException e) {
            log.warn("Provider connection test failed: entityType={} entityId={} provider={} code={}",
                    entityType.getValue(), entityId, provider.getWireName(), e.getCode());
            connection = ValidationResult.failed(e.getMessage());
        }
        steps.add(new ProviderTestResult.Step("connection", connection.isValid(), connection.getErrors()));
        log.info("Provider connection test: entityType={} entityId={} provider={} success={}",
                entityType.getValue(), entityId, provider.getWireName(), connection.isValid());
        return testResult(provider, config.isTestMode(), steps);
    }

    private static ProviderTestResult testResult(PaymentProviderType provider, boolean testMode,
                                                 List<ProviderTestResult.Step> steps) {
        return ProviderTestResult.builder()
                .provider(provider.getWireName())
                .testMode(testMode)
                .success(steps.stream().allMatch(ProviderTestResult.Step::isPassed))
                .steps(steps)
                .build();
    }

    private PaymentConfigEntity createDefault(PaymentEntityType entityType, String entityId, String userId) {
        PaymentConfigEntity created = configRepository.save(newDefault(entityType, entityId, userId));
        log.info("Default payment config created: entityType={} entityId={}", entityType.getValue(), entityId);
        return created;
    }

    private static PaymentConfigEntity newDefault(PaymentEntityType entityType, String entityId, String userId) {
        return PaymentConfigEntity.builder()
                .entityType(entityType)
                .entityId(entityId)
                .ownerId(userId)
                .enabled(false)
                .testMode(true)
                .build();
    }

    /**
     * Evicts the tenant's adapters once the new config is visible to other
     * transactions; evicting before commit would let a concurrent reader
     * re-cache an adapter from the old row.
     */
    private void invalidateAfterCommit(PaymentEntityType entityType, String entityId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            adapterCache.invalidate(entityType, entityId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                adapterCache.invalidate(entityType, entityId);
            }
        });
    }

    private void validateModuleSettings(PaymentModuleSettings settings) {
        List<String> errors = validator.validate(settings).stream()
                .map(ConstraintViolation::getMessage)
                .sorted()
                .collect(Collectors.toList());
        if (settings.getMinAmount() != null && settings.getMaxAmount() != null
                && settings.getMinAmount().compareTo(settings.getMaxAmount()) > 0) {
            errors.add("minAmount must not exceed maxAmount");
        }
        if (!errors.isEmpty()) {
            throw new PaymentException(PaymentErrorCode.INVALID_CONFIG,
                    "Configuration error for payment settings: " + String.join(", ", errors));
        }
    }

    private static void checkOwner(PaymentConfigEntity entity, String userId) {
        if (entity.getOwnerId() != null && userId != null && !entity.getOwnerId().equals(userId)) {
            throw accessDenied(entity.getEntityType(), entity.getEntityId());
        }
    }

    private static PaymentException accessDenied(PaymentEntityType entityType, String entityId) {
        return new PaymentException(PaymentErrorCode.ACCESS_DENIED,
                "No access to payment settings of " + entityType.getValue() + " " + entityId);
    }

    private static PaymentProviderType parseProvider(String name) {
        try {
            return PaymentProviderType.fromValue(name);
        } catch (IllegalArgumentException e) {
            throw new PaymentException(PaymentErrorCode.INVALID_CONFIG, e.getMessage());
        }
    }

    private Map<String, Object> mask(PaymentProviderType type, Map<String, Object> settings) {
        return vault.maskSecrets(type, settings);
    }

    private Map<String, Object> decrypt(PaymentProviderType type, Map<String, Object> settings) {
        return vault.decryptSecrets(type, settings);
    }

    private static PaymentConfig toConfig(PaymentConfigEntity entity, SecretTransform transform) {
        Map<String, Map<String, Object>> settings = new HashMap<>();
        if (entity.getProviderSettings() != null) {
            entity.getProviderSettings().forEach((name, raw) -> {
                if (raw != null) {
                    settings.put(name, transform.apply(PaymentProviderType.fromValue(name), raw));
                }
            });
        }
        return PaymentConfig.builder()
                .entityType(entity.getEntityType())
                .entityId(entity.getEntityId())
                .ownerId(entity.getOwnerId())
                .enabled(entity.isEnabled())
                .testMode(entity.isTestMode())
                .settings(entity.getSettings() != null ? entity.getSettings() : PaymentModuleSettings.defaults())
                .providers(entity.getProviders() != null ? List.copyOf(entity.getProviders()) : List.of())
                .providerSettings(settings)
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    @FunctionalInterface
    private interface SecretTransform {
        Map<String, Object> apply(PaymentProviderType type, Map<String, Object> settings);
    }
}
