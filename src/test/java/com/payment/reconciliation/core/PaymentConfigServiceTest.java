package com.payment.reconciliation.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.reconciliation.adapters.ProviderEndpoints;
import com.payment.reconciliation.crypto.ExchangeRateService;
import com.payment.reconciliation.crypto.PendingCryptoPaymentView;
import com.payment.reconciliation.crypto.UniqueAmountAllocator;
import com.payment.reconciliation.domain.PaymentConfig;
import com.payment.reconciliation.domain.PaymentConfigStatus;
import com.payment.reconciliation.domain.PaymentConfigUpdate;
import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentModuleSettings;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.ProviderTestResult;
import com.payment.reconciliation.persistence.entity.PaymentConfigEntity;
import com.payment.reconciliation.persistence.repository.PaymentConfigRepository;
import com.payment.reconciliation.vault.CredentialVault;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PaymentConfigServiceTest {

    private static final String SHOP_ID = "shop-42";

    private PaymentConfigRepository repository;
    private CredentialVault vault;
    private ProviderAdapterCache adapterCache;
    private PaymentConfigService service;

    @BeforeEach
    void setUp() {
        repository = mock(PaymentConfigRepository.class);
        vault = new CredentialVault("test-master-key-for-unit-tests");
        adapterCache = new ProviderAdapterCache();
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        Clock clock = Clock.systemUTC();
        ProviderFactory factory = new ProviderFactory(
                new ProviderEndpoints("http://provider.test"),
                new RestTemplate(),
                new ProviderCallExecutor(CircuitBreakerRegistry.ofDefaults(), RetryRegistry.ofDefaults()),
                new ObjectMapper(),
                validator,
                mock(ExchangeRateService.class),
                new UniqueAmountAllocator(clock),
                mock(PendingCryptoPaymentView.class),
                clock);
        service = new PaymentConfigService(repository, vault, factory, adapterCache, validator);
        when(repository.save(any(PaymentConfigEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void firstReadCreatesDisabledTestModeDefault() {
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID)).thenReturn(Optional.empty());

        PaymentConfig config = service.getConfig(PaymentEntityType.SHOP, SHOP_ID, "user-1");

        assertThat(config.isEnabled()).isFalse();
        assertThat(config.isTestMode()).isTrue();
        assertThat(config.getOwnerId()).isEqualTo("user-1");
        assertThat(config.getSettings().getCurrency()).isEqualTo("RUB");
        verify(repository).save(any(PaymentConfigEntity.class));
    }

    @Test
    void otherUsersAreDenied() {
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID))
                .thenReturn(Optional.of(stored(new HashMap<>())));

        assertThatThrownBy(() -> service.getConfig(PaymentEntityType.SHOP, SHOP_ID, "intruder"))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getCode())
                .isEqualTo(PaymentErrorCode.ACCESS_DENIED);
    }

    @Test
    void saveEncryptsSecretsAndReturnsMaskedView() {
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID)).thenReturn(Optional.empty());
        adapterCache.get(cachedConfig(), PaymentProviderType.YOOKASSA, true,
                () -> mock(PaymentProviderAdapter.class));

        PaymentConfig config = service.saveConfig(PaymentEntityType.SHOP, SHOP_ID, "user-1", PaymentConfigUpdate.builder()
                .enabled(true)
                .providers(List.of("yookassa"))
                .providerSettings(Map.of("yookassa", Map.of("shopId", "123456", "secretKey", "live_abcdefghijkl")))
                .build());

        ArgumentCaptor<PaymentConfigEntity> saved = ArgumentCaptor.forClass(PaymentConfigEntity.class);
        verify(repository).save(saved.capture());
        String storedSecret = (String) saved.getValue().getProviderSettings().get("yookassa").get("secretKey");
        assertThat(vault.isEncrypted(storedSecret)).isTrue();
        assertThat(vault.decryptField(storedSecret)).isEqualTo("live_abcdefghijkl");

        Map<String, Object> shown = config.getProviderSettings().get("yookassa");
        assertThat(shown.get("secretKey")).isEqualTo("live••••ijkl");
        assertThat(shown.get("_secretKeySet")).isEqualTo(true);
        assertThat(shown.get("shopId")).isEqualTo("123456");
        assertThat(adapterCache.size()).isZero();
    }

    @Test
    void maskedSecretOnUpdateKeepsStoredValue() {
        Map<String, Map<String, Object>> settings = new HashMap<>();
        settings.put("yookassa", vault.encryptSecrets(PaymentProviderType.YOOKASSA,
                Map.of("shopId", "123456", "secretKey", "live_abcdefghijkl")));
        PaymentConfigEntity entity = stored(settings);
        String encryptedBefore = (String) settings.get("yookassa").get("secretKey");
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID)).thenReturn(Optional.of(entity));

        service.saveConfig(PaymentEntityType.SHOP, SHOP_ID, "user-1", PaymentConfigUpdate.builder()
                .providerSettings(Map.of("yookassa", Map.of("shopId", "654321", "secretKey", "live••••ijkl",
                        "_secretKeySet", true)))
                .build());

        Map<String, Object> after = entity.getProviderSettings().get("yookassa");
        assertThat(after.get("secretKey")).isEqualTo(encryptedBefore);
        assertThat(after.get("shopId")).isEqualTo("654321");
        assertThat(after).doesNotContainKey("_secretKeySet");
    }

    @Test
    void enabledProviderWithoutSettingsIsRejected() {
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.saveConfig(PaymentEntityType.SHOP, SHOP_ID, "user-1",
                PaymentConfigUpdate.builder().providers(List.of("tinkoff")).build()))
                .isInstanceOf(PaymentException.class)
                .hasMessage("Configuration error for Tinkoff: settings are missing");
        verify(repository, never()).save(any());
    }

    @Test
    void invalidProviderSettingsAreRejected() {
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.saveConfig(PaymentEntityType.SHOP, SHOP_ID, "user-1",
                PaymentConfigUpdate.builder()
                        .providerSettings(Map.of("yookassa", Map.of("shopId", "abc", "secretKey", "live_abcdefghijkl")))
                        .build()))
                .isInstanceOf(PaymentException.class)
                .hasMessageContaining("shopId must contain only digits");
    }

    @Test
    void unknownProviderNameIsAConfigError() {
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.saveConfig(PaymentEntityType.SHOP, SHOP_ID, "user-1",
                PaymentConfigUpdate.builder().providers(List.of("paypal")).build()))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getCode())
                .isEqualTo(PaymentErrorCode.INVALID_CONFIG);
    }

    @Test
    void minAmountAboveMaxAmountIsRejected() {
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID)).thenReturn(Optional.empty());
        PaymentModuleSettings settings = PaymentModuleSettings.builder()
                .minAmount(new BigDecimal("500"))
                .maxAmount(new BigDecimal("100"))
                .build();

        assertThatThrownBy(() -> service.saveConfig(PaymentEntityType.SHOP, SHOP_ID, "user-1",
                PaymentConfigUpdate.builder().settings(settings).build()))
                .isInstanceOf(PaymentException.class)
                .hasMessageContaining("minAmount must not exceed maxAmount");
    }

    @Test
    void internalViewIsDecrypted() {
        Map<String, Map<String, Object>> settings = new HashMap<>();
        settings.put("yookassa", vault.encryptSecrets(PaymentProviderType.YOOKASSA,
                Map.of("shopId", "123456", "secretKey", "live_abcdefghijkl")));
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID))
                .thenReturn(Optional.of(stored(settings)));

        Map<String, Object> provider = service.getProviderConfig(PaymentEntityType.SHOP, SHOP_ID, PaymentProviderType.YOOKASSA);

        assertThat(provider.get("secretKey")).isEqualTo("live_abcdefghijkl");
    }

    @Test
    void unconfiguredTenantHasNoEnabledProviders() {
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.BOT, "bot-1")).thenReturn(Optional.empty());

        assertThat(service.isPaymentEnabled(PaymentEntityType.BOT, "bot-1")).isFalse();
        assertThat(service.getEnabledProviders(PaymentEntityType.BOT, "bot-1")).isEmpty();
        PaymentConfigStatus status = service.getStatus(PaymentEntityType.BOT, "bot-1");
        assertThat(status.isTestMode()).isTrue();
        assertThat(status.getCurrency()).isEqualTo("RUB");
        assertThatThrownBy(() -> service.getConfigInternal(PaymentEntityType.BOT, "bot-1"))
                .isInstanceOf(PaymentException.class)
                .hasMessage("Payments are not configured for bot bot-1");
    }

    @Test
    void connectionTestStopsWhenSettingsAreMissing() {
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID))
                .thenReturn(Optional.of(stored(new HashMap<>())));

        ProviderTestResult result = service.testProvider(PaymentEntityType.SHOP, SHOP_ID, "user-1", PaymentProviderType.STRIPE);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getSteps()).hasSize(1);
        assertThat(result.getSteps().get(0).getErrors()).containsExactly("Stripe settings are missing");
    }

    @Test
    void connectionTestReportsSchemaErrors() {
        Map<String, Map<String, Object>> settings = new HashMap<>();
        settings.put("yookassa", Map.of("shopId", "123456"));
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID))
                .thenReturn(Optional.of(stored(settings)));

        ProviderTestResult result = service.testProvider(PaymentEntityType.SHOP, SHOP_ID, "user-1", PaymentProviderType.YOOKASSA);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getSteps()).hasSize(2);
        assertThat(result.getSteps().get(1).getName()).isEqualTo("schema");
        assertThat(result.getSteps().get(1).getErrors()).contains("secretKey is required");
    }

    @Test
    void deleteEvictsCachedAdapters() {
        PaymentConfigEntity entity = stored(new HashMap<>());
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID)).thenReturn(Optional.of(entity));
        adapterCache.get(cachedConfig(), PaymentProviderType.TINKOFF, false,
                () -> mock(PaymentProviderAdapter.class));

        service.deleteConfig(PaymentEntityType.SHOP, SHOP_ID, "user-1");

        verify(repository).delete(entity);
        assertThat(adapterCache.size()).isZero();
    }

    @Test
    void saveInsideTransactionEvictsOnlyAfterCommit() {
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID))
                .thenReturn(Optional.of(stored(new HashMap<>())));
        adapterCache.get(cachedConfig(), PaymentProviderType.YOOKASSA, true,
                () -> mock(PaymentProviderAdapter.class));

        TransactionSynchronizationManager.initSynchronization();
        try {
            service.saveConfig(PaymentEntityType.SHOP, SHOP_ID, "user-1", PaymentConfigUpdate.builder()
                    .testMode(false)
                    .build());

            assertThat(adapterCache.size()).isEqualTo(1);
            List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
            assertThat(synchronizations).hasSize(1);

            synchronizations.forEach(TransactionSynchronization::afterCommit);

            assertThat(adapterCache.size()).isZero();
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void rolledBackDeleteKeepsCachedAdapters() {
        PaymentConfigEntity entity = stored(new HashMap<>());
        when(repository.findByEntityTypeAndEntityId(PaymentEntityType.SHOP, SHOP_ID)).thenReturn(Optional.of(entity));
        adapterCache.get(cachedConfig(), PaymentProviderType.TINKOFF, false,
                () -> mock(PaymentProviderAdapter.class));

        TransactionSynchronizationManager.initSynchronization();
        try {
            service.deleteConfig(PaymentEntityType.SHOP, SHOP_ID, "user-1");

            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

            assertThat(adapterCache.size()).isEqualTo(1);
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    private static PaymentConfig cachedConfig() {
        return PaymentConfig.builder()
                .entityType(PaymentEntityType.SHOP)
                .entityId(SHOP_ID)
                .version(0L)
                .updatedAt(Instant.parse("2024-05-01T12:00:00Z"))
                .build();
    }

    private static PaymentConfigEntity stored(Map<String, Map<String, Object>> providerSettings) {
        return PaymentConfigEntity.builder()
                .id("cfg-1")
                .entityType(PaymentEntityType.SHOP)
                .entityId(SHOP_ID)
                .ownerId("user-1")
                .enabled(true)
                .testMode(true)
                .providers(new ArrayList<>())
                .providerSettings(providerSettings)
                .build();
    }
}
