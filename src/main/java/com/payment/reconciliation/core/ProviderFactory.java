package com.payment.reconciliation.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.reconciliation.adapters.CryptoTrc20Adapter;
import com.payment.reconciliation.adapters.CryptoTrc20Settings;
import com.payment.reconciliation.adapters.ProviderEndpoints;
import com.payment.reconciliation.adapters.ProviderSettings;
import com.payment.reconciliation.adapters.RobokassaAdapter;
import com.payment.reconciliation.adapters.RobokassaSettings;
import com.payment.reconciliation.adapters.StripeAdapter;
import com.payment.reconciliation.adapters.StripeSettings;
import com.payment.reconciliation.adapters.TinkoffAdapter;
import com.payment.reconciliation.adapters.TinkoffSettings;
import com.payment.reconciliation.adapters.YooKassaAdapter;
import com.payment.reconciliation.adapters.YooKassaSettings;
import com.payment.reconciliation.crypto.ExchangeRateService;
import com.payment.reconciliation.crypto.PendingCryptoPaymentView;
import com.payment.reconciliation.crypto.UniqueAmountAllocator;
import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.ProviderInfo;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds provider adapters from a tenant's decrypted settings. The raw
 * settings are bound to the provider's typed settings class and validated
 * before construction, so a bad config fails here with every violation listed
 * rather than on first use.
 * <p>
 * Test mode is the tenant flag OR'd with what the credentials themselves say
 * (e.g. {@code sk_test_} keys), so sandbox credentials never reach a live host.
 */
@Slf4j
@Component
public class ProviderFactory {

    private final ProviderEndpoints endpoints;
    private final RestTemplate restTemplate;
    private final ProviderCallExecutor callExecutor;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final ExchangeRateService exchangeRateService;
    private final UniqueAmountAllocator amountAllocator;
    private final PendingCryptoPaymentView pendingCryptoPaymentView;
    private final Clock clock;

    public ProviderFactory(ProviderEndpoints endpoints,
                           @Qualifier("providerRestTemplate") RestTemplate restTemplate,
                           ProviderCallExecutor callExecutor,
                           ObjectMapper objectMapper,
                           Validator validator,
                           ExchangeRateService exchangeRateService,
                           UniqueAmountAllocator amountAllocator,
                           PendingCryptoPaymentView pendingCryptoPaymentView,
                           Clock clock) {
        this.endpoints = endpoints;
        this.restTemplate = restTemplate;
        this.callExecutor = callExecutor;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.exchangeRateService = exchangeRateService;
        this.amountAllocator = amountAllocator;
        this.pendingCryptoPaymentView = pendingCryptoPaymentView;
        this.clock = clock;
    }

    public PaymentProviderAdapter create(PaymentProviderType type, Map<String, Object> rawConfig, boolean testMode) {
        ProviderSettings settings = parseSettings(type, rawConfig);
        boolean effectiveTestMode = testMode || settings.isSandboxCredentials();
        log.debug("Building adapter: provider={} testMode={} sandboxCredentials={}",
                type.getWireName(), testMode, settings.isSandboxCredentials());
        switch (type) {
            case YOOKASSA:
                return new YooKassaAdapter((YooKassaSettings) settings, endpoints, restTemplate, callExecutor, effectiveTestMode);
            case TINKOFF:
                return new TinkoffAdapter((TinkoffSettings) settings, endpoints, restTemplate, callExecutor, clock, effectiveTestMode);
            case ROBOKASSA:
                return new RobokassaAdapter((RobokassaSettings) settings, endpoints, restTemplate, callExecutor, effectiveTestMode);
            case STRIPE:
                return new StripeAdapter((StripeSettings) settings, endpoints, restTemplate, callExecutor,
                        objectMapper, clock, effectiveTestMode);
            case CRYPTO_TRC20:
                return new CryptoTrc20Adapter((CryptoTrc20Settings) settings, endpoints, restTemplate, callExecutor,
                        exchangeRateService, amountAllocator, pendingCryptoPaymentView, objectMapper, clock, effectiveTestMode);
            default:
                throw new PaymentException(PaymentErrorCode.INVALID_CONFIG, "Unsupported provider: " + type, type);
        }
    }

    /**
     * Binds and validates raw settings; throws INVALID_CONFIG listing every violation.
     */
    public ProviderSettings parseSettings(PaymentProviderType type, Map<String, Object> rawConfig) {
        ProviderSettings settings = bind(type, rawConfig);
        List<String> errors = validate(settings);
        if (!errors.isEmpty()) {
            throw new PaymentException(PaymentErrorCode.INVALID_CONFIG,
                    "Configuration error for " + type.getDisplayName() + ": " + String.join(", ", errors), type);
        }
        return settings;
    }

    /** Schema violations of raw settings; empty when valid. */
    public List<String> validationErrors(PaymentProviderType type, Map<String, Object> rawConfig) {
        try {
            return validate(bind(type, rawConfig));
        } catch (PaymentException e) {
            return List.of(e.getMessage());
        }
    }

    public List<String> getSupportedProviders() {
        return Arrays.stream(PaymentProviderType.values())
                .map(PaymentProviderType::getWireName)
                .collect(Collectors.toList());
    }

    public List<ProviderInfo> getProviderInfos() {
        return Arrays.stream(PaymentProviderType.values())
                .map(ProviderFactory::describe)
                .collect(Collectors.toList());
    }

    private ProviderSettings bind(PaymentProviderType type, Map<String, Object> rawConfig) {
        if (rawConfig == null || rawConfig.isEmpty()) {
            throw new PaymentException(PaymentErrorCode.INVALID_CONFIG,
                    "Configuration error for " + type.getDisplayName() + ": settings are missing", type);
        }
        try {
            return objectMapper.convertValue(rawConfig, settingsClass(type));
        } catch (IllegalArgumentException e) {
            throw new PaymentException(PaymentErrorCode.INVALID_CONFIG,
                    "Configuration error for " + type.getDisplayName() + ": malformed settings", type, false, e);
        }
    }

    private List<String> validate(ProviderSettings settings) {
        List<String> errors = new ArrayList<>();
        validator.validate(settings).stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(ConstraintViolation::getMessage)
                .forEach(errors::add);
        errors.addAll(settings.crossFieldErrors());
        return errors;
    }

    static Class<? extends ProviderSettings> settingsClass(PaymentProviderType type) {
        switch (type) {
            case YOOKASSA:
                return YooKassaSettings.class;
            case TINKOFF:
                return TinkoffSettings.class;
            case ROBOKASSA:
                return RobokassaSettings.class;
            case STRIPE:
                return StripeSettings.class;
            case CRYPTO_TRC20:
                return CryptoTrc20Settings.class;
            default:
                throw new IllegalArgumentException("Unsupported provider: " + type);
        }
    }

    static ProviderInfo describe(PaymentProviderType type) {
        ProviderInfo.ProviderInfoBuilder info = ProviderInfo.builder()
                .name(type.getWireName())
                .displayName(type.getDisplayName())
                .secretFields(type.getSecretFields());
        switch (type) {
            case YOOKASSA:
                return info.requiredFields(List.of("shopId", "secretKey"))
                        .currencies(List.of("RUB"))
                        .supportsRefunds(true).supportsWebhooks(true).supportsCapture(true)
                        .build();
            case TINKOFF:
                return info.requiredFields(List.of("terminalKey", "secretKey"))
                        .currencies(List.of("RUB"))
                        .supportsRefunds(true).supportsWebhooks(true).supportsCapture(true)
                        .build();
            case ROBOKASSA:
                return info.requiredFields(List.of("merchantLogin", "password1", "password2"))
                        .currencies(List.of("RUB", "USD", "EUR"))
                        .supportsRefunds(false).supportsWebhooks(true).supportsCapture(false)
                        .build();
            case STRIPE:
                return info.requiredFields(List.of("publishableKey", "secretKey"))
                        .currencies(List.of("USD", "EUR", "GBP", "RUB"))
                        .supportsRefunds(true).supportsWebhooks(true).supportsCapture(true)
                        .build();
            case CRYPTO_TRC20:
            default:
                return info.requiredFields(List.of("walletAddress"))
                        .currencies(List.of("USDT"))
                        .supportsRefunds(false).supportsWebhooks(false).supportsCapture(false)
                        .build();
        }
    }
}
