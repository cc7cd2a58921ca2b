package com.payment.reconciliation.adapters;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

/**
 * Live and sandbox base URLs for every provider. Test mode always resolves to
 * the sandbox value; where a provider has no separate sandbox host the two are equal
 * and test credentials select the sandbox.
 */
@Slf4j
@Getter
@Component
public class ProviderEndpoints {

    @Value("${payment.providers.yookassa.base-url:https://api.yookassa.ru/v3}")
    private String yookassaBaseUrl;

    @Value("${payment.providers.yookassa.sandbox-base-url:https://api.yookassa.ru/v3}")
    private String yookassaSandboxBaseUrl;

    @Value("${payment.providers.tinkoff.base-url:https://securepay.tinkoff.ru/v2}")
    private String tinkoffBaseUrl;

    @Value("${payment.providers.tinkoff.sandbox-base-url:https://rest-api-test.tinkoff.ru/v2}")
    private String tinkoffSandboxBaseUrl;

    @Value("${payment.providers.robokassa.payment-url:https://auth.robokassa.ru/Merchant/Index.aspx}")
    private String robokassaPaymentUrl;

    @Value("${payment.providers.robokassa.api-url:https://auth.robokassa.ru/Merchant/WebService/Service.asmx}")
    private String robokassaApiUrl;

    @Value("${payment.providers.stripe.base-url:https://api.stripe.com/v1}")
    private String stripeBaseUrl;

    @Value("${payment.providers.stripe.webhook-tolerance-seconds:300}")
    private long stripeWebhookToleranceSeconds;

    @Value("${payment.providers.tron.base-url:https://api.trongrid.io}")
    private String tronBaseUrl;

    @Value("${payment.providers.tron.sandbox-base-url:https://nile.trongrid.io}")
    private String tronSandboxBaseUrl;

    @Value("${payment.providers.tron.usdt-contract:TR7NHqjeKQxGTCi8q8ZY4pL8otSzgjLj6t}")
    private String usdtContract;

    @Value("${payment.providers.tron.sandbox-usdt-contract:TXLAQ63Xg1NAzckPwKHvzw7CSEmLMEqcdj}")
    private String sandboxUsdtContract;

    public ProviderEndpoints() {
    }

    /** Builds endpoints explicitly, for tests that point every provider at a mock server. */
    public ProviderEndpoints(String baseUrl) {
        this.yookassaBaseUrl = baseUrl + "/yookassa";
        this.yookassaSandboxBaseUrl = baseUrl + "/yookassa";
        this.tinkoffBaseUrl = baseUrl + "/tinkoff";
        this.tinkoffSandboxBaseUrl = baseUrl + "/tinkoff-test";
        this.robokassaPaymentUrl = baseUrl + "/robokassa/Index.aspx";
        this.robokassaApiUrl = baseUrl + "/robokassa/Service.asmx";
        this.stripeBaseUrl = baseUrl + "/stripe";
        this.stripeWebhookToleranceSeconds = 300;
        this.tronBaseUrl = baseUrl + "/tron";
        this.tronSandboxBaseUrl = baseUrl + "/tron-nile";
        this.usdtContract = "TR7NHqjeKQxGTCi8q8ZY4pL8otSzgjLj6t";
        this.sandboxUsdtContract = "TXLAQ63Xg1NAzckPwKHvzw7CSEmLMEqcdj";
    }

    @PostConstruct
    void logEndpoints() {
        log.info("Provider endpoints: yookassa={} tinkoff={} tinkoffSandbox={} stripe={} tron={} tronSandbox={}",
                yookassaBaseUrl, tinkoffBaseUrl, tinkoffSandboxBaseUrl, stripeBaseUrl, tronBaseUrl, tronSandboxBaseUrl);
    }

    public String yookassa(boolean testMode) {
        return testMode ? yookassaSandboxBaseUrl : yookassaBaseUrl;
    }

    public String tinkoff(boolean testMode) {
        return testMode ? tinkoffSandboxBaseUrl : tinkoffBaseUrl;
    }

    public String tron(boolean testnet) {
        return testnet ? tronSandboxBaseUrl : tronBaseUrl;
    }

    public String usdtContract(boolean testnet) {
        return testnet ? sandboxUsdtContract : usdtContract;
    }
}
