package com.payment.reconciliation.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * USDT exchange rates (fiat units per 1 USDT) from public market APIs, with a
 * short-lived cache. When a source fails, a stale cached rate is used rather
 * than failing the payment; with nothing cached the failure propagates.
 */
@Slf4j
@Service
public class ExchangeRateService {

    public static final Set<String> SOURCES = Set.of("binance", "coingecko", "coinbase", "kraken", "manual");
    static final int TOKEN_SCALE = 4;

    private final RestTemplate restTemplate;
    private final Clock clock;
    private final Map<String, CachedRate> cache = new ConcurrentHashMap<>();

    @Value("${payment.crypto.rate-cache-ttl-seconds:60}")
    private long cacheTtlSeconds = 60;

    @Value("${payment.crypto.rates.binance-url:https://api.binance.com/api/v3}")
    private String binanceUrl = "https://api.binance.com/api/v3";

    @Value("${payment.crypto.rates.coingecko-url:https://api.coingecko.com/api/v3}")
    private String coingeckoUrl = "https://api.coingecko.com/api/v3";

    @Value("${payment.crypto.rates.coinbase-url:https://api.coinbase.com/v2}")
    private String coinbaseUrl = "https://api.coinbase.com/v2";

    public ExchangeRateService(@Qualifier("providerRestTemplate") RestTemplate restTemplate, Clock clock) {
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    public ExchangeQuote quote(BigDecimal fiatAmount, String fiatCurrency, String source,
                               BigDecimal manualRate, BigDecimal markupPercent) {
        String currency = fiatCurrency.toUpperCase(Locale.ROOT);
        String effectiveSource = source != null ? source : "coingecko";
        BigDecimal baseRate = "USDT".equals(currency) ? BigDecimal.ONE : getRate(currency, effectiveSource, manualRate);
        BigDecimal rate = baseRate;
        if (markupPercent != null && markupPercent.signum() != 0 && !"USDT".equals(currency)) {
            rate = baseRate.multiply(BigDecimal.ONE.add(markupPercent.movePointLeft(2)));
        }
        BigDecimal tokenAmount = fiatAmount.divide(rate, TOKEN_SCALE, RoundingMode.HALF_UP);
        return new ExchangeQuote(fiatAmount, currency, baseRate, rate, tokenAmount, effectiveSource);
    }

    public BigDecimal getRate(String fiatCurrency, String source, BigDecimal manualRate) {
        String currency = fiatCurrency.toUpperCase(Locale.ROOT);
        if ("manual".equals(source)) {
            if (manualRate == null || manualRate.signum() <= 0) {
                throw new PaymentException(PaymentErrorCode.INVALID_CONFIG,
                        "manualExchangeRate is required when exchangeRateSource is manual",
                        PaymentProviderType.CRYPTO_TRC20);
            }
            return manualRate;
        }
        String key = source + ":" + currency;
        CachedRate cached = cache.get(key);
        Instant now = clock.instant();
        if (cached != null && cached.fetchedAt.plus(Duration.ofSeconds(cacheTtlSeconds)).isAfter(now)) {
            return cached.rate;
        }
        try {
            BigDecimal rate = fetch(source, currency);
            if (rate == null || rate.signum() <= 0) {
                throw new PaymentException(PaymentErrorCode.PROVIDER_ERROR,
                        "No USDT/" + currency + " rate from " + source, PaymentProviderType.CRYPTO_TRC20);
            }
            cache.put(key, new CachedRate(rate, now));
            log.debug("Exchange rate refreshed: source={} currency={} rate={}", source, currency, rate);
            return rate;
        } catch (RestClientException | PaymentException e) {
            if (cached != null) {
                log.warn("Exchange rate fetch failed, using stale rate: source={} currency={} ageSeconds={} error={}",
                        source, currency, Duration.between(cached.fetchedAt, now).getSeconds(), e.getMessage());
                return cached.rate;
            }
            log.error("Exchange rate fetch failed with no cached rate: source={} currency={} error={}",
                    source, currency, e.getMessage());
            throw new PaymentException(PaymentErrorCode.PROVIDER_ERROR,
                    "Exchange rate unavailable for USDT/" + currency, PaymentProviderType.CRYPTO_TRC20, true, e);
        }
    }

    private BigDecimal fetch(String source, String currency) {
        switch (source) {
            case "binance": {
                JsonNode node = restTemplate.getForObject(
                        binanceUrl + "/ticker/price?symbol=USDT{currency}", JsonNode.class, currency);
                return decimal(node != null ? node.path("price") : null);
            }
            case "coinbase": {
                JsonNode node = restTemplate.getForObject(
                        coinbaseUrl + "/exchange-rates?currency=USDT", JsonNode.class);
                return decimal(node != null ? node.path("data").path("rates").path(currency) : null);
            }
            case "kraken":
                // Kraken quotes USDT against USD only; other currencies come from CoinGecko
                if ("USD".equals(currency)) {
                    return BigDecimal.ONE;
                }
                return fetch("coingecko", currency);
            case "coingecko":
            default: {
                String vs = currency.toLowerCase(Locale.ROOT);
                JsonNode node = restTemplate.getForObject(
                        coingeckoUrl + "/simple/price?ids=tether&vs_currencies={vs}", JsonNode.class, vs);
                return decimal(node != null ? node.path("tether").path(vs) : null);
            }
        }
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return new BigDecimal(node.asText());
    }

    private static final class CachedRate {
        private final BigDecimal rate;
        private final Instant fetchedAt;

        private CachedRate(BigDecimal rate, Instant fetchedAt) {
            this.rate = rate;
            this.fetchedAt = fetchedAt;
        }
    }
}
