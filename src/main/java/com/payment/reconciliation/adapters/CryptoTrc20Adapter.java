package com.payment.reconciliation.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.reconciliation.core.ProviderCallExecutor;
import com.payment.reconciliation.crypto.ExchangeQuote;
import com.payment.reconciliation.crypto.ExchangeRateService;
import com.payment.reconciliation.crypto.PendingCryptoPayment;
import com.payment.reconciliation.crypto.PendingCryptoPaymentView;
import com.payment.reconciliation.crypto.TokenTransfer;
import com.payment.reconciliation.crypto.TransferMatcher;
import com.payment.reconciliation.crypto.UniqueAmountAllocator;
import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.domain.ProviderPaymentRequest;
import com.payment.reconciliation.domain.ProviderPaymentResult;
import com.payment.reconciliation.domain.ProviderRefundRequest;
import com.payment.reconciliation.domain.ProviderRefundResult;
import com.payment.reconciliation.domain.ProviderStatusInfo;
import com.payment.reconciliation.domain.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * USDT on TRON. There is no payment API and no push notification: an invoice
 * is a wallet address plus a uniquely perturbed amount, and settlement is
 * detected by reading confirmed incoming TRC-20 transfers from TronGrid.
 * <p>
 * Testnet (Nile) uses its own explorer host and its own USDT contract, so a
 * test invoice can never be settled by a mainnet transfer.
 */
@Slf4j
public class CryptoTrc20Adapter extends AbstractProviderAdapter {

    static final String TOKEN = "USDT";
    static final String NETWORK = "TRC-20";
    static final int TOKEN_DECIMALS = 6;
    static final int PAGE_LIMIT = 200;
    static final int MAX_PAGES = 5;

    private final CryptoTrc20Settings settings;
    private final ProviderEndpoints endpoints;
    private final ExchangeRateService exchangeRateService;
    private final UniqueAmountAllocator amountAllocator;
    private final PendingCryptoPaymentView pendingView;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean testnet;

    public CryptoTrc20Adapter(CryptoTrc20Settings settings, ProviderEndpoints endpoints, RestTemplate restTemplate,
                              ProviderCallExecutor callExecutor, ExchangeRateService exchangeRateService,
                              UniqueAmountAllocator amountAllocator, PendingCryptoPaymentView pendingView,
                              ObjectMapper objectMapper, Clock clock, boolean testMode) {
        super(restTemplate, callExecutor, testMode);
        this.settings = settings;
        this.endpoints = endpoints;
        this.exchangeRateService = exchangeRateService;
        this.amountAllocator = amountAllocator;
        this.pendingView = pendingView;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.testnet = testMode || Boolean.TRUE.equals(settings.getUseTestnet());
    }

    @Override
    public PaymentProviderType getType() {
        return PaymentProviderType.CRYPTO_TRC20;
    }

    public String getWalletAddress() {
        return settings.getWalletAddress();
    }

    public boolean isTestnet() {
        return testnet;
    }

    public String watchKey() {
        return (testnet ? "nile:" : "main:") + settings.getWalletAddress();
    }

    @Override
    public ValidationResult validateConfig() {
        String url = endpoints.tron(testnet) + "/v1/accounts/" + settings.getWalletAddress();
        try {
            JsonNode response = call("validateConfig", () -> exchange(HttpMethod.GET, url, headers(), null));
            if (response == null || !response.path("success").asBoolean(true)) {
                return ValidationResult.failed("TronGrid rejected the wallet address lookup");
            }
            return ValidationResult.ok();
        } catch (PaymentException e) {
            if (e.getCode() == PaymentErrorCode.UNAUTHORIZED) {
                return ValidationResult.failed("Invalid tronGridApiKey");
            }
            return ValidationResult.failed("Could not reach TronGrid: " + e.getMessage());
        }
    }

    @Override
    public ProviderPaymentResult createPayment(ProviderPaymentRequest request) {
        ExchangeQuote quote = exchangeRateService.quote(request.getAmount(), request.getCurrency(),
                settings.getExchangeRateSource(), settings.getManualExchangeRate(), settings.getExchangeRateMarkup());
        Instant now = clock.instant();
        int expirationMinutes = settings.getExpirationMinutes() != null ? settings.getExpirationMinutes() : 60;
        Instant expiresAt = now.plus(expirationMinutes, ChronoUnit.MINUTES);
        BigDecimal tolerance = settings.effectiveTolerancePercent();
        String watchKey = watchKey();

        BigDecimal expected = amountAllocator.allocate(watchKey, quote.getTokenAmount(), tolerance,
                settings.effectiveMaxOffset(), pendingView.pendingExpectedAmounts(watchKey), expiresAt);
        String externalId = "crypto_" + UUID.randomUUID();

        Map<String, Object> metadata = new HashMap<>();
        metadata.put(PendingCryptoPaymentView.META_WALLET, settings.getWalletAddress());
        metadata.put(PendingCryptoPaymentView.META_EXPECTED_AMOUNT, expected.toPlainString());
        metadata.put(PendingCryptoPaymentView.META_ORIGINAL_AMOUNT, request.getAmount().toPlainString());
        metadata.put(PendingCryptoPaymentView.META_ORIGINAL_CURRENCY, quote.getFiatCurrency());
        metadata.put(PendingCryptoPaymentView.META_EXCHANGE_RATE, quote.getRate().toPlainString());
        metadata.put(PendingCryptoPaymentView.META_TESTNET, testnet);
        metadata.put(PendingCryptoPaymentView.META_TOLERANCE, tolerance.toPlainString());
        metadata.put("network", NETWORK);
        metadata.put("currency", TOKEN);
        metadata.put("exchangeRateSource", quote.getSource());
        metadata.put("expirationMinutes", expirationMinutes);
        metadata.put("expiresAt", expiresAt.toString());

        log.info("Crypto invoice created: externalId={} watchKey={} expectedAmount={} originalAmount={} originalCurrency={} rate={}",
                externalId, watchKey, expected.toPlainString(), request.getAmount(), quote.getFiatCurrency(), quote.getRate());
        return ProviderPaymentResult.builder()
                .externalId(externalId)
                .status(PaymentStatus.PENDING)
                .paymentUrl(paymentUri(expected, externalId, expiresAt))
                .amount(expected)
                .currency(TOKEN)
                .expiresAt(expiresAt)
                .metadata(metadata)
                .build();
    }

    /**
     * Settlement check for one invoice: SUCCEEDED with the matching transfer,
     * CANCELED once expired without one, otherwise PENDING.
     */
    @Override
    public ProviderStatusInfo getPaymentStatus(String externalId) {
        PendingCryptoPayment payment = pendingView.findByExternalId(externalId)
                .orElseThrow(() -> new PaymentException(PaymentErrorCode.PAYMENT_NOT_FOUND,
                        "Crypto payment " + externalId + " not found", getType()));
        if (payment.getStatus() != PaymentStatus.PENDING) {
            Map<String, Object> metadata = new HashMap<>();
            if (payment.getTransactionId() != null) {
                metadata.put(PendingCryptoPaymentView.META_TRANSACTION_ID, payment.getTransactionId());
            }
            return ProviderStatusInfo.builder()
                    .externalId(externalId)
                    .status(payment.getStatus())
                    .providerStatus(payment.getStatus().getValue())
                    .metadata(metadata)
                    .build();
        }
        Instant since = payment.getCreatedAt() != null ? payment.getCreatedAt() : clock.instant().minus(1, ChronoUnit.DAYS);
        Optional<TokenTransfer> match = TransferMatcher.findMatch(payment, listIncomingTransfers(since),
                pendingView::isTransactionClaimed);
        if (match.isPresent()) {
            return confirmed(externalId, match.get());
        }
        if (payment.isExpired(clock.instant())) {
            return expired(externalId);
        }
        return statusInfo(externalId, PaymentStatus.PENDING, "awaiting_transfer");
    }

    /**
     * Confirmed incoming USDT transfers to the wallet since {@code since}, oldest pages first.
     */
    public List<TokenTransfer> listIncomingTransfers(Instant since) {
        List<TokenTransfer> transfers = new ArrayList<>();
        String fingerprint = null;
        for (int page = 0; page < MAX_PAGES; page++) {
            UriComponentsBuilder builder = UriComponentsBuilder
                    .fromUriString(endpoints.tron(testnet) + "/v1/accounts/" + settings.getWalletAddress() + "/transactions/trc20")
                    .queryParam("only_to", true)
                    .queryParam("only_confirmed", true)
                    .queryParam("limit", PAGE_LIMIT)
                    .queryParam("contract_address", endpoints.usdtContract(testnet))
                    .queryParam("min_timestamp", since.toEpochMilli());
            if (fingerprint != null) {
                builder.queryParam("fingerprint", fingerprint);
            }
            String url = builder.toUriString();
            JsonNode response = call("listTransfers", () -> exchange(HttpMethod.GET, url, headers(), null));
            if (response == null) {
                break;
            }
            for (JsonNode node : response.path("data")) {
                TokenTransfer transfer = toTransfer(node);
                if (transfer != null && settings.getWalletAddress().equals(transfer.getTo())) {
                    transfers.add(transfer);
                }
            }
            fingerprint = text(response.path("meta"), "fingerprint");
            if (fingerprint == null || fingerprint.isBlank()) {
                break;
            }
        }
        log.debug("TronGrid transfers fetched: watchKey={} since={} count={}", watchKey(), since, transfers.size());
        return transfers;
    }

    /** On-chain invoices are not authorized first; nothing to cancel remotely. */
    @Override
    public ProviderStatusInfo cancelPayment(String externalId) {
        return statusInfo(externalId, PaymentStatus.CANCELED, "canceled");
    }

    @Override
    public ProviderStatusInfo capturePayment(String externalId, BigDecimal amount) {
        return getPaymentStatus(externalId);
    }

    @Override
    public ProviderRefundResult refund(ProviderRefundRequest request) {
        throw PaymentException.notSupported(getType(), "Refunds");
    }

    private ProviderStatusInfo confirmed(String externalId, TokenTransfer transfer) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(PendingCryptoPaymentView.META_TRANSACTION_ID, transfer.getTransactionId());
        metadata.put("fromAddress", transfer.getFrom());
        metadata.put("receivedAmount", transfer.getValue().toPlainString());
        if (transfer.getBlockTimestamp() != null) {
            metadata.put("paidAt", transfer.getBlockTimestamp().toString());
        }
        return ProviderStatusInfo.builder()
                .externalId(externalId)
                .status(PaymentStatus.SUCCEEDED)
                .providerStatus("confirmed")
                .amount(transfer.getValue())
                .currency(TOKEN)
                .paidAt(transfer.getBlockTimestamp())
                .metadata(metadata)
                .build();
    }

    private ProviderStatusInfo expired(String externalId) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("reason", "expired");
        return ProviderStatusInfo.builder()
                .externalId(externalId)
                .status(PaymentStatus.CANCELED)
                .providerStatus("expired")
                .metadata(metadata)
                .build();
    }

    private TokenTransfer toTransfer(JsonNode node) {
        String txId = text(node, "transaction_id");
        String raw = text(node, "value");
        if (txId == null || raw == null) {
            return null;
        }
        int decimals = node.path("token_info").path("decimals").asInt(TOKEN_DECIMALS);
        long blockTimestamp = node.path("block_timestamp").asLong(0);
        return TokenTransfer.builder()
                .transactionId(txId)
                .from(text(node, "from"))
                .to(text(node, "to"))
                .value(new BigDecimal(raw).movePointLeft(decimals))
                .blockTimestamp(blockTimestamp > 0 ? Instant.ofEpochMilli(blockTimestamp) : null)
                .build();
    }

    private String paymentUri(BigDecimal expected, String externalId, Instant expiresAt) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", "crypto_payment");
        data.put("address", settings.getWalletAddress());
        data.put("amount", expected.toPlainString());
        data.put("currency", TOKEN);
        data.put("network", NETWORK);
        data.put("paymentId", externalId);
        data.put("expiresAt", expiresAt.toString());
        try {
            byte[] json = objectMapper.writeValueAsString(data).getBytes(StandardCharsets.UTF_8);
            return "crypto://" + Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new PaymentException(PaymentErrorCode.UNKNOWN_ERROR, "Could not encode crypto payment URI",
                    getType(), false, e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (settings.getTronGridApiKey() != null && !settings.getTronGridApiKey().isBlank()) {
            headers.set("TRON-PRO-API-KEY", settings.getTronGridApiKey());
        }
        return headers;
    }
}
