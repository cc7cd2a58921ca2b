package com.payment.reconciliation.api;

import com.payment.reconciliation.crypto.CryptoMonitorStats;
import com.payment.reconciliation.crypto.CryptoPaymentMonitor;
import com.payment.reconciliation.crypto.ExchangeRateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/payments/crypto")
@RequiredArgsConstructor
@Tag(name = "Crypto", description = "USDT TRC-20 monitor and exchange rates")
public class CryptoMonitorController {

    private final CryptoPaymentMonitor monitor;
    private final ExchangeRateService exchangeRateService;

    @GetMapping("/monitor/stats")
    @Operation(summary = "Monitor statistics")
    public ResponseEntity<CryptoMonitorStats> stats() {
        return ResponseEntity.ok(monitor.getStats());
    }

    @PostMapping("/{paymentId}/check")
    @Operation(summary = "Check one crypto payment now", description = "Looks for a matching transfer immediately instead of waiting for the next tick.")
    public ResponseEntity<PaymentResponseDto> check(@PathVariable String paymentId) {
        return ResponseEntity.ok(PaymentResponseDto.from(monitor.checkPaymentNow(paymentId)));
    }

    @GetMapping("/exchange-rates/{currency}")
    @Operation(summary = "USDT rate", description = "Fiat units per 1 USDT from the given source (default coingecko).")
    public ResponseEntity<Map<String, Object>> rate(@PathVariable String currency,
                                                    @RequestParam(defaultValue = "coingecko") String source) {
        String normalized = currency.toUpperCase(Locale.ROOT);
        if (!ExchangeRateService.SOURCES.contains(source) || "manual".equals(source)) {
            throw new IllegalArgumentException("Unknown exchange rate source: " + source);
        }
        BigDecimal rate = exchangeRateService.getRate(normalized, source, null);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("currency", normalized);
        body.put("source", source);
        body.put("rate", rate);
        return ResponseEntity.ok(body);
    }
}
