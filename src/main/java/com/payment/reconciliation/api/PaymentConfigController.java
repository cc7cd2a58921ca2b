package com.payment.reconciliation.api;

import com.payment.reconciliation.core.PaymentConfigService;
import com.payment.reconciliation.core.ProviderFactory;
import com.payment.reconciliation.domain.PaymentConfig;
import com.payment.reconciliation.domain.PaymentConfigStatus;
import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.ProviderInfo;
import com.payment.reconciliation.domain.ProviderTestResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Tenant payment configuration. Secrets are always returned masked; sending
 * a masked value back on save keeps the stored secret.
 */
@RestController
@RequestMapping("/api/v1/payment-configs")
@RequiredArgsConstructor
@Tag(name = "Payment configuration", description = "Per-tenant provider credentials and payment settings")
public class PaymentConfigController {

    static final String USER_HEADER = "X-User-Id";

    private final PaymentConfigService configService;
    private final ProviderFactory providerFactory;

    @GetMapping("/providers")
    @Operation(summary = "Supported providers", description = "Required and secret fields, currencies and capabilities per provider.")
    public ResponseEntity<List<ProviderInfo>> providers() {
        return ResponseEntity.ok(providerFactory.getProviderInfos());
    }

    @GetMapping("/{entityType}/{entityId}")
    @Operation(summary = "Get config", description = "Returns the stored config with secrets masked, or defaults when none is saved.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Config (masked)"),
            @ApiResponse(responseCode = "403", description = "Config belongs to another owner")
    })
    public ResponseEntity<PaymentConfig> get(@PathVariable String entityType,
                                             @PathVariable String entityId,
                                             @RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(configService.getConfig(PaymentEntityType.fromValue(entityType), entityId, userId));
    }

    @PutMapping("/{entityType}/{entityId}")
    @Operation(summary = "Save config", description = "Validates every active provider's settings, encrypts secrets and stores the config.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Saved config (masked)"),
            @ApiResponse(responseCode = "400", description = "Invalid provider settings. Body: { \"error\": \"INVALID_CONFIG\", \"message\": ... }"),
            @ApiResponse(responseCode = "403", description = "Config belongs to another owner")
    })
    public ResponseEntity<PaymentConfig> save(@PathVariable String entityType,
                                              @PathVariable String entityId,
                                              @RequestHeader(USER_HEADER) String userId,
                                              @Valid @RequestBody PaymentConfigRequestDto dto) {
        return ResponseEntity.ok(configService.saveConfig(
                PaymentEntityType.fromValue(entityType), entityId, userId, dto.toUpdate()));
    }

    @DeleteMapping("/{entityType}/{entityId}")
    @Operation(summary = "Delete config")
    public ResponseEntity<Void> delete(@PathVariable String entityType,
                                       @PathVariable String entityId,
                                       @RequestHeader(USER_HEADER) String userId) {
        configService.deleteConfig(PaymentEntityType.fromValue(entityType), entityId, userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{entityType}/{entityId}/status")
    @Operation(summary = "Payment availability", description = "Public summary for checkout pages: enabled flag, usable providers, currency.")
    public ResponseEntity<PaymentConfigStatus> status(@PathVariable String entityType, @PathVariable String entityId) {
        return ResponseEntity.ok(configService.getStatus(PaymentEntityType.fromValue(entityType), entityId));
    }

    @PostMapping("/{entityType}/{entityId}/test/{provider}")
    @Operation(summary = "Test provider connection", description = "Checks stored settings and makes one credential check against the provider.")
    public ResponseEntity<ProviderTestResult> test(@PathVariable String entityType,
                                                   @PathVariable String entityId,
                                                   @PathVariable String provider,
                                                   @RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(configService.testProvider(
                PaymentEntityType.fromValue(entityType), entityId, userId, PaymentProviderType.fromValue(provider)));
    }
}
