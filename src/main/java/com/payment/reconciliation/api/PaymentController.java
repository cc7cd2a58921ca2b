package com.payment.reconciliation.api;

import com.payment.reconciliation.core.PaymentTransactionService;
import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.domain.PaymentTargetType;
import com.payment.reconciliation.persistence.entity.PaymentEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for creating payments and driving their lifecycle.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Create, query, refund and cancel payments")
public class PaymentController {

    private final PaymentTransactionService transactionService;

    @PostMapping
    @Operation(
            summary = "Create payment",
            description = "Creates a payment with the tenant's configured provider and returns it with the provider's "
                    + "payment URL. Repeating the call with the same idempotencyKey returns the existing payment.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment created (status pending, or already settled for some providers)",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed, payments disabled, provider not enabled or amount out of range"),
            @ApiResponse(responseCode = "402", description = "Provider declined the payment. Body: { \"error\": \"PAYMENT_DECLINED\", ... }"),
            @ApiResponse(responseCode = "502", description = "Provider error; body.retryable tells whether the call may be repeated"),
            @ApiResponse(responseCode = "503", description = "Provider unreachable or rate limited")
    })
    public ResponseEntity<PaymentResponseDto> create(@Valid @RequestBody CreatePaymentRequestDto dto) {
        PaymentEntity payment = transactionService.createPayment(dto.toCommand());
        return ResponseEntity.ok(PaymentResponseDto.from(payment));
    }

    @PostMapping("/{entityType}/{entityId}/targets/{targetType}/{targetId}")
    @Operation(summary = "Pay for a business entity",
            description = "Creates a payment for the amount the order or booking currently owes.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment created",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentResponseDto.class))),
            @ApiResponse(responseCode = "403", description = "The entity does not belong to the tenant's owner"),
            @ApiResponse(responseCode = "404", description = "Entity not found")
    })
    public ResponseEntity<PaymentResponseDto> createForTarget(@PathVariable String entityType,
                                                              @PathVariable String entityId,
                                                              @PathVariable String targetType,
                                                              @PathVariable String targetId,
                                                              @Valid @RequestBody TargetPaymentRequestDto dto) {
        PaymentEntity payment = transactionService.createTargetPayment(
                PaymentEntityType.fromValue(entityType), entityId,
                PaymentTargetType.fromValue(targetType), targetId,
                dto.getProvider(), dto.getReturnUrl(), dto.getCancelUrl(), dto.getCustomer(), dto.getIdempotencyKey());
        return ResponseEntity.ok(PaymentResponseDto.from(payment));
    }

    @GetMapping("/{paymentId}")
    @Operation(summary = "Get payment by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment found",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentResponseDto.class))),
            @ApiResponse(responseCode = "404", description = "No payment with this id")
    })
    public ResponseEntity<PaymentResponseDto> get(@PathVariable String paymentId) {
        return ResponseEntity.ok(PaymentResponseDto.from(transactionService.getPayment(paymentId)));
    }

    @GetMapping("/by-external-id/{provider}/{externalId}")
    @Operation(summary = "Get payment by provider reference", description = "Looks up a payment by the id the provider knows it under.")
    public ResponseEntity<PaymentResponseDto> getByExternalId(@PathVariable String provider, @PathVariable String externalId) {
        PaymentEntity payment = transactionService.getPaymentByExternalId(PaymentProviderType.fromValue(provider), externalId);
        return ResponseEntity.ok(PaymentResponseDto.from(payment));
    }

    @GetMapping("/by-target/{targetType}/{targetId}")
    @Operation(summary = "Latest payment for a business entity")
    public ResponseEntity<PaymentResponseDto> getByTarget(@PathVariable String targetType, @PathVariable String targetId) {
        PaymentEntity payment = transactionService.getPaymentByTarget(PaymentTargetType.fromValue(targetType), targetId);
        return ResponseEntity.ok(PaymentResponseDto.from(payment));
    }

    @GetMapping("/entity/{entityType}/{entityId}")
    @Operation(summary = "List a tenant's payments", description = "Newest first; page size is capped at 100.")
    public ResponseEntity<PaymentPageDto> listByEntity(@PathVariable String entityType,
                                                       @PathVariable String entityId,
                                                       @RequestParam(required = false) String status,
                                                       @RequestParam(defaultValue = "0") int page,
                                                       @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(PaymentPageDto.from(transactionService.getPaymentsByEntity(
                PaymentEntityType.fromValue(entityType), entityId, PaymentStatus.fromValue(status), page, size)));
    }

    @PostMapping("/{paymentId}/check-status")
    @Operation(summary = "Poll provider for status",
            description = "Asks the provider for the current status and applies it. Settled payments are returned as is.")
    public ResponseEntity<PaymentResponseDto> checkStatus(@PathVariable String paymentId) {
        return ResponseEntity.ok(PaymentResponseDto.from(transactionService.checkPaymentStatus(paymentId)));
    }

    @PostMapping("/{paymentId}/refund")
    @Operation(summary = "Refund payment", description = "Full refund when amount is omitted; partial otherwise.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Refund applied (or queued at the provider)",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Amount exceeds what is left to refund"),
            @ApiResponse(responseCode = "409", description = "Payment is not in a refundable status"),
            @ApiResponse(responseCode = "422", description = "Provider does not support refunds")
    })
    public ResponseEntity<PaymentResponseDto> refund(@PathVariable String paymentId,
                                                     @Valid @RequestBody(required = false) RefundRequestDto dto) {
        RefundRequestDto body = dto != null ? dto : new RefundRequestDto();
        log.info("Refund requested: paymentId={} amount={}", paymentId, body.getAmount());
        PaymentEntity payment = transactionService.refundPayment(paymentId, body.getAmount(), body.getReason());
        return ResponseEntity.ok(PaymentResponseDto.from(payment));
    }

    @PostMapping("/{paymentId}/cancel")
    @Operation(summary = "Cancel payment", description = "Only pending or authorized payments can be canceled.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment canceled",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentResponseDto.class))),
            @ApiResponse(responseCode = "409", description = "Payment is not in a cancelable status")
    })
    public ResponseEntity<PaymentResponseDto> cancel(@PathVariable String paymentId) {
        return ResponseEntity.ok(PaymentResponseDto.from(transactionService.cancelPayment(paymentId)));
    }

    @PostMapping("/{paymentId}/capture")
    @Operation(summary = "Capture authorized payment")
    public ResponseEntity<PaymentResponseDto> capture(@PathVariable String paymentId,
                                                      @Valid @RequestBody(required = false) CaptureRequestDto dto) {
        PaymentEntity payment = transactionService.capturePayment(paymentId, dto != null ? dto.getAmount() : null);
        return ResponseEntity.ok(PaymentResponseDto.from(payment));
    }
}
