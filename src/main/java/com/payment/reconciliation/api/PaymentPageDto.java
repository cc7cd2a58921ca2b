package com.payment.reconciliation.api;

import com.payment.reconciliation.persistence.entity.PaymentEntity;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class PaymentPageDto {

    List<PaymentResponseDto> content;
    int page;
    int size;
    long totalElements;
    int totalPages;

    public static PaymentPageDto from(Page<PaymentEntity> page) {
        return new PaymentPageDto(
                page.getContent().stream().map(PaymentResponseDto::from).collect(Collectors.toList()),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages());
    }
}
