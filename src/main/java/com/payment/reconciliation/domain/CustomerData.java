package com.payment.reconciliation.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import jakarta.validation.constraints.Email;
import lombok.Builder;
import lombok.Value;

/**
 * Optional payer details passed to providers that need them (receipts, pre-filled forms).
 */
@Value
@Builder
@JsonDeserialize(builder = CustomerData.CustomerDataBuilder.class)
@JsonPOJOBuilder(withPrefix = "")
public class CustomerData {

    @Email
    String email;
    String phone;
    String name;
}
