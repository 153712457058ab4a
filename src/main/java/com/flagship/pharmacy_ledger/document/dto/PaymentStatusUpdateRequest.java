package com.flagship.pharmacy_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.document.PaymentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class PaymentStatusUpdateRequest {

    @NotNull(message = "Payment status is required")
    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;
}
