package com.flagship.pharmacy_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.document.PaymentMode;
import com.flagship.pharmacy_ledger.document.PaymentStatus;
import com.flagship.pharmacy_ledger.document.PosSaleEntity;
import com.flagship.pharmacy_ledger.stock.ExpiredBatchWarning;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
public class PosSaleResponse {

    @JsonProperty("receipt_number")
    String receiptNumber;

    @JsonProperty("sale_date")
    Instant saleDate;

    @JsonProperty("pharmacy_location")
    String pharmacyLocation;

    @JsonProperty("pharmacist_name")
    String pharmacistName;

    @JsonProperty("prescription_number")
    String prescriptionNumber;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("cgst_amount")
    BigDecimal cgstAmount;

    @JsonProperty("sgst_amount")
    BigDecimal sgstAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("payment_mode")
    PaymentMode paymentMode;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    @JsonProperty("items")
    List<DocumentItemResponse> items;

    @JsonProperty("warnings")
    List<ExpiredBatchWarning> warnings;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PosSaleResponse from(PosSaleEntity sale, List<ExpiredBatchWarning> warnings) {
        return PosSaleResponse.builder()
            .receiptNumber(sale.getReceiptNumber())
            .saleDate(sale.getSaleDate())
            .pharmacyLocation(sale.getPharmacyLocation())
            .pharmacistName(sale.getPharmacistName())
            .prescriptionNumber(sale.getPrescriptionNumber())
            .subtotal(sale.getSubtotal())
            .cgstAmount(sale.getCgstAmount())
            .sgstAmount(sale.getSgstAmount())
            .totalAmount(sale.getTotalAmount())
            .paymentMode(sale.getPaymentMode())
            .paymentStatus(sale.getPaymentStatus())
            .items(sale.getItems().stream().map(DocumentItemResponse::from).collect(Collectors.toList()))
            .warnings(warnings)
            .createdAt(sale.getCreatedAt())
            .build();
    }
}
