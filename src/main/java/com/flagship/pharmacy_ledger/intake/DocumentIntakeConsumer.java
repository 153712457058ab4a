package com.flagship.pharmacy_ledger.intake;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pharmacy_ledger.cash.CashReconciliationService;
import com.flagship.pharmacy_ledger.cash.dto.StatementLineRequest;
import com.flagship.pharmacy_ledger.document.PosSaleService;
import com.flagship.pharmacy_ledger.document.SupplierInvoiceService;
import com.flagship.pharmacy_ledger.document.dto.RecordInvoiceRequest;
import com.flagship.pharmacy_ledger.document.dto.RecordSaleRequest;
import com.flagship.pharmacy_ledger.exception.AlreadyAppliedException;
import com.flagship.pharmacy_ledger.exception.BalanceMismatchException;
import com.flagship.pharmacy_ledger.exception.ConcurrencyTimeoutException;
import com.flagship.pharmacy_ledger.exception.InsufficientStockException;
import com.flagship.pharmacy_ledger.exception.ResourceNotFoundException;
import com.flagship.pharmacy_ledger.observability.CorrelationContext;
import com.flagship.pharmacy_ledger.observability.LedgerMetrics;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Kafka consumer for candidate records from the document intake pipeline.
 *
 * Acknowledgment policy:
 * - applied, or already applied before: acknowledged
 * - rejected by a business rule or malformed: acknowledged and logged at WARN, never retried
 * - lock contention exhausted: not acknowledged, so the record is redelivered
 * - anything else: not acknowledged and rethrown to the container's error handler
 */
@Component
@ConditionalOnProperty(name = "intake.consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DocumentIntakeConsumer {

    private final PosSaleService saleService;
    private final SupplierInvoiceService invoiceService;
    private final CashReconciliationService cashService;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final LedgerMetrics metrics;

    @KafkaListener(
        topics = "${kafka.topic.intake:ledger.intake}",
        groupId = "${spring.kafka.consumer.group-id:pharmacy-ledger-intake}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        CorrelationContext.bind(CorrelationContext.accept(correlationIdOf(record)));
        log.debug("Received intake record: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        String documentType = "unknown";
        try {
            IntakeEnvelope envelope = parseEnvelope(record.value());
            if (envelope == null) {
                metrics.recordIntake(documentType, "malformed");
                ack.acknowledge();
                return;
            }
            documentType = envelope.getDocumentType().name();

            route(envelope);
            metrics.recordIntake(documentType, "applied");
            ack.acknowledge();

        } catch (AlreadyAppliedException e) {
            metrics.recordIntake(documentType, "duplicate");
            log.info("Intake record at offset {} already applied: {}", record.offset(), e.getMessage());
            ack.acknowledge();
        } catch (InsufficientStockException | BalanceMismatchException e) {
            metrics.recordIntake(documentType, "rejected");
            log.warn("Intake record at offset {} rejected: {}", record.offset(), e.getMessage());
            ack.acknowledge();
        } catch (IllegalArgumentException | IllegalStateException | ResourceNotFoundException e) {
            metrics.recordIntake(documentType, "invalid");
            log.warn("Intake record at offset {} is invalid: {}", record.offset(), e.getMessage());
            ack.acknowledge();
        } catch (ConcurrencyTimeoutException e) {
            metrics.recordIntake(documentType, "retry");
            log.warn("Intake record at offset {} not applied, leaving it for redelivery: {}",
                    record.offset(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordIntake(documentType, "error");
            log.error("Error processing intake record at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.clear();
        }
    }

    private void route(IntakeEnvelope envelope) {
        switch (envelope.getDocumentType()) {
            case POS_RECEIPT -> {
                RecordSaleRequest sale = bind(envelope, RecordSaleRequest.class);
                var recorded = saleService.recordSale(sale);
                log.info("Intake POS receipt {} recorded with {} warning(s)",
                        sale.getReceiptNumber(), recorded.getWarnings().size());
            }
            case SUPPLIER_INVOICE -> {
                RecordInvoiceRequest invoice = bind(envelope, RecordInvoiceRequest.class);
                invoiceService.recordInvoice(invoice);
                log.info("Intake supplier invoice {} recorded", invoice.getInvoiceNumber());
            }
            case BANK_STATEMENT_LINE -> {
                StatementLineRequest line = bind(envelope, StatementLineRequest.class);
                cashService.importStatementEntry(line.toStatementLine());
                log.info("Intake statement line {} imported for account {}", line.getTranId(), line.getAccountId());
            }
        }
    }

    private <T> T bind(IntakeEnvelope envelope, Class<T> type) {
        if (envelope.getPayload() == null || envelope.getPayload().isNull()) {
            throw new IllegalArgumentException(envelope.getDocumentType() + " record has no payload");
        }
        T payload;
        try {
            payload = objectMapper.treeToValue(envelope.getPayload(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable " + envelope.getDocumentType() + " payload: "
                    + e.getOriginalMessage(), e);
        }
        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid " + envelope.getDocumentType() + " payload: " + details);
        }
        return payload;
    }

    private IntakeEnvelope parseEnvelope(String json) {
        if (json == null) {
            log.warn("Intake record without a value, acknowledging to skip");
            return null;
        }
        try {
            IntakeEnvelope envelope = objectMapper.readValue(json, IntakeEnvelope.class);
            if (envelope.getDocumentType() == null) {
                log.warn("Intake record without documentType, acknowledging to skip");
                return null;
            }
            return envelope;
        } catch (JsonProcessingException e) {
            log.warn("Could not parse intake envelope, acknowledging to skip: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String correlationIdOf(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        return header == null || header.value() == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }
}
