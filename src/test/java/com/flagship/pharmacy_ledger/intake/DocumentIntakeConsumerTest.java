package com.flagship.pharmacy_ledger.intake;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.pharmacy_ledger.cash.CashReconciliationService;
import com.flagship.pharmacy_ledger.cash.Direction;
import com.flagship.pharmacy_ledger.cash.StatementLine;
import com.flagship.pharmacy_ledger.document.PosSaleService;
import com.flagship.pharmacy_ledger.document.RecordedSale;
import com.flagship.pharmacy_ledger.document.SupplierInvoiceService;
import com.flagship.pharmacy_ledger.document.dto.RecordSaleRequest;
import com.flagship.pharmacy_ledger.exception.ConcurrencyTimeoutException;
import com.flagship.pharmacy_ledger.exception.DuplicateTransactionException;
import com.flagship.pharmacy_ledger.exception.InsufficientStockException;
import com.flagship.pharmacy_ledger.observability.LedgerMetrics;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Acknowledgment policy of the intake consumer.
 */
@ExtendWith(MockitoExtension.class)
class DocumentIntakeConsumerTest {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    @Mock
    private PosSaleService saleService;

    @Mock
    private SupplierInvoiceService invoiceService;

    @Mock
    private CashReconciliationService cashService;

    @Mock
    private LedgerMetrics metrics;

    @Mock
    private Acknowledgment ack;

    private DocumentIntakeConsumer consumer;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        consumer = new DocumentIntakeConsumer(saleService, invoiceService, cashService, objectMapper, VALIDATOR,
                metrics);
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("ledger.intake", 0, 42L, "key", value);
    }

    private static String statementLine(String tranId) {
        return "{\"documentType\":\"BANK_STATEMENT_LINE\",\"payload\":{"
                + "\"account_id\":\"HDFC-1\",\"tran_id\":\"" + tranId + "\","
                + "\"occurred_at\":\"2024-03-01T10:15:00Z\",\"direction\":\"CR\","
                + "\"amount\":\"5000.00\",\"description\":\"NEFT from Apollo\"}}";
    }

    private static String sale(String itemsJson) {
        return "{\"documentType\":\"POS_RECEIPT\",\"payload\":{"
                + "\"receipt_number\":\"POS-1\",\"sale_date\":\"2024-03-01T10:15:00Z\","
                + "\"payment_mode\":\"CASH\",\"items\":" + itemsJson + "}}";
    }

    @Test
    @DisplayName("A statement line is bound, imported and acknowledged")
    void testStatementLineApplied() {
        consumer.consume(record(statementLine("T-100")), ack);

        ArgumentCaptor<StatementLine> captor = ArgumentCaptor.forClass(StatementLine.class);
        verify(cashService).importStatementEntry(captor.capture());
        assertEquals("T-100", captor.getValue().getTranId());
        assertEquals(Direction.CR, captor.getValue().getDirection());
        assertEquals(0, new BigDecimal("5000.00").compareTo(captor.getValue().getAmount()));
        assertEquals(Instant.parse("2024-03-01T10:15:00Z"), captor.getValue().getOccurredAt());
        verify(ack).acknowledge();
        verify(metrics).recordIntake("BANK_STATEMENT_LINE", "applied");
    }

    @Test
    @DisplayName("A POS receipt reaches the sale service")
    void testPosReceiptApplied() {
        when(saleService.recordSale(any(RecordSaleRequest.class))).thenReturn(new RecordedSale(null, List.of()));

        consumer.consume(record(sale("[{\"medicine_name\":\"Dolo 650\",\"batch_number\":\"D1\","
                + "\"quantity\":2,\"unit_price\":\"30.00\"}]")), ack);

        ArgumentCaptor<RecordSaleRequest> captor = ArgumentCaptor.forClass(RecordSaleRequest.class);
        verify(saleService).recordSale(captor.capture());
        assertEquals("POS-1", captor.getValue().getReceiptNumber());
        assertEquals(2, captor.getValue().getItems().get(0).getQuantity());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("A redelivered record is acknowledged without error")
    void testDuplicateAcknowledged() {
        when(cashService.importStatementEntry(any())).thenThrow(new DuplicateTransactionException("T-100"));

        consumer.consume(record(statementLine("T-100")), ack);

        verify(ack).acknowledge();
        verify(metrics).recordIntake("BANK_STATEMENT_LINE", "duplicate");
    }

    @Test
    @DisplayName("Business rejections are acknowledged and never retried")
    void testRejectionAcknowledged() {
        when(saleService.recordSale(any())).thenThrow(new InsufficientStockException("Dolo 650|D1", 2, 1));

        consumer.consume(record(sale("[{\"medicine_name\":\"Dolo 650\",\"batch_number\":\"D1\","
                + "\"quantity\":2,\"unit_price\":\"30.00\"}]")), ack);

        verify(ack).acknowledge();
        verify(metrics).recordIntake("POS_RECEIPT", "rejected");
    }

    @Test
    @DisplayName("Malformed envelopes and invalid payloads are skipped")
    void testMalformedSkipped() {
        consumer.consume(record("{not json"), ack);
        consumer.consume(record("{\"payload\":{}}"), ack);
        consumer.consume(record(sale("[]")), ack);

        verify(ack, times(3)).acknowledge();
        verifyNoInteractions(saleService, invoiceService, cashService);
        verify(metrics).recordIntake("POS_RECEIPT", "invalid");
    }

    @Test
    @DisplayName("Exhausted lock retries leave the record unacknowledged for redelivery")
    void testConcurrencyTimeoutNotAcknowledged() {
        when(cashService.importStatementEntry(any())).thenThrow(
                new ConcurrencyTimeoutException("cash.import", 3, new CannotAcquireLockException("locked")));

        assertThrows(ConcurrencyTimeoutException.class, () -> consumer.consume(record(statementLine("T-7")), ack));

        verify(ack, never()).acknowledge();
        verify(metrics).recordIntake("BANK_STATEMENT_LINE", "retry");
    }

    @Test
    @DisplayName("Unexpected failures are rethrown to the container")
    void testUnexpectedFailureRethrown() {
        when(cashService.importStatementEntry(any())).thenThrow(new NullPointerException("boom"));

        assertThrows(NullPointerException.class, () -> consumer.consume(record(statementLine("T-8")), ack));

        verify(ack, never()).acknowledge();
    }
}
