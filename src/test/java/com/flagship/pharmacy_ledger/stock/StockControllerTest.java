package com.flagship.pharmacy_ledger.stock;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Stock endpoints: status codes, error bodies and duplicate submissions.
 */
@SpringBootTest
@AutoConfigureMockMvc
class StockControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String medicine;
    private String suffix;

    @BeforeEach
    void setUp() {
        suffix = UUID.randomUUID().toString().substring(0, 8);
        medicine = "Cetirizine-" + suffix;
    }

    private ResultActions postJson(String path, Map<String, Object> body) throws Exception {
        return mockMvc.perform(post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private Map<String, Object> receipt(String referenceId, int quantity) {
        Map<String, Object> body = new HashMap<>();
        body.put("medicine_name", medicine);
        body.put("batch_number", "B1");
        body.put("quantity", quantity);
        body.put("unit_cost", "2.00");
        body.put("reference_type", "SUPPLIER_INVOICE");
        body.put("reference_id", referenceId);
        body.put("manufacturer", "Sun Pharma");
        body.put("expiry_date", LocalDate.now().plusYears(2).toString());
        body.put("reorder_level", 5);
        return body;
    }

    private Map<String, Object> sale(String referenceId, int quantity) {
        Map<String, Object> body = new HashMap<>();
        body.put("medicine_name", medicine);
        body.put("batch_number", "B1");
        body.put("quantity", quantity);
        body.put("unit_price", "3.00");
        body.put("reference_type", "POS");
        body.put("reference_id", referenceId);
        return body;
    }

    @Test
    @DisplayName("Receipt returns 201, a resubmission returns 200 ALREADY_APPLIED")
    void testReceiveAndDuplicate() throws Exception {
        postJson("/api/stock/receipts", receipt("INV-" + suffix, 10))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.entries", hasSize(1)))
                .andExpect(jsonPath("$.entries[0].kind").value("IN"))
                .andExpect(jsonPath("$.quantities_after['" + medicine + "|B1']").value(10));

        postJson("/api/stock/receipts", receipt("INV-" + suffix, 10))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ALREADY_APPLIED"))
                .andExpect(jsonPath("$.external_id").value("SUPPLIER_INVOICE/INV-" + suffix));

        mockMvc.perform(get("/api/stock/positions/{m}/{b}", medicine, "B1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_quantity").value(10))
                .andExpect(jsonPath("$.reorder_level").value(5));
    }

    @Test
    @DisplayName("An oversell returns 409 with requested and available quantities")
    void testOversell() throws Exception {
        postJson("/api/stock/receipts", receipt("INV-" + suffix, 3)).andExpect(status().isCreated());

        postJson("/api/stock/sales", sale("POS-" + suffix, 4))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Insufficient Stock"))
                .andExpect(jsonPath("$.details.requested").value("4"))
                .andExpect(jsonPath("$.details.available").value("3"));

        postJson("/api/stock/sales", sale("POS-" + suffix, 3))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.entries[0].kind").value("OUT"));
    }

    @Test
    @DisplayName("Invalid bodies are rejected with field errors")
    void testValidation() throws Exception {
        Map<String, Object> body = receipt("INV-" + suffix, 0);
        body.remove("expiry_date");

        postJson("/api/stock/receipts", body)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.details.quantity").exists())
                .andExpect(jsonPath("$.details.expiryDate").exists());

        Map<String, Object> badType = sale("POS-" + suffix, 1);
        badType.put("reference_type", "CHEQUE");
        postJson("/api/stock/sales", badType).andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Adjustments, history and as-of quantity")
    void testAdjustAndHistory() throws Exception {
        postJson("/api/stock/receipts", receipt("INV-" + suffix, 10)).andExpect(status().isCreated());

        Map<String, Object> adjustment = new HashMap<>();
        adjustment.put("medicine_name", medicine);
        adjustment.put("batch_number", "B1");
        adjustment.put("delta", -2);
        adjustment.put("reason", "Damaged strips");
        postJson("/api/stock/adjustments", adjustment)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.entries[0].kind").value("ADJUST"));

        mockMvc.perform(get("/api/stock/positions/{m}/{b}/history", medicine, "B1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].kind").value("ADJUST"));

        mockMvc.perform(get("/api/stock/positions/{m}/{b}/quantity", medicine, "B1")
                        .param("as_of", "2000-01-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quantity").value(0));
    }

    @Test
    @DisplayName("Unknown batches return 404")
    void testUnknownBatch() throws Exception {
        mockMvc.perform(get("/api/stock/positions/{m}/{b}", medicine, "NOPE"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }
}
