package com.flagship.pharmacy_ledger.health;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testHealthReportsDatabaseAndBacklog() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.database").value("UP"))
                .andExpect(jsonPath("$.outbox_backlog").value(notNullValue()));
    }

    @Test
    void testCorrelationIdIsEchoed() throws Exception {
        mockMvc.perform(get("/health").header("X-Correlation-ID", "corr-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-ID", "corr-123"));
    }

    @Test
    void testUnsafeCorrelationIdIsReplaced() throws Exception {
        mockMvc.perform(get("/health").header("X-Correlation-ID", "bad id with spaces"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-ID", not("bad id with spaces")));
    }
}
