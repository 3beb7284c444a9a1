package com.example.plannerv1.common;

import com.example.plannerv1.common.error.ErrorLogBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class OperationsEndpointsTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ErrorLogBuffer errorLogBuffer;

    @BeforeEach
    void setUp() {
        errorLogBuffer.clear();
    }

    @Test
    void health_reportsSettings() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("UP"))
            .andExpect(jsonPath("$.data.lookaheadDays").value(90));
    }

    @Test
    void recentErrors_canBeReadAndCleared() throws Exception {
        errorLogBuffer.addError("materialize patternId=1 date=2026-01-01", new IllegalStateException("boom"));

        mockMvc.perform(get("/api/errors/recent"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.count").value(1))
            .andExpect(jsonPath("$.data[0].message").value("materialize patternId=1 date=2026-01-01"));

        mockMvc.perform(delete("/api/errors/recent"))
            .andExpect(status().isOk());
        assertThat(errorLogBuffer.recent()).isEmpty();
    }
}
