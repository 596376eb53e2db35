package com.example.guardshift.common;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void health_reportsHealthyWithVersion() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.status").value("healthy"))
            .andExpect(jsonPath("$.data.version").value("1.0.0"))
            .andExpect(jsonPath("$.data.timestamp").isNotEmpty());
    }

    @Test
    void home_listsAvailableEndpoints() throws Exception {
        mockMvc.perform(get("/api"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.version").value("1.0.0"))
            .andExpect(jsonPath("$.availableEndpoints['generate schedule']").value("POST /schedule"));
    }

    @Test
    void algorithmInfo_describesQueueScheduling() throws Exception {
        mockMvc.perform(get("/algorithm-info"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.algorithm").value("Queue-based Fair Scheduling"))
            .andExpect(jsonPath("$.data.constraints").value(hasItem("Maximum consecutive night shifts")));
    }

    @Test
    void unknownPath_returnsNotFoundEnvelope() throws Exception {
        mockMvc.perform(get("/nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.success").value(false));
    }
}
