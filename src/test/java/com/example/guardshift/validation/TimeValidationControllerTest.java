package com.example.guardshift.validation;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class TimeValidationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void validateTime_returnsClosestGridTime() throws Exception {
        mockMvc.perform(get("/validate-time/08:20"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(false))
            .andExpect(jsonPath("$.closest_time").value("08:30"))
            .andExpect(jsonPath("$.message").value("Minutes must be a multiple of 30"));
    }

    @Test
    void validateTime_acceptsGridTimeOnApiPrefix() throws Exception {
        mockMvc.perform(get("/api/validate-time/22:00"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true))
            .andExpect(jsonPath("$.closest_time").doesNotExist());
    }
}
