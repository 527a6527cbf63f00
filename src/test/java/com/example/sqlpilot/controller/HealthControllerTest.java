package com.example.sqlpilot.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import com.example.sqlpilot.service.HealthService;

@WebMvcTest(HealthController.class)
@ActiveProfiles("test")
public class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HealthService healthService;

    @Test
    public void health_AllComponentsOk_ReturnsHealthy() throws Exception {
        Map<String, String> components = new LinkedHashMap<>();
        components.put("database", "ok (H2 2.2.224)");
        components.put("llm", "ok (gpt-4o-mini at https://api.openai.com/v1)");
        when(healthService.checkComponents()).thenReturn(components);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.components.database").value("ok (H2 2.2.224)"));
    }

    @Test
    public void health_DatabaseDown_ReturnsDegraded() throws Exception {
        Map<String, String> components = new LinkedHashMap<>();
        components.put("database", "failed (Connection refused)");
        components.put("llm", "ok (gpt-4o-mini at https://api.openai.com/v1)");
        when(healthService.checkComponents()).thenReturn(components);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"));
    }
}
