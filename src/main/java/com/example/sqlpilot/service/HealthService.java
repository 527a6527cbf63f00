package com.example.sqlpilot.service;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.example.sqlpilot.config.LLMConfig;
import com.example.sqlpilot.exception.CollaboratorUnavailableException;
import com.example.sqlpilot.shadow.ShadowDatabase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class HealthService {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    private final ShadowDatabase shadowDatabase;
    private final LLMConfig llmConfig;

    /**
     * Component name to status text. A status starting with {@code failed} marks the service degraded.
     */
    public Map<String, String> checkComponents() {
        Map<String, String> components = new LinkedHashMap<>();
        try {
            components.put("database", "ok (" + shadowDatabase.describe() + ")");
        } catch (CollaboratorUnavailableException e) {
            log.warn("Health check: database unavailable: {}", e.getMessage());
            components.put("database", "failed (" + e.getMessage() + ")");
        }

        if (llmConfig.hasApiKey()) {
            components.put("llm", "ok (" + llmConfig.getModel() + " at " + llmConfig.getApiUrl() + ")");
        } else {
            components.put("llm", "failed (API key not configured)");
        }
        return components;
    }

    public static String overallStatus(Map<String, String> components) {
        return components.values().stream().anyMatch(status -> status.startsWith("failed")) ? DEGRADED : HEALTHY;
    }
}
