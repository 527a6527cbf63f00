package com.example.sqlpilot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.annotation.PostConstruct;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;

@Getter
@Validated
@Configuration
@ConfigurationProperties(prefix = "llm")
public class LLMConfig {

    @NotBlank(message = "LLM API URL must not be blank")
    @Value("${llm.api-url:https://api.openai.com/v1}")
    private String apiUrl;

    @Value("${llm.api-key:}")
    private String apiKey;

    @NotBlank(message = "LLM model must not be blank")
    @Value("${llm.model:gpt-4o-mini}")
    private String model;

    @NotBlank(message = "LLM system prompt must not be blank")
    @Value("${llm.system-prompt:You are a SQL performance expert. You propose either one rewritten SELECT statement that returns exactly the same rows as the original, or one CREATE INDEX statement. Never change what the query returns.}")
    private String systemPrompt;

    @NotNull(message = "LLM temperature must not be null")
    @Min(value = 0, message = "LLM temperature must be greater than or equal to 0")
    @Max(value = 1, message = "LLM temperature must be less than or equal to 1")
    @Value("${llm.temperature:0.1}")
    private double temperature;

    @NotNull(message = "LLM max tokens must not be null")
    @Min(value = 1, message = "LLM max tokens must be greater than 0")
    @Value("${llm.max-tokens:2000}")
    private int maxTokens;

    @Min(value = 0, message = "LLM max retries must not be negative")
    @Value("${llm.max-retries:3}")
    private int maxRetries;

    @Min(value = 1, message = "LLM retry delay must be positive")
    @Value("${llm.retry-delay-ms:1000}")
    private long retryDelayMs;

    @Min(value = 1, message = "LLM response timeout must be positive")
    @Value("${llm.response-timeout-ms:60000}")
    private long responseTimeoutMs;

    @PostConstruct
    public void validate() {
        if (apiUrl == null || apiUrl.isBlank()) {
            throw new IllegalStateException("LLM API URL is not configured");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalStateException("LLM model is not configured");
        }
        if (temperature < 0 || temperature > 1) {
            throw new IllegalStateException("LLM temperature must be between 0 and 1");
        }
        if (maxTokens <= 0) {
            throw new IllegalStateException("LLM max tokens must be positive");
        }
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * API key safe to print: first four characters, the rest masked.
     */
    public String maskedApiKey() {
        if (!hasApiKey()) {
            return "<not set>";
        }
        if (apiKey.length() <= 4) {
            return "****";
        }
        return apiKey.substring(0, 4) + "****";
    }
}
