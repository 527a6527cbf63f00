package com.example.sqlpilot.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class LLMClientConfig {

    private final LLMConfig llmConfig;

    @Bean
    public WebClient llmWebClient(WebClient.Builder builder) {
        log.info("Initializing LLM API client with URL: {}", llmConfig.getApiUrl());

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofMillis(llmConfig.getResponseTimeoutMs()))
                .keepAlive(true);

        WebClient.Builder configured = builder
                .baseUrl(llmConfig.getApiUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (llmConfig.hasApiKey()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + llmConfig.getApiKey());
        } else {
            log.warn("LLM API key is not configured; requests will be sent without authorization");
        }
        return configured.build();
    }
}
