package com.example.sqlpilot.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.example.sqlpilot.config.LLMConfig;
import com.example.sqlpilot.exception.CollaboratorUnavailableException;
import com.example.sqlpilot.exception.CollaboratorUnavailableException.Collaborator;
import com.example.sqlpilot.exception.ProposalInvalidException;
import com.example.sqlpilot.exception.SqlPilotException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Client for an OpenAI-compatible {@code /chat/completions} endpoint. Transport failures, 5xx and
 * 429 responses are retried with backoff; once the retry budget is spent the language model is
 * reported unavailable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LLMService {

    private final LLMConfig llmConfig;
    private final WebClient llmWebClient;
    private final ObjectMapper objectMapper;

    public Mono<String> complete(String prompt) {
        if (!StringUtils.hasText(prompt)) {
            return Mono.error(new ProposalInvalidException("Prompt cannot be empty"));
        }

        return Mono.defer(() -> {
            Map<String, Object> requestBody = prepareRequestBody(prompt);
            log.debug("Making request to LLM API: URL={}, model={}",
                    llmConfig.getApiUrl() + "/chat/completions", llmConfig.getModel());

            return llmWebClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .onStatus(this::isFatalClientError, this::handleClientError)
                    .onStatus(HttpStatusCode::is5xxServerError, this::handleServerError)
                    .bodyToMono(String.class);
        })
                .retryWhen(Retry.backoff(llmConfig.getMaxRetries(), Duration.ofMillis(llmConfig.getRetryDelayMs()))
                        .filter(this::isTransient)
                        .doBeforeRetry(signal -> log.warn("Retrying LLM API call, attempt: {} ({})",
                                signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((retryBackoffSpec, retrySignal) ->
                                new CollaboratorUnavailableException(Collaborator.LANGUAGE_MODEL,
                                        "LLM API unavailable after " + (llmConfig.getMaxRetries() + 1)
                                                + " attempts: " + retrySignal.failure().getMessage(),
                                        retrySignal.failure())))
                .switchIfEmpty(Mono.error(() -> new ProposalInvalidException("Empty response from LLM")))
                .flatMap(this::parseResponse)
                .onErrorMap(this::isUnexpected, e -> {
                    log.error("Error calling LLM API: {}", e.getMessage(), e);
                    if (isTransient(e)) {
                        return new CollaboratorUnavailableException(Collaborator.LANGUAGE_MODEL,
                                "LLM API unavailable: " + e.getMessage(), e);
                    }
                    return new ProposalInvalidException("LLM request failed: " + e.getMessage(), false, e);
                });
    }

    private Map<String, Object> prepareRequestBody(String prompt) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", llmConfig.getModel());

        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", llmConfig.getSystemPrompt()));
        messages.add(Map.of("role", "user", "content", prompt));

        requestBody.put("messages", messages);
        requestBody.put("temperature", llmConfig.getTemperature());
        requestBody.put("max_tokens", llmConfig.getMaxTokens());

        return requestBody;
    }

    private boolean isFatalClientError(HttpStatusCode status) {
        return status.is4xxClientError() && status.value() != HttpStatus.TOO_MANY_REQUESTS.value();
    }

    private boolean isTransient(Throwable e) {
        if (e instanceof WebClientRequestException) {
            return true;
        }
        if (e instanceof WebClientResponseException) {
            HttpStatusCode status = ((WebClientResponseException) e).getStatusCode();
            return status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value();
        }
        return false;
    }

    private boolean isUnexpected(Throwable e) {
        return !(e instanceof SqlPilotException) && !(e instanceof java.util.concurrent.TimeoutException);
    }

    private Mono<? extends Throwable> handleClientError(ClientResponse clientResponse) {
        HttpStatusCode status = clientResponse.statusCode();
        return clientResponse.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(errorBody -> {
                    log.error("LLM API client error: status={}, body={}", status, errorBody);
                    if (status.value() == HttpStatus.UNAUTHORIZED.value()
                            || status.value() == HttpStatus.FORBIDDEN.value()) {
                        return Mono.<Throwable>error(new CollaboratorUnavailableException(Collaborator.LANGUAGE_MODEL,
                                "LLM API rejected credentials: " + status));
                    }
                    return Mono.<Throwable>error(new ProposalInvalidException("Invalid request to LLM API: " + status
                            + " " + errorBody));
                });
    }

    private Mono<? extends Throwable> handleServerError(ClientResponse clientResponse) {
        return clientResponse.createException()
                .doOnNext(e -> log.error("LLM API server error: status={}, body={}",
                        clientResponse.statusCode(), e.getResponseBodyAsString()));
    }

    private Mono<String> parseResponse(String response) {
        if (!StringUtils.hasText(response)) {
            return Mono.error(new ProposalInvalidException("Empty response from LLM"));
        }

        try {
            JsonNode rootNode = objectMapper.readTree(response);
            JsonNode choicesNode = rootNode.path("choices");

            if (!choicesNode.isArray() || choicesNode.size() == 0) {
                log.error("Invalid response format: no choices array or empty choices");
                return Mono.error(new ProposalInvalidException("Invalid response format from LLM: no choices available"));
            }

            JsonNode messageNode = choicesNode.get(0).path("message");
            if (!messageNode.has("content") || !StringUtils.hasText(messageNode.path("content").asText())) {
                log.error("Invalid response format: no content in message");
                return Mono.error(new ProposalInvalidException("Invalid response format from LLM: no content in message"));
            }

            return Mono.just(messageNode.path("content").asText());
        } catch (Exception e) {
            log.error("Failed to parse LLM response: {}", e.getMessage());
            return Mono.error(new ProposalInvalidException("Failed to parse LLM response: " + e.getMessage(), false, e));
        }
    }
}
