package com.example.sqlpilot.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.example.sqlpilot.model.OptimizationRequest;
import com.example.sqlpilot.model.OutcomeStatus;
import com.example.sqlpilot.model.dto.OptimizeRequest;
import com.example.sqlpilot.model.dto.OptimizeResponse;
import com.example.sqlpilot.service.OptimizationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "SQL optimization", description = "Verified SQL query optimization")
public class OptimizeController {

    private final OptimizationService optimizationService;

    @PostMapping("/optimize")
    @Operation(summary = "Optimize a SQL query",
            description = "Returns a rewrite or index only if it was proven equivalent and faster on the shadow database")
    public Mono<ResponseEntity<OptimizeResponse>> optimize(@Valid @RequestBody OptimizeRequest request) {
        long started = System.currentTimeMillis();
        OptimizationRequest prepared = optimizationService.prepare(request.getSql(), request.getDatabase());
        log.debug("Accepted optimization request {}", prepared.getId());

        return optimizationService.optimize(prepared)
                .map(outcome -> {
                    OptimizeResponse body = OptimizeResponse.from(outcome, System.currentTimeMillis() - started);
                    HttpStatus status = outcome.getStatus() == OutcomeStatus.FATAL_ERROR
                            ? HttpStatus.SERVICE_UNAVAILABLE
                            : HttpStatus.OK;
                    return ResponseEntity.status(status).body(body);
                });
    }
}
