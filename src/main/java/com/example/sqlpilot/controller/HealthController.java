package com.example.sqlpilot.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.sqlpilot.model.dto.HealthResponse;
import com.example.sqlpilot.service.HealthService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Status of the shadow database and the language model")
public class HealthController {

    private final HealthService healthService;

    @GetMapping("/health")
    @Operation(summary = "Check component health")
    public ResponseEntity<HealthResponse> health() {
        Map<String, String> components = healthService.checkComponents();
        return ResponseEntity.ok(new HealthResponse(HealthService.overallStatus(components), components));
    }
}
