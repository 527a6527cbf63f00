package com.example.sqlpilot.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizeRequest {

    @NotBlank(message = "SQL query is required")
    private String sql;

    /** mysql, postgresql or h2; defaults to the shadow database's dialect. */
    private String database;
}
