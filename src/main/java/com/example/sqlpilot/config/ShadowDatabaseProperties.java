package com.example.sqlpilot.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Connection to the shadow copy of the data candidates are validated against.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "sqlpilot.shadow")
public class ShadowDatabaseProperties {

    @NotBlank(message = "Shadow database URL must not be blank")
    private String url;

    private String username;

    private String password;

    private String driverClassName;

    /** mysql, postgresql or h2. */
    @NotBlank
    private String dialect = "mysql";

    /** How long a statement waits for a table another request has an index applied on. */
    private Duration lockTimeout = Duration.ofMinutes(2);

    private Pool pool = new Pool();

    @Data
    public static class Pool {
        @Min(1)
        private int maximumPoolSize = 10;
        @Min(0)
        private int minimumIdle = 1;
        private long idleTimeout = 600_000L;
        private long connectionTimeout = 30_000L;
    }
}
