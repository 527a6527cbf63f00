package com.example.sqlpilot.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.sqlpilot.model.VerificationSettings;
import com.example.sqlpilot.util.SqlSafetyGuard;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableConfigurationProperties({ValidationProperties.class, ShadowDatabaseProperties.class})
public class OptimizerConfig {

    @Bean
    public VerificationSettings verificationSettings(ValidationProperties properties) {
        VerificationSettings settings = properties.toSettings();
        log.info("Verification settings: maxAttempts={}, minSpeedup={}, timingRepeatCount={}, executionTimeout={}",
                settings.getMaxAttempts(), settings.getMinSpeedup(), settings.getTimingRepeatCount(),
                settings.getExecutionTimeout());
        return settings;
    }

    @Bean
    public SqlSafetyGuard sqlSafetyGuard(ValidationProperties properties) {
        return new SqlSafetyGuard(properties.getForbiddenOperations());
    }
}
