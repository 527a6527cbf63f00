package com.example.sqlpilot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import lombok.RequiredArgsConstructor;

@Configuration
@RequiredArgsConstructor
public class DatabaseConfig {

    private final ShadowDatabaseProperties properties;

    @Bean(destroyMethod = "close")
    @Primary
    public HikariDataSource shadowDataSource() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("sqlpilot-shadow");
        config.setJdbcUrl(properties.getUrl());
        config.setUsername(properties.getUsername());
        config.setPassword(properties.getPassword());
        if (properties.getDriverClassName() != null && !properties.getDriverClassName().isBlank()) {
            config.setDriverClassName(properties.getDriverClassName());
        }

        ShadowDatabaseProperties.Pool pool = properties.getPool();
        config.setMaximumPoolSize(pool.getMaximumPoolSize());
        config.setMinimumIdle(pool.getMinimumIdle());
        config.setIdleTimeout(pool.getIdleTimeout());
        config.setConnectionTimeout(pool.getConnectionTimeout());
        // connections are opened lazily so the CLI can report an unreachable database itself
        config.setInitializationFailTimeout(-1);

        return new HikariDataSource(config);
    }
}
