package com.example.sqlpilot.service;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.example.sqlpilot.exception.ApiException;
import com.example.sqlpilot.exception.UnsafeSqlException;
import com.example.sqlpilot.model.CancellationToken;
import com.example.sqlpilot.model.Dialect;
import com.example.sqlpilot.model.OptimizationRequest;
import com.example.sqlpilot.model.RequestOutcome;
import com.example.sqlpilot.shadow.ShadowDatabase;
import com.example.sqlpilot.util.SqlSafetyGuard;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point shared by the HTTP API and the CLI: validates the submitted query and runs the
 * orchestrator off the request thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizationService {

    private final OptimizationOrchestrator orchestrator;
    private final ShadowDatabase shadowDatabase;
    private final SqlSafetyGuard safetyGuard;

    /**
     * @throws ApiException with {@code BAD_REQUEST} when the query is empty, unsafe or targets a
     *         database the shadow environment cannot stand in for
     */
    public OptimizationRequest prepare(String sql, String database) {
        if (!StringUtils.hasText(sql)) {
            throw new ApiException("SQL query cannot be empty", HttpStatus.BAD_REQUEST);
        }

        Dialect dialect;
        try {
            dialect = StringUtils.hasText(database) ? Dialect.fromName(database) : shadowDatabase.getDialect();
        } catch (IllegalArgumentException e) {
            throw new ApiException(e.getMessage(), HttpStatus.BAD_REQUEST, e);
        }
        if (dialect != shadowDatabase.getDialect()) {
            throw new ApiException("Shadow database is " + shadowDatabase.getDialect() + "; cannot validate "
                    + dialect + " queries", HttpStatus.BAD_REQUEST);
        }

        String trimmed = stripSemicolon(sql.trim());
        try {
            safetyGuard.checkOriginal(trimmed);
        } catch (UnsafeSqlException e) {
            throw new ApiException(e.getMessage(), HttpStatus.BAD_REQUEST, e);
        }
        return OptimizationRequest.builder()
                .originalSql(trimmed)
                .dialect(dialect)
                .build();
    }

    public Mono<RequestOutcome> optimize(OptimizationRequest request) {
        CancellationToken cancellation = new CancellationToken();
        return Mono.fromCallable(() -> orchestrator.optimize(request, cancellation))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(() -> {
                    log.info("Request {} cancelled by caller", request.getId());
                    cancellation.cancel();
                });
    }

    public RequestOutcome optimizeBlocking(OptimizationRequest request) {
        return orchestrator.optimize(request, new CancellationToken());
    }

    private static String stripSemicolon(String sql) {
        String trimmed = sql;
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
