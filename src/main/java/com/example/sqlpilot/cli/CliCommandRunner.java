package com.example.sqlpilot.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import com.example.sqlpilot.config.LLMConfig;
import com.example.sqlpilot.config.ShadowDatabaseProperties;
import com.example.sqlpilot.exception.ApiException;
import com.example.sqlpilot.model.OptimizationRequest;
import com.example.sqlpilot.model.OutcomeStatus;
import com.example.sqlpilot.model.RequestOutcome;
import com.example.sqlpilot.model.VerificationSettings;
import com.example.sqlpilot.service.HealthService;
import com.example.sqlpilot.service.OptimizationService;
import com.example.sqlpilot.util.OutcomeReportFormatter;
import com.example.sqlpilot.util.SqlSafetyGuard;

import lombok.RequiredArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * One-shot command line: {@code optimize}, {@code health} and {@code config}. Without a command
 * the application keeps serving HTTP.
 *
 * <p>Exit codes: 0 when the request finished (accepted or exhausted), 1 on a fatal error, 2 on a
 * usage error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CliCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_USAGE = 2;

    static final Set<String> COMMANDS = Set.of("optimize", "health", "config");

    static final String USAGE = String.join("\n",
            "Usage:",
            "  optimize --sql <text> | --file <path> [--database <mysql|postgresql|h2>] [--verbose]",
            "  health",
            "  config");

    private final OptimizationService optimizationService;
    private final HealthService healthService;
    private final VerificationSettings settings;
    private final ShadowDatabaseProperties shadowProperties;
    private final LLMConfig llmConfig;
    private final SqlSafetyGuard safetyGuard;

    @Setter
    private PrintStream out = System.out;

    @Setter
    private PrintStream err = System.err;

    private int exitCode = EXIT_OK;

    public static boolean isCliInvocation(String[] args) {
        return args.length > 0 && COMMANDS.contains(args[0]);
    }

    @Override
    public void run(ApplicationArguments args) {
        String[] sourceArgs = args.getSourceArgs();
        if (sourceArgs.length == 0 || sourceArgs[0].startsWith("--")) {
            return;
        }
        exitCode = execute(Arrays.asList(sourceArgs));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> args) {
        String command = args.get(0);
        List<String> options = args.subList(1, args.size());
        try {
            switch (command) {
                case "optimize":
                    return optimize(options);
                case "health":
                    return health();
                case "config":
                    return config();
                default:
                    err.println("Unknown command: " + command);
                    err.println(USAGE);
                    return EXIT_USAGE;
            }
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
    }

    private int optimize(List<String> options) {
        String sql = null;
        String file = null;
        String database = null;
        boolean verbose = false;

        for (int i = 0; i < options.size(); i++) {
            String option = options.get(i);
            String name = option.contains("=") ? option.substring(0, option.indexOf('=')) : option;
            switch (name) {
                case "--sql":
                    sql = value(options, i, option);
                    i += option.contains("=") ? 0 : 1;
                    break;
                case "--file":
                    file = value(options, i, option);
                    i += option.contains("=") ? 0 : 1;
                    break;
                case "--database":
                    database = value(options, i, option);
                    i += option.contains("=") ? 0 : 1;
                    break;
                case "--verbose":
                    verbose = true;
                    break;
                default:
                    throw new UsageException("Unknown option: " + option);
            }
        }

        if (sql != null && file != null) {
            throw new UsageException("Use either --sql or --file, not both");
        }
        if (file != null) {
            Path path = Path.of(file);
            if (!Files.isRegularFile(path)) {
                throw new UsageException("File " + file + " not found");
            }
            try {
                sql = Files.readString(path, StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                throw new UsageException("Cannot read " + file + ": " + e.getMessage());
            }
        }
        if (sql == null || sql.isBlank()) {
            throw new UsageException("Please provide SQL via --sql or --file");
        }

        OptimizationRequest request;
        try {
            request = optimizationService.prepare(sql, database);
        } catch (ApiException e) {
            throw new UsageException(e.getMessage());
        }

        RequestOutcome outcome = optimizationService.optimizeBlocking(request);
        out.print(OutcomeReportFormatter.format(outcome, verbose));
        return outcome.getStatus() == OutcomeStatus.FATAL_ERROR ? EXIT_FATAL : EXIT_OK;
    }

    private int health() {
        Map<String, String> components = healthService.checkComponents();
        String status = HealthService.overallStatus(components);
        out.println("status: " + status);
        components.forEach((name, value) -> out.println(name + ": " + value));
        return HealthService.HEALTHY.equals(status) ? EXIT_OK : EXIT_FATAL;
    }

    private int config() {
        out.println("validation:");
        out.println("  max-attempts: " + settings.getMaxAttempts());
        out.println("  min-speedup: " + settings.getMinSpeedup());
        out.println("  timing-repeat-count: " + settings.getTimingRepeatCount());
        out.println("  variance-tolerance: " + settings.getVarianceTolerance());
        out.println("  float-epsilon: " + settings.getFloatEpsilon());
        out.println("  execution-timeout: " + settings.getExecutionTimeout());
        out.println("  proposal-timeout: " + settings.getProposalTimeout());
        out.println("  max-result-rows: " + settings.getMaxResultRows());
        out.println("  retained-row-limit: " + settings.getRetainedRowLimit());
        out.println("  full-scan-row-threshold: " + settings.getFullScanRowThreshold());
        out.println("  forbidden-operations: " + safetyGuard.getForbiddenOperations());
        out.println("shadow:");
        out.println("  url: " + shadowProperties.getUrl());
        out.println("  username: " + shadowProperties.getUsername());
        out.println("  dialect: " + shadowProperties.getDialect());
        out.println("  lock-timeout: " + shadowProperties.getLockTimeout());
        out.println("llm:");
        out.println("  api-url: " + llmConfig.getApiUrl());
        out.println("  api-key: " + llmConfig.maskedApiKey());
        out.println("  model: " + llmConfig.getModel());
        out.println("  temperature: " + llmConfig.getTemperature());
        out.println("  max-tokens: " + llmConfig.getMaxTokens());
        out.println("  max-retries: " + llmConfig.getMaxRetries());
        return EXIT_OK;
    }

    private static String value(List<String> options, int index, String option) {
        if (option.contains("=")) {
            return option.substring(option.indexOf('=') + 1);
        }
        if (index + 1 >= options.size()) {
            throw new UsageException("Missing value for " + option);
        }
        return options.get(index + 1);
    }

    static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
