package com.example.sqlpilot.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.sqlpilot.model.Dialect;
import com.example.sqlpilot.model.ExecutionPlan;
import com.example.sqlpilot.model.PlanOperation;
import com.example.sqlpilot.model.PlanOperation.AccessType;

/**
 * Turns the raw rows of an {@code EXPLAIN} into an {@link ExecutionPlan}. MySQL returns one row
 * per table access, PostgreSQL and H2 return plan text.
 */
public class ExplainPlanParser {
    private static final Logger logger = LoggerFactory.getLogger(ExplainPlanParser.class);

    private static final Pattern PG_COST = Pattern.compile("cost=(\\d+(?:\\.\\d+)?)\\.\\.(\\d+(?:\\.\\d+)?)");
    private static final Pattern PG_ROWS = Pattern.compile("rows=(\\d+)");
    private static final Pattern PG_SEQ_SCAN = Pattern.compile("(?:Parallel )?Seq Scan on (\\S+)");
    private static final Pattern PG_INDEX_SCAN =
            Pattern.compile("(Index Only Scan|Index Scan)(?: Backward)? using (\\S+) on (\\S+)");
    private static final Pattern PG_BITMAP_HEAP = Pattern.compile("Bitmap Heap Scan on (\\S+)");

    private static final Pattern H2_SOURCE =
            Pattern.compile("(?:FROM|JOIN)\\s+(?:\"?\\w+\"?\\.)?\"?(\\w+)\"?", Pattern.CASE_INSENSITIVE);
    private static final Pattern H2_TABLE_SCAN = Pattern.compile("/\\*\\s*(?:\\w+\\.)?(\\w+)\\.tableScan\\s*\\*/");
    private static final Pattern H2_INDEX = Pattern.compile("/\\*\\s*(?:\\w+\\.)?\"?(\\w+)\"?\\s*:");

    public static ExecutionPlan parse(Dialect dialect, List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return ExecutionPlan.unavailable();
        }
        try {
            switch (dialect) {
                case MYSQL:
                    return parseMySql(rows);
                case POSTGRESQL:
                    return parsePostgres(planText(rows));
                case H2:
                default:
                    return parseH2(planText(rows));
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to parse {} plan: {}", dialect, e.getMessage());
            return ExecutionPlan.builder().planText(planText(rows)).build();
        }
    }

    static ExecutionPlan parseMySql(List<Map<String, Object>> rows) {
        ExecutionPlan.ExecutionPlanBuilder plan = ExecutionPlan.builder();
        StringBuilder text = new StringBuilder();
        for (Map<String, Object> row : rows) {
            String table = stringValue(row, "table");
            String type = stringValue(row, "type");
            String key = stringValue(row, "key");
            String extra = stringValue(row, "Extra");
            Long estimatedRows = longValue(row, "rows");
            text.append(String.format("table=%s type=%s key=%s rows=%s extra=%s%n",
                    table, type, key, estimatedRows, extra));
            plan.operation(PlanOperation.builder()
                    .table(table)
                    .accessType(mySqlAccessType(type))
                    .index(key)
                    .estimatedRows(estimatedRows)
                    .extra(extra)
                    .build());
        }
        return plan.planText(text.toString().trim()).build();
    }

    static ExecutionPlan parsePostgres(String plan) {
        ExecutionPlan.ExecutionPlanBuilder builder = ExecutionPlan.builder().planText(plan);
        Matcher cost = PG_COST.matcher(plan);
        if (cost.find()) {
            builder.totalCost(Double.parseDouble(cost.group(2)));
        }
        for (String line : plan.split("\n")) {
            Long rows = null;
            Matcher rowsMatcher = PG_ROWS.matcher(line);
            if (rowsMatcher.find()) {
                rows = Long.parseLong(rowsMatcher.group(1));
            }
            Matcher seqScan = PG_SEQ_SCAN.matcher(line);
            Matcher indexScan = PG_INDEX_SCAN.matcher(line);
            Matcher bitmap = PG_BITMAP_HEAP.matcher(line);
            if (seqScan.find()) {
                builder.operation(PlanOperation.builder()
                        .table(seqScan.group(1))
                        .accessType(AccessType.FULL_SCAN)
                        .estimatedRows(rows)
                        .build());
            } else if (indexScan.find()) {
                builder.operation(PlanOperation.builder()
                        .table(indexScan.group(3))
                        .accessType(AccessType.INDEX_LOOKUP)
                        .index(indexScan.group(2))
                        .estimatedRows(rows)
                        .extra(indexScan.group(1))
                        .build());
            } else if (bitmap.find()) {
                builder.operation(PlanOperation.builder()
                        .table(bitmap.group(1))
                        .accessType(AccessType.INDEX_LOOKUP)
                        .estimatedRows(rows)
                        .extra("Bitmap Heap Scan")
                        .build());
            }
        }
        return builder.build();
    }

    static ExecutionPlan parseH2(String plan) {
        ExecutionPlan.ExecutionPlanBuilder builder = ExecutionPlan.builder().planText(plan);
        String currentTable = null;
        for (String line : plan.split("\n")) {
            Matcher source = H2_SOURCE.matcher(line);
            if (source.find()) {
                currentTable = source.group(1);
            }
            Matcher tableScan = H2_TABLE_SCAN.matcher(line);
            if (tableScan.find()) {
                builder.operation(PlanOperation.builder()
                        .table(tableScan.group(1))
                        .accessType(AccessType.FULL_SCAN)
                        .build());
                continue;
            }
            Matcher index = H2_INDEX.matcher(line);
            if (index.find() && currentTable != null) {
                builder.operation(PlanOperation.builder()
                        .table(currentTable)
                        .accessType(AccessType.INDEX_LOOKUP)
                        .index(index.group(1))
                        .build());
            }
        }
        return builder.build();
    }

    private static AccessType mySqlAccessType(String type) {
        if (type == null) {
            return AccessType.OTHER;
        }
        switch (type.toLowerCase(Locale.ROOT)) {
            case "all":
                return AccessType.FULL_SCAN;
            case "index":
                return AccessType.INDEX_SCAN;
            case "range":
            case "ref":
            case "eq_ref":
            case "const":
            case "system":
            case "ref_or_null":
            case "index_merge":
                return AccessType.INDEX_LOOKUP;
            default:
                return AccessType.OTHER;
        }
    }

    private static String planText(List<Map<String, Object>> rows) {
        StringBuilder text = new StringBuilder();
        for (Map<String, Object> row : rows) {
            for (Object value : row.values()) {
                if (value != null) {
                    text.append(value).append("\n");
                }
            }
        }
        return text.toString().trim();
    }

    private static String stringValue(Map<String, Object> row, String column) {
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(column)) {
                return entry.getValue() != null ? entry.getValue().toString() : null;
            }
        }
        return null;
    }

    private static Long longValue(Map<String, Object> row, String column) {
        String value = stringValue(row, column);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Non-numeric {} value in plan row: {}", column, value);
            return null;
        }
    }
}
