package org.carball.cubeql.explain;

import org.carball.cubeql.sql.DatabaseEngine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Reads MySQL's tabular EXPLAIN output, one row per table access. MySQL gives no costs in this
 * format, so the estimated row count stands in for cost.
 */
public class MySqlExplainParser {

    public ExplainResult parse(List<Map<String, Object>> rows, String sql, List<Object> params) {
        List<PlanOperation> operations = new ArrayList<>();
        Set<String> usedIndexes = new LinkedHashSet<>();
        boolean sequentialScans = false;
        double totalCost = 0;

        for (Map<String, Object> row : rows) {
            String accessType = value(row, "type");
            String key = value(row, "key");
            String extra = value(row, "Extra");
            long estimatedRows = number(row, "rows");

            if ("ALL".equalsIgnoreCase(accessType)) {
                sequentialScans = true;
            }
            if (key != null) {
                usedIndexes.add(key);
            }
            totalCost += estimatedRows;

            List<String> details = extraDetails(extra);
            String filter = extra != null && extra.toLowerCase(Locale.ROOT).contains("using where") ? extra : null;
            operations.add(new PlanOperation(operationType(accessType, extra), value(row, "table"), key,
                    estimatedRows, (double) estimatedRows, null, filter, details, List.of()));
        }

        ExplainSummary summary = new ExplainSummary(DatabaseEngine.MYSQL, sequentialScans,
                List.copyOf(usedIndexes), null, null, rows.isEmpty() ? null : totalCost);
        return new ExplainResult(raw(rows), operations, summary, sql, params);
    }

    static String operationType(String accessType, String extra) {
        if (accessType == null) {
            return "Unknown";
        }
        switch (accessType.toLowerCase(Locale.ROOT)) {
            case "all":
                return "Seq Scan";
            case "index":
                return extra != null && extra.toLowerCase(Locale.ROOT).contains("using index")
                        ? "Index Only Scan" : "Index Scan";
            case "range":
                return "Index Range Scan";
            case "ref":
            case "eq_ref":
                return "Index Lookup";
            case "const":
            case "system":
                return "Const Lookup";
            case "null":
                return "No Table";
            default:
                return "MySQL " + accessType;
        }
    }

    private static List<String> extraDetails(String extra) {
        List<String> details = new ArrayList<>();
        if (extra == null) {
            return details;
        }
        String lower = extra.toLowerCase(Locale.ROOT);
        if (lower.contains("using where")) {
            details.add("WHERE filter applied");
        }
        if (lower.contains("using filesort")) {
            details.add("Filesort required");
        }
        if (lower.contains("using temporary")) {
            details.add("Temporary table required");
        }
        if (lower.contains("using join buffer")) {
            details.add("Join buffer used");
        }
        return details;
    }

    /**
     * The rows as a tab-separated table with a header line.
     */
    private static String raw(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        lines.add(String.join("\t", rows.get(0).keySet()));
        for (Map<String, Object> row : rows) {
            StringJoiner line = new StringJoiner("\t");
            row.values().forEach(v -> line.add(v == null ? "NULL" : v.toString()));
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    /**
     * Column lookup ignoring case; drivers disagree on {@code Extra} versus {@code extra}.
     */
    private static String value(Map<String, Object> row, String column) {
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(column)) {
                return entry.getValue() == null ? null : entry.getValue().toString();
            }
        }
        return null;
    }

    private static long number(Map<String, Object> row, String column) {
        String value = value(row, column);
        if (value == null || value.isBlank()) {
            return 0L;
        }
        try {
            return Math.round(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("EXPLAIN column '" + column + "' is not numeric: " + value, e);
        }
    }
}
