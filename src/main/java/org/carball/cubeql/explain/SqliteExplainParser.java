package org.carball.cubeql.explain;

import org.carball.cubeql.sql.DatabaseEngine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads SQLite's {@code EXPLAIN QUERY PLAN} rows ({@code id, parent, notused, detail}) into a
 * tree. SQLite reports neither costs nor row estimates, so only the access paths are known.
 */
public class SqliteExplainParser {

    private static final Pattern SCAN = Pattern.compile("^SCAN\\s+(?:TABLE\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEARCH = Pattern.compile("^SEARCH\\s+(?:TABLE\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRIMARY_KEY = Pattern.compile("USING\\s+INTEGER\\s+PRIMARY\\s+KEY",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern INDEX = Pattern.compile(
            "USING\\s+(?:AUTOMATIC\\s+)?(?:COVERING\\s+)?INDEX(?:\\s+([^\\s(]+))?", Pattern.CASE_INSENSITIVE);
    private static final Pattern FILTER = Pattern.compile("\\((.+)\\)\\s*$");

    /**
     * A plan row before it is placed in the tree.
     */
    private static final class Node {
        final long id;
        final long parent;
        final String detail;
        final PlanOperation operation;
        final List<Node> children = new ArrayList<>();

        Node(long id, long parent, String detail, PlanOperation operation) {
            this.id = id;
            this.parent = parent;
            this.detail = detail;
            this.operation = operation;
        }

        PlanOperation toOperation() {
            List<PlanOperation> nested = new ArrayList<>();
            children.forEach(child -> nested.add(child.toOperation()));
            return new PlanOperation(operation.type(), operation.table(), operation.index(), null, null, null,
                    operation.filter(), operation.details(), List.copyOf(nested));
        }
    }

    public ExplainResult parse(List<Map<String, Object>> rows, String sql, List<Object> params) {
        Set<String> usedIndexes = new LinkedHashSet<>();
        boolean sequentialScans = false;
        Map<Long, Node> byId = new LinkedHashMap<>();
        List<Node> ordered = new ArrayList<>();

        for (Map<String, Object> row : rows) {
            String detail = value(row, "detail");
            detail = detail == null ? "" : detail.trim();
            PlanOperation operation = operation(detail);
            if ("Seq Scan".equals(operation.type())) {
                sequentialScans = true;
            }
            if (operation.index() != null) {
                usedIndexes.add(operation.index());
            }
            Node node = new Node(number(row, "id"), number(row, "parent"), detail, operation);
            byId.put(node.id, node);
            ordered.add(node);
        }

        List<Node> roots = new ArrayList<>();
        for (Node node : ordered) {
            Node parent = node.parent == node.id ? null : byId.get(node.parent);
            if (parent == null) {
                roots.add(node);
            } else {
                parent.children.add(node);
            }
        }
        List<PlanOperation> operations = new ArrayList<>();
        roots.forEach(root -> operations.add(root.toOperation()));

        ExplainSummary summary = new ExplainSummary(DatabaseEngine.SQLITE, sequentialScans,
                List.copyOf(usedIndexes), null, null, null);
        return new ExplainResult(raw(ordered), operations, summary, sql, params);
    }

    /**
     * Classifies one {@code detail} line. Lines that match no known form keep their text as the type.
     */
    static PlanOperation operation(String detail) {
        String normalized = detail.replaceAll("\\s+", " ");
        String upper = normalized.toUpperCase(Locale.ROOT);
        List<String> details = List.of(detail);

        if (upper.startsWith("SCAN CONSTANT ROW")) {
            return new PlanOperation("Constant Row", null, null, null, null, null, null, details, List.of());
        }
        Matcher scan = SCAN.matcher(normalized);
        if (scan.find()) {
            String table = scan.group(1);
            Matcher index = INDEX.matcher(normalized);
            if (index.find()) {
                return new PlanOperation("Index Scan", table, index.group(1), null, null, null, null, details,
                        List.of());
            }
            return new PlanOperation("Seq Scan", table, null, null, null, null, null, details, List.of());
        }

        Matcher search = SEARCH.matcher(normalized);
        if (search.find()) {
            String table = search.group(1);
            String filter = filter(normalized);
            if (PRIMARY_KEY.matcher(normalized).find()) {
                return new PlanOperation("Primary Key Lookup", table, null, null, null, null, filter, details,
                        List.of());
            }
            Matcher index = INDEX.matcher(normalized);
            if (index.find()) {
                return new PlanOperation("Index Scan", table, index.group(1), null, null, null, filter, details,
                        List.of());
            }
            return new PlanOperation("Search", table, null, null, null, null, filter, details, List.of());
        }

        if (upper.startsWith("USE TEMP B-TREE")) {
            String type = "Temp B-Tree";
            if (upper.contains("FOR ORDER BY") || upper.contains("FOR RIGHT PART OF ORDER BY")) {
                type = "Sort";
            } else if (upper.contains("FOR GROUP BY")) {
                type = "Group";
            } else if (upper.contains("FOR DISTINCT")) {
                type = "Distinct";
            }
            return new PlanOperation(type, null, null, null, null, null, null, details, List.of());
        }
        if (upper.startsWith("COMPOUND QUERY")) {
            return new PlanOperation("Compound Query", null, null, null, null, null, null, details, List.of());
        }
        if (upper.startsWith("CO-ROUTINE")) {
            return new PlanOperation("Coroutine", normalized.substring("CO-ROUTINE".length()).trim(), null,
                    null, null, null, null, details, List.of());
        }
        if (upper.startsWith("MATERIALIZE")) {
            return new PlanOperation("Materialize", normalized.substring("MATERIALIZE".length()).trim(), null,
                    null, null, null, null, details, List.of());
        }
        if (upper.startsWith("SUBQUERY") || upper.startsWith("CORRELATED SCALAR SUBQUERY")
                || upper.startsWith("SCALAR SUBQUERY")) {
            return new PlanOperation("Subquery", null, null, null, null, null, null, details, List.of());
        }
        return new PlanOperation(normalized, null, null, null, null, null, null, details, List.of());
    }

    private static String filter(String detail) {
        Matcher matcher = FILTER.matcher(detail);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String raw(List<Node> rows) {
        if (rows.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        lines.add("id\tparent\tdetail");
        rows.forEach(row -> lines.add(row.id + "\t" + row.parent + "\t" + row.detail));
        return String.join("\n", lines);
    }

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
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("EXPLAIN QUERY PLAN column '" + column + "' is not an integer: "
                    + value, e);
        }
    }
}
