package org.carball.cubeql.explain;

import org.carball.cubeql.sql.DatabaseEngine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads PostgreSQL's text EXPLAIN format. Plan nodes are nested by the indentation of their
 * {@code ->} arrows; property lines such as {@code Filter:} attach to the node above them.
 */
public class PostgresExplainParser {

    private static final Pattern COST = Pattern.compile(
            "\\(cost=([\\d.]+)\\.\\.([\\d.]+) rows=(\\d+) width=\\d+\\)");
    private static final Pattern ACTUAL = Pattern.compile(
            "\\(actual time=[\\d.]+\\.\\.[\\d.]+ rows=(\\d+) loops=\\d+\\)");
    private static final Pattern USING = Pattern.compile("^(.*?) using (\\S+) on (\\S+).*$");
    private static final Pattern ON = Pattern.compile("^(.*?) on (\\S+).*$");
    private static final Pattern PLANNING_TIME = Pattern.compile("^\\s*planning time:\\s*([\\d.]+)\\s*ms",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern EXECUTION_TIME = Pattern.compile("^\\s*execution time:\\s*([\\d.]+)\\s*ms",
            Pattern.CASE_INSENSITIVE);

    /**
     * Mutable while the tree is being assembled.
     */
    private static final class Node {
        final int indent;
        String type;
        String table;
        String index;
        Long estimatedRows;
        Double estimatedCost;
        Long actualRows;
        String filter;
        final List<String> details = new ArrayList<>();
        final List<Node> children = new ArrayList<>();

        Node(int indent) {
            this.indent = indent;
        }

        PlanOperation toOperation() {
            return new PlanOperation(type, table, index, estimatedRows, estimatedCost, actualRows, filter,
                    List.copyOf(details), children.stream().map(Node::toOperation).toList());
        }
    }

    public ExplainResult parse(List<String> lines, String sql, List<Object> params) {
        List<Node> roots = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        Set<String> usedIndexes = new LinkedHashSet<>();
        boolean sequentialScans = false;
        Double planningTime = null;
        Double executionTime = null;
        Double totalCost = null;

        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            Matcher planning = PLANNING_TIME.matcher(line);
            if (planning.find()) {
                planningTime = Double.parseDouble(planning.group(1));
                continue;
            }
            Matcher execution = EXECUTION_TIME.matcher(line);
            if (execution.find()) {
                executionTime = Double.parseDouble(execution.group(1));
                continue;
            }

            String trimmed = line.trim();
            boolean arrow = trimmed.startsWith("->");
            Matcher cost = COST.matcher(line);
            boolean hasCost = cost.find();
            if (!arrow && !hasCost) {
                if (!stack.isEmpty()) {
                    attachProperty(stack.peek(), trimmed);
                }
                continue;
            }

            int indent = arrow ? line.indexOf("->") : leadingSpaces(line);
            Node node = new Node(indent);
            String label = arrow ? trimmed.substring(2).trim() : trimmed;
            int costStart = label.indexOf("  (");
            if (costStart < 0) {
                costStart = label.indexOf(" (");
            }
            describe(node, costStart >= 0 ? label.substring(0, costStart).trim() : label);
            if (hasCost) {
                node.estimatedCost = Double.parseDouble(cost.group(2));
                node.estimatedRows = Long.parseLong(cost.group(3));
            }
            Matcher actual = ACTUAL.matcher(line);
            if (actual.find()) {
                node.actualRows = Long.parseLong(actual.group(1));
            }

            while (!stack.isEmpty() && stack.peek().indent >= indent) {
                stack.pop();
            }
            if (stack.isEmpty()) {
                roots.add(node);
                if (totalCost == null) {
                    totalCost = node.estimatedCost;
                }
            } else {
                stack.peek().children.add(node);
            }
            stack.push(node);

            if (node.type.contains("Seq Scan")) {
                sequentialScans = true;
            }
            if (node.index != null) {
                usedIndexes.add(node.index);
            }
        }

        ExplainSummary summary = new ExplainSummary(DatabaseEngine.POSTGRES, sequentialScans,
                List.copyOf(usedIndexes), planningTime, executionTime, totalCost);
        return new ExplainResult(String.join("\n", lines),
                roots.stream().map(Node::toOperation).toList(), summary, sql, params);
    }

    private static void describe(Node node, String label) {
        Matcher using = USING.matcher(label);
        if (using.matches()) {
            node.type = using.group(1);
            node.index = using.group(2);
            node.table = using.group(3);
            return;
        }
        Matcher on = ON.matcher(label);
        if (on.matches()) {
            node.type = on.group(1);
            if (node.type.endsWith("Bitmap Index Scan")) {
                node.index = on.group(2);
            } else {
                node.table = on.group(2);
            }
            return;
        }
        node.type = label;
    }

    private static void attachProperty(Node node, String property) {
        String lower = property.toLowerCase(Locale.ROOT);
        if (lower.startsWith("filter:") || lower.startsWith("join filter:")) {
            node.filter = property.substring(property.indexOf(':') + 1).trim();
        } else {
            node.details.add(property);
        }
    }

    private static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') {
            count++;
        }
        return count;
    }
}
