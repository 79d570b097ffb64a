package org.carball.cubeql.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.model.analysis.JoinPathAnalysis;
import org.carball.cubeql.model.analysis.JoinPathStep;
import org.carball.cubeql.model.analysis.PreAggregationAnalysis;
import org.carball.cubeql.model.analysis.PrimaryCubeCandidate;
import org.carball.cubeql.model.analysis.QueryAnalysis;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.model.result.FlowMetadata;
import org.carball.cubeql.model.result.FunnelMetadata;
import org.carball.cubeql.model.result.RetentionMetadata;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders a compiled query for people: the SQL and its parameters, the planning analysis of a
 * standard query, the metadata of funnel, flow and retention queries, and any warnings.
 */
@Slf4j
public class CompilationReport {

    private final CompiledQuery compiled;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public CompilationReport(CompiledQuery compiled) {
        this.compiled = compiled;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(compiled);
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    /**
     * SQL followed by numbered parameters, for piping into a database client.
     */
    public String toText() {
        StringBuilder text = new StringBuilder(compiled.getSql()).append("\n");
        if (!compiled.getParams().isEmpty()) {
            text.append("\n-- Parameters\n");
            for (int i = 0; i < compiled.getParams().size(); i++) {
                text.append("-- ").append(i + 1).append(": ").append(compiled.getParams().get(i)).append("\n");
            }
        }
        for (String warning : compiled.getWarnings()) {
            text.append("-- Warning: ").append(warning).append("\n");
        }
        return text.toString();
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Query Compilation Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Mode:** ").append(compiled.getMode() == null ? "query" : compiled.getMode().value()).append("  \n");
        md.append("**Schema Version:** ").append(compiled.getSchemaVersion()).append("  \n\n");

        md.append("## SQL\n\n");
        md.append("```sql\n").append(compiled.getSql()).append("\n```\n\n");

        if (!compiled.getParams().isEmpty()) {
            md.append("### Parameters\n\n");
            md.append("| # | Value | Type |\n");
            md.append("|---|-------|------|\n");
            for (int i = 0; i < compiled.getParams().size(); i++) {
                Object param = compiled.getParams().get(i);
                md.append("| ").append(i + 1).append(" | `").append(param).append("` | ")
                        .append(param == null ? "null" : param.getClass().getSimpleName()).append(" |\n");
            }
            md.append("\n");
        }

        if (compiled.getAnalysis() != null) {
            appendAnalysis(md, compiled.getAnalysis());
        }
        if (compiled.getFunnelMetadata() != null) {
            appendFunnel(md, compiled.getFunnelMetadata());
        }
        if (compiled.getFlowMetadata() != null) {
            appendFlow(md, compiled.getFlowMetadata());
        }
        if (compiled.getRetentionMetadata() != null) {
            appendRetention(md, compiled.getRetentionMetadata());
        }

        if (!compiled.getWarnings().isEmpty()) {
            md.append("## Warnings\n\n");
            compiled.getWarnings().forEach(w -> md.append("- ⚠️ ").append(w).append("\n"));
            md.append("\n");
        }
        return md.toString();
    }

    private static void appendAnalysis(StringBuilder md, QueryAnalysis analysis) {
        md.append("## Query Plan\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Query Type | ").append(analysis.querySummary().queryType().value()).append(" |\n");
        md.append("| Cubes Involved | ").append(String.join(", ", analysis.cubesInvolved())).append(" |\n");
        md.append("| Joins | ").append(analysis.querySummary().joinCount()).append(" |\n");
        md.append("| CTEs | ").append(analysis.querySummary().cteCount()).append(" |\n\n");

        if (analysis.primaryCube() != null) {
            md.append("### Primary Cube: ").append(analysis.primaryCube().selectedCube()).append("\n\n");
            md.append("- **Reason:** ").append(analysis.primaryCube().reason().value()).append("\n");
            md.append("- **Explanation:** ").append(analysis.primaryCube().explanation()).append("\n\n");
            List<PrimaryCubeCandidate> candidates = analysis.primaryCube().candidates();
            if (candidates != null && candidates.size() > 1) {
                md.append("| Candidate | Dimensions | Joins | Reaches All |\n");
                md.append("|-----------|------------|-------|-------------|\n");
                for (PrimaryCubeCandidate candidate : candidates) {
                    md.append("| ").append(candidate.cubeName())
                            .append(" | ").append(candidate.dimensionCount())
                            .append(" | ").append(candidate.joinCount())
                            .append(" | ").append(candidate.canReachAll() ? "✓" : "✗").append(" |\n");
                }
                md.append("\n");
            }
        }

        if (!analysis.joinPaths().isEmpty()) {
            md.append("### Join Paths\n\n");
            for (JoinPathAnalysis path : analysis.joinPaths()) {
                if (!path.pathFound()) {
                    md.append("- ❌ **").append(path.targetCube()).append("**: ").append(path.error()).append("\n");
                    continue;
                }
                md.append("- **").append(path.targetCube()).append("** (").append(path.pathLength()).append(" hops)\n");
                for (JoinPathStep step : path.path()) {
                    md.append("  - ").append(step.fromCube()).append(" → ").append(step.toCube())
                            .append(" `").append(step.joinType()).append("` (").append(step.relationship()).append(")");
                    if (step.junctionTable() != null) {
                        md.append(" via `").append(step.junctionTable()).append("`");
                    }
                    md.append("\n");
                }
            }
            md.append("\n");
        }

        if (!analysis.preAggregations().isEmpty()) {
            md.append("### Pre-Aggregations\n\n");
            for (PreAggregationAnalysis preAggregation : analysis.preAggregations()) {
                md.append("- **").append(preAggregation.cubeName()).append("** as `")
                        .append(preAggregation.cteAlias()).append("`: ").append(preAggregation.reason()).append("\n");
                md.append("  - Measures: ").append(String.join(", ", preAggregation.measures())).append("\n");
                md.append("  - Join keys: ").append(String.join(", ", preAggregation.joinKeys())).append("\n");
            }
            md.append("\n");
        }
    }

    private static void appendFunnel(StringBuilder md, FunnelMetadata funnel) {
        md.append("## Funnel\n\n");
        md.append("- **Binding Key:** ").append(funnel.bindingKey()).append("\n");
        md.append("- **Time Dimension:** ").append(funnel.timeDimension()).append("\n\n");
        md.append("| Step | Name | Cube | Time to Convert |\n");
        md.append("|------|------|------|-----------------|\n");
        for (FunnelMetadata.FunnelStepMetadata step : funnel.steps()) {
            md.append("| ").append(step.index()).append(" | ").append(step.name())
                    .append(" | ").append(step.cube())
                    .append(" | ").append(step.timeToConvert() == null ? "-" : step.timeToConvert()).append(" |\n");
        }
        md.append("\n");
    }

    private static void appendFlow(StringBuilder md, FlowMetadata flow) {
        md.append("## Flow\n\n");
        md.append("- **Starting Step:** ").append(flow.startingStep()).append("\n");
        md.append("- **Event Dimension:** ").append(flow.eventDimension()).append("\n");
        md.append("- **Steps:** ").append(flow.stepsBefore()).append(" before, ")
                .append(flow.stepsAfter()).append(" after\n");
        md.append("- **Output:** ").append(flow.outputMode().value()).append("\n");
        md.append("- **Strategy:** ").append(flow.joinStrategy().value()).append("\n");
        md.append("- **Layers:** ").append(String.join(" → ", flow.layers())).append("\n\n");
    }

    private static void appendRetention(StringBuilder md, RetentionMetadata retention) {
        md.append("## Retention\n\n");
        md.append("- **Cube:** ").append(retention.cube()).append("\n");
        md.append("- **Binding Key:** ").append(retention.bindingKey()).append("\n");
        md.append("- **Granularity:** ").append(retention.granularity().value()).append("\n");
        md.append("- **Periods:** ").append(retention.periods()).append("\n");
        md.append("- **Type:** ").append(retention.retentionType().value()).append("\n");
        md.append("- **Range:** ").append(retention.rangeStart()).append(" to ").append(retention.rangeEnd()).append("\n");
        if (!retention.breakdownDimensions().isEmpty()) {
            md.append("- **Breakdown:** ").append(String.join(", ", retention.breakdownDimensions())).append("\n");
        }
        md.append("\n");
    }
}
