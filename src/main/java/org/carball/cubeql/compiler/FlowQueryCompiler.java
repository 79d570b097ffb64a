package org.carball.cubeql.compiler;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.exception.IncompleteSpecException;
import org.carball.cubeql.model.query.Filter;
import org.carball.cubeql.model.query.FlowJoinStrategy;
import org.carball.cubeql.model.query.FlowOutputMode;
import org.carball.cubeql.model.query.FlowSpec;
import org.carball.cubeql.model.query.MemberMapping;
import org.carball.cubeql.model.query.QueryMode;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.model.result.FlowMetadata;
import org.carball.cubeql.model.schema.Dimension;
import org.carball.cubeql.model.schema.DimensionType;
import org.carball.cubeql.model.schema.MemberRef;
import org.carball.cubeql.model.schema.SchemaSnapshot;
import org.carball.cubeql.sql.RenderedSql;
import org.carball.cubeql.sql.SqlDialect;
import org.carball.cubeql.sql.SqlFragment;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compiles a flow: the entities matching a starting step, then the events immediately before and
 * after it, one layer at a time, aggregated into Sankey (or sunburst) nodes and links.
 */
@Slf4j
public class FlowQueryCompiler {

    static final int MAX_DEPTH = 5;
    static final String PATH_SEPARATOR = "→";

    private record ResolvedFlow(FlowSpec spec, String cube, String bindingKey, String timeDimension,
                                String eventDimension, String startingStepName, int stepsBefore, int stepsAfter,
                                boolean sunburst, boolean lateral) {}

    private final CompilationContext context;
    private final SchemaSnapshot snapshot;
    private final SqlDialect dialect;
    private final CubeSource source;

    public FlowQueryCompiler(CompilationContext context) {
        this.context = context;
        this.snapshot = context.getSnapshot();
        this.dialect = context.getDialect();
        this.source = new CubeSource(context);
    }

    /**
     * @throws IncompleteSpecException listing everything missing from the flow
     */
    public CompiledQuery compile(FlowSpec flow) {
        List<String> warnings = new ArrayList<>();
        ResolvedFlow resolved = resolve(flow, warnings);

        List<SqlFragment> ctes = new ArrayList<>();
        List<String> layers = new ArrayList<>();
        ctes.add(startingEntities(resolved));
        for (int depth = 1; depth <= resolved.stepsBefore(); depth++) {
            ctes.add(step(resolved, "before_step_" + depth, previousAlias("before", depth), depth == 1, false));
        }
        for (int depth = 1; depth <= resolved.stepsAfter(); depth++) {
            ctes.add(step(resolved, "after_step_" + depth, previousAlias("after", depth), depth == 1, true));
        }
        for (int depth = resolved.stepsBefore(); depth >= 1; depth--) {
            layers.add("before_step_" + depth);
        }
        layers.add("starting_entities");
        for (int depth = 1; depth <= resolved.stepsAfter(); depth++) {
            layers.add("after_step_" + depth);
        }
        ctes.add(nodes(resolved));
        ctes.add(links(resolved));
        ctes.add(finalResult());

        SqlFragment sql = SqlFragment.builder()
                .sql("WITH ")
                .append(SqlFragment.join(",\n", ctes))
                .sql("\nSELECT * FROM final_result")
                .build();
        RenderedSql rendered = sql.render(dialect);
        log.debug("Compiled flow on {} with {} step(s) before and {} after ({} join)", resolved.cube(),
                resolved.stepsBefore(), resolved.stepsAfter(), resolved.lateral() ? "lateral" : "window");

        return CompiledQuery.builder()
                .sql(rendered.sql())
                .params(rendered.params())
                .mode(QueryMode.FLOW)
                .schemaVersion(snapshot.getVersion())
                .flowMetadata(new FlowMetadata(
                        resolved.startingStepName(),
                        resolved.bindingKey(),
                        resolved.timeDimension(),
                        resolved.eventDimension(),
                        resolved.stepsBefore(),
                        resolved.stepsAfter(),
                        resolved.sunburst() ? FlowOutputMode.SUNBURST : FlowOutputMode.SANKEY,
                        resolved.lateral() ? FlowJoinStrategy.LATERAL : FlowJoinStrategy.WINDOW,
                        List.copyOf(layers)))
                .warnings(warnings)
                .build();
    }

    private ResolvedFlow resolve(FlowSpec flow, List<String> warnings) {
        List<String> problems = new ArrayList<>();
        String eventDimension = flow.getEventDimension();
        String cube = null;
        if (eventDimension == null || eventDimension.isBlank()) {
            problems.add("Event dimension is required for flow analysis");
        } else if (!snapshot.isDimension(eventDimension)) {
            problems.add("Event dimension '" + eventDimension + "' is not a dimension");
        } else {
            cube = MemberRef.parse(eventDimension).cubeName();
        }

        String bindingKey = member(flow.getBindingKey(), cube, "binding key", false, problems);
        String timeDimension = member(flow.getTimeDimension(), cube, "time dimension", true, problems);

        List<Filter> startingFilters = List.of();
        if (flow.getStartingStep() == null) {
            problems.add("Starting step is required for flow analysis");
        } else {
            startingFilters = flow.getStartingStep().getFilters() == null
                    ? List.of() : flow.getStartingStep().getFilters();
            if (startingFilters.isEmpty()) {
                problems.add("Starting step must have at least one filter");
            }
        }

        if (flow.getStepsBefore() < 0 || flow.getStepsBefore() > MAX_DEPTH) {
            problems.add("stepsBefore must be between 0 and " + MAX_DEPTH + ", got: " + flow.getStepsBefore());
        }
        if (flow.getStepsAfter() < 0 || flow.getStepsAfter() > MAX_DEPTH) {
            problems.add("stepsAfter must be between 0 and " + MAX_DEPTH + ", got: " + flow.getStepsAfter());
        }
        if (flow.getEntityLimit() != null && flow.getEntityLimit() <= 0) {
            problems.add("entityLimit must be positive, got: " + flow.getEntityLimit());
        }
        FlowJoinStrategy strategy = flow.getJoinStrategy() == null ? FlowJoinStrategy.AUTO : flow.getJoinStrategy();
        if (strategy == FlowJoinStrategy.LATERAL && !dialect.supportsLateralJoins()) {
            problems.add("Lateral joins are not supported on " + dialect.engine().value());
        }
        if (!problems.isEmpty()) {
            throw new IncompleteSpecException(problems);
        }
        startingFilters.forEach(filter -> filter.forEachCondition(condition -> context.getFilters().validate(condition)));

        boolean sunburst = flow.getOutputMode() == FlowOutputMode.SUNBURST;
        int stepsBefore = flow.getStepsBefore();
        if (sunburst && stepsBefore > 0) {
            warnings.add("Sunburst output only walks forward; stepsBefore (" + stepsBefore + ") is ignored");
            stepsBefore = 0;
        }
        int depthWarning = context.getConfig().getFlowDepthWarning();
        if (stepsBefore >= depthWarning || flow.getStepsAfter() >= depthWarning) {
            log.warn("Flow depth {}/{} may be slow on large datasets", stepsBefore, flow.getStepsAfter());
            warnings.add("High step depth (" + depthWarning + "-" + MAX_DEPTH
                    + ") may impact query performance on large datasets");
        }

        String name = flow.getStartingStep().getName();
        if (name == null || name.isBlank()) {
            warnings.add("Starting step has no name - using default");
            name = "Start";
        }
        boolean lateral = strategy == FlowJoinStrategy.LATERAL
                || (strategy == FlowJoinStrategy.AUTO && dialect.supportsLateralJoins());
        return new ResolvedFlow(flow, cube, bindingKey, timeDimension, eventDimension, name,
                stepsBefore, flow.getStepsAfter(), sunburst, lateral);
    }

    private String member(MemberMapping mapping, String cube, String role, boolean time, List<String> problems) {
        if (mapping == null) {
            problems.add("Flow requires a " + role);
            return null;
        }
        if (cube == null) {
            return null;
        }
        Optional<String> member = mapping.forCube(cube);
        if (member.isEmpty()) {
            problems.add("No " + role + " mapped for event cube '" + cube + "'");
            return null;
        }
        Optional<Dimension> dimension = snapshot.findDimension(member.get());
        if (dimension.isEmpty()) {
            problems.add("Flow " + role + " '" + member.get() + "' is not a dimension");
        } else if (time && dimension.get().getType() != DimensionType.TIME) {
            problems.add("Flow time dimension '" + member.get() + "' must be of type time");
        }
        return member.get();
    }

    private SqlFragment startingEntities(ResolvedFlow flow) {
        SqlFragment bindingKey = dimension(flow.bindingKey());
        SqlFragment time = dimension(flow.timeDimension());
        SqlFragment event = dimension(flow.eventDimension());
        List<Filter> filters = flow.spec().getStartingStep().getFilters();

        SqlFragment.Builder cte = SqlFragment.builder()
                .sql("starting_entities AS (\n  SELECT ")
                .append(bindingKey).sql(" AS binding_key, MIN(").append(time).sql(") AS start_time, ")
                .append(event).sql(" AS event_type, ")
                .append(dialect.castToText(event)).sql(" AS event_path")
                .sql("\n  " + source.from(flow.cube(), CubeSource.members(filters), "  "));
        SqlFragment where = context.getFilters().build(filters, this::dimension);
        if (!where.isEmpty()) {
            cte.sql("\n  WHERE ").append(where);
        }
        cte.sql("\n  GROUP BY ").append(bindingKey).sql(", ").append(event);
        if (flow.spec().getEntityLimit() != null) {
            // Earliest starters first, so the sampled entities are the same on every run
            cte.sql("\n  ORDER BY start_time, binding_key\n  LIMIT ").param(flow.spec().getEntityLimit());
        }
        return cte.sql("\n)").build();
    }

    /**
     * One layer before or after the previous one: the nearest event on the far side of the
     * previous layer's time, per binding key.
     */
    private SqlFragment step(ResolvedFlow flow, String alias, String previous, boolean fromStart, boolean forward) {
        SqlFragment bindingKey = dimension(flow.bindingKey());
        SqlFragment time = dimension(flow.timeDimension());
        SqlFragment event = dimension(flow.eventDimension());
        SqlFragment previousTime = SqlFragment.raw(previous + "." + (fromStart ? "start_time" : "step_time"));
        SqlFragment previousPath = SqlFragment.raw(previous + ".event_path");
        String from = source.from(flow.cube(), List.of(), "    ");

        SqlFragment path;
        if (!flow.sunburst()) {
            path = dialect.castToText(event);
        } else if (forward) {
            path = dialect.concat(List.of(previousPath, SqlFragment.raw("'" + PATH_SEPARATOR + "'"), dialect.castToText(event)));
        } else {
            path = dialect.concat(List.of(dialect.castToText(event), SqlFragment.raw("'" + PATH_SEPARATOR + "'"), previousPath));
        }
        SqlFragment timeBound = time.append(forward ? " > " : " < ").append(previousTime);
        String direction = forward ? "ASC" : "DESC";

        SqlFragment.Builder cte = SqlFragment.builder().sql(alias + " AS (\n");
        if (flow.lateral()) {
            cte.sql("  SELECT e.binding_key, e.step_time, e.event_type, e.event_path\n  FROM " + previous
                            + "\n  CROSS JOIN LATERAL (\n    SELECT ")
                    .append(bindingKey).sql(" AS binding_key, ").append(time).sql(" AS step_time, ")
                    .append(event).sql(" AS event_type, ").append(path).sql(" AS event_path")
                    .sql("\n    " + from)
                    .sql("\n    WHERE ").append(bindingKey).sql(" = " + previous + ".binding_key AND ").append(timeBound)
                    .sql("\n    ORDER BY ").append(time).sql(" " + direction)
                    .sql("\n    LIMIT 1\n  ) e");
        } else {
            cte.sql("  SELECT binding_key, step_time, event_type, event_path\n  FROM (\n    SELECT ")
                    .append(bindingKey).sql(" AS binding_key, ").append(time).sql(" AS step_time, ")
                    .append(event).sql(" AS event_type, ").append(path).sql(" AS event_path, ")
                    .sql("ROW_NUMBER() OVER (PARTITION BY ").append(bindingKey)
                    .sql(" ORDER BY ").append(time).sql(" " + direction + ") AS rn")
                    .sql("\n    " + from)
                    .sql("\n    INNER JOIN " + previous + " ON ").append(bindingKey).sql(" = " + previous + ".binding_key")
                    .sql("\n    WHERE ").append(timeBound)
                    .sql("\n  ) ranked\n  WHERE rn = 1");
        }
        return cte.sql("\n)").build();
    }

    private SqlFragment nodes(ResolvedFlow flow) {
        List<String> parts = new ArrayList<>();
        String key = flow.sunburst() ? "event_path" : "event_type";
        for (int depth = flow.stepsBefore(); depth >= 1; depth--) {
            parts.add(nodeSelect("before_" + depth + "_", key, -depth, "before_step_" + depth, flow.sunburst()));
        }
        parts.add(nodeSelect("start_", "event_type", 0, "starting_entities", false));
        for (int depth = 1; depth <= flow.stepsAfter(); depth++) {
            parts.add(nodeSelect("after_" + depth + "_", key, depth, "after_step_" + depth, flow.sunburst()));
        }
        return SqlFragment.raw("nodes_agg AS (\n  SELECT node_id, name, layer, value FROM (\n    "
                + String.join("\n    UNION ALL\n    ", parts) + "\n  ) nodes_union\n)");
    }

    private String nodeSelect(String prefix, String key, int layer, String from, boolean byPath) {
        String groupBy = byPath ? "event_path, event_type" : "event_type";
        return "SELECT " + prefixed(prefix, key) + " AS node_id, " + dialect.castToText(SqlFragment.raw("event_type"))
                + " AS name, " + layer + " AS layer, COUNT(*) AS value FROM " + from + " GROUP BY " + groupBy;
    }

    private SqlFragment links(ResolvedFlow flow) {
        List<String> parts = new ArrayList<>();
        String key = flow.sunburst() ? "event_path" : "event_type";
        for (int depth = flow.stepsBefore(); depth >= 2; depth--) {
            parts.add(linkSelect("before_" + depth + "_", "f." + key, "before_" + (depth - 1) + "_", "t." + key,
                    "before_step_" + depth + " f", "before_step_" + (depth - 1) + " t", "f", "t"));
        }
        if (flow.stepsBefore() >= 1) {
            parts.add(linkSelect("before_1_", "b." + key, "start_", "s.event_type",
                    "before_step_1 b", "starting_entities s", "b", "s"));
        }
        if (flow.stepsAfter() >= 1) {
            parts.add(linkSelect("start_", "s.event_type", "after_1_", "a." + key,
                    "starting_entities s", "after_step_1 a", "s", "a"));
        }
        for (int depth = 1; depth < flow.stepsAfter(); depth++) {
            parts.add(linkSelect("after_" + depth + "_", "f." + key, "after_" + (depth + 1) + "_", "t." + key,
                    "after_step_" + depth + " f", "after_step_" + (depth + 1) + " t", "f", "t"));
        }
        if (parts.isEmpty()) {
            return SqlFragment.raw("links_agg AS (\n  SELECT NULL AS source_id, NULL AS target_id, 0 AS value"
                    + " FROM (SELECT 1 AS one) empty WHERE 1 = 0\n)");
        }
        return SqlFragment.raw("links_agg AS (\n  SELECT source_id, target_id, value FROM (\n    "
                + String.join("\n    UNION ALL\n    ", parts) + "\n  ) links_union\n)");
    }

    private String linkSelect(String sourcePrefix, String sourceKey, String targetPrefix, String targetKey,
                              String from, String join, String fromAlias, String joinAlias) {
        return "SELECT " + prefixed(sourcePrefix, sourceKey) + " AS source_id, "
                + prefixed(targetPrefix, targetKey) + " AS target_id, COUNT(*) AS value FROM " + from
                + " INNER JOIN " + join + " ON " + fromAlias + ".binding_key = " + joinAlias + ".binding_key"
                + " GROUP BY " + sourceKey + ", " + targetKey;
    }

    private String prefixed(String prefix, String column) {
        return dialect.concat(List.of(SqlFragment.raw("'" + prefix + "'"), dialect.castToText(SqlFragment.raw(column))))
                .toString();
    }

    private static SqlFragment finalResult() {
        return SqlFragment.raw("final_result AS (\n"
                + "  SELECT 'node' AS record_type, node_id AS id, name, layer, value, NULL AS source_id, NULL AS target_id"
                + " FROM nodes_agg\n"
                + "  UNION ALL\n"
                + "  SELECT 'link' AS record_type, NULL AS id, NULL AS name, NULL AS layer, value, source_id, target_id"
                + " FROM links_agg WHERE source_id IS NOT NULL\n"
                + ")");
    }

    private static String previousAlias(String direction, int depth) {
        return depth == 1 ? "starting_entities" : direction + "_step_" + (depth - 1);
    }

    private SqlFragment dimension(String member) {
        return context.getMembers().dimension(member);
    }
}
