package org.carball.cubeql.compiler;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.exception.IncompleteSpecException;
import org.carball.cubeql.model.query.Filter;
import org.carball.cubeql.model.query.FunnelSpec;
import org.carball.cubeql.model.query.FunnelStep;
import org.carball.cubeql.model.query.MemberMapping;
import org.carball.cubeql.model.query.QueryMode;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.model.result.FunnelMetadata;
import org.carball.cubeql.model.result.FunnelMetadata.FunnelStepMetadata;
import org.carball.cubeql.model.schema.Dimension;
import org.carball.cubeql.model.schema.DimensionType;
import org.carball.cubeql.model.schema.SchemaSnapshot;
import org.carball.cubeql.sql.IsoDuration;
import org.carball.cubeql.sql.RenderedSql;
import org.carball.cubeql.sql.SqlDialect;
import org.carball.cubeql.sql.SqlFragment;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles a funnel into chained step CTEs. Each step keeps the first qualifying event per
 * binding key and inner-joins the previous step, so an entity only reaches step N after reaching
 * step N-1 earlier and, when a window is set, soon enough.
 */
@Slf4j
public class FunnelQueryCompiler {

    /**
     * A validated step with its resolved cube and members.
     */
    private record ResolvedStep(int index, FunnelStep step, String cube, String bindingKey, String timeDimension,
                                IsoDuration window) {}

    private final CompilationContext context;
    private final SchemaSnapshot snapshot;
    private final SqlDialect dialect;
    private final CubeSource source;

    public FunnelQueryCompiler(CompilationContext context) {
        this.context = context;
        this.snapshot = context.getSnapshot();
        this.dialect = context.getDialect();
        this.source = new CubeSource(context);
    }

    /**
     * @throws IncompleteSpecException listing everything missing from the funnel
     */
    public CompiledQuery compile(FunnelSpec funnel) {
        List<ResolvedStep> steps = resolve(funnel);
        List<String> warnings = new ArrayList<>();

        List<SqlFragment> ctes = new ArrayList<>();
        List<FunnelStepMetadata> stepMetadata = new ArrayList<>();
        for (ResolvedStep step : steps) {
            ctes.add(stepCte(step));
            RenderedSql debug = debugSql(step).render(dialect);
            stepMetadata.add(new FunnelStepMetadata(step.index(), step.step().getName(), step.cube(),
                    step.step().getTimeToConvert(), debug.sql(), debug.params()));
        }
        ctes.add(joinedCte(steps.size()));
        ctes.add(metricsCte(steps.size(), funnel.isIncludeTimeMetrics(), warnings));

        SqlFragment sql = SqlFragment.builder()
                .sql("WITH ")
                .append(SqlFragment.join(",\n", ctes))
                .sql("\nSELECT * FROM funnel_metrics")
                .build();
        RenderedSql rendered = sql.render(dialect);
        log.debug("Compiled funnel with {} steps", steps.size());

        return CompiledQuery.builder()
                .sql(rendered.sql())
                .params(rendered.params())
                .mode(QueryMode.FUNNEL)
                .schemaVersion(snapshot.getVersion())
                .funnelMetadata(new FunnelMetadata(
                        String.valueOf(funnel.getBindingKey()),
                        String.valueOf(funnel.getTimeDimension()),
                        funnel.isIncludeTimeMetrics(),
                        List.copyOf(stepMetadata)))
                .warnings(warnings)
                .build();
    }

    private List<ResolvedStep> resolve(FunnelSpec funnel) {
        List<String> problems = new ArrayList<>();
        List<FunnelStep> steps = funnel.getSteps() == null ? List.of() : funnel.getSteps();
        if (steps.size() < 2) {
            problems.add("Funnel requires at least 2 steps");
        }
        if (funnel.getBindingKey() == null) {
            problems.add("Funnel requires a binding key");
        }
        if (funnel.getTimeDimension() == null) {
            problems.add("Funnel requires a time dimension");
        }
        if (!problems.isEmpty()) {
            throw new IncompleteSpecException(problems);
        }

        List<ResolvedStep> resolved = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            FunnelStep step = steps.get(i);
            String label = step.getName() == null || step.getName().isBlank() ? "#" + i : "'" + step.getName() + "'";
            if (step.getName() == null || step.getName().isBlank()) {
                problems.add("Funnel step " + i + " needs a name");
            }

            String cube = step.getCube() != null ? step.getCube() : funnel.getBindingKey().defaultCube().orElse(null);
            if (cube == null || !snapshot.hasCube(cube)) {
                problems.add("Funnel step " + label + " uses unknown cube '" + cube + "'");
                continue;
            }
            String bindingKey = member(funnel.getBindingKey(), cube, "binding key", label, false, problems);
            String timeDimension = member(funnel.getTimeDimension(), cube, "time dimension", label, true, problems);

            for (String filterMember : CubeSource.members(step.getFilters())) {
                if (snapshot.isMeasure(filterMember)) {
                    problems.add("Funnel step " + label + " filters on measure '" + filterMember
                            + "'; step filters may only use dimensions");
                }
            }

            IsoDuration window = null;
            if (step.getTimeToConvert() != null) {
                if (i == 0) {
                    problems.add("The first funnel step cannot have a timeToConvert");
                } else {
                    Optional<IsoDuration> parsed = IsoDuration.parseOptional(step.getTimeToConvert());
                    if (parsed.isEmpty()) {
                        problems.add("Funnel step " + label + " has an invalid timeToConvert '"
                                + step.getTimeToConvert() + "'; expected an ISO-8601 duration such as P7D or PT1H");
                    } else {
                        window = parsed.get();
                    }
                }
            }
            resolved.add(new ResolvedStep(i, step, cube, bindingKey, timeDimension, window));
        }

        if (!problems.isEmpty()) {
            throw new IncompleteSpecException(problems);
        }
        for (ResolvedStep step : resolved) {
            List<Filter> filters = step.step().getFilters() == null ? List.of() : step.step().getFilters();
            filters.forEach(filter -> filter.forEachCondition(condition -> context.getFilters().validate(condition)));
        }
        return resolved;
    }

    private String member(MemberMapping mapping, String cube, String role, String label, boolean time,
                          List<String> problems) {
        Optional<String> member = mapping.forCube(cube);
        if (member.isEmpty()) {
            problems.add("No " + role + " mapped for cube '" + cube + "' used by funnel step " + label);
            return null;
        }
        Optional<Dimension> dimension = snapshot.findDimension(member.get());
        if (dimension.isEmpty()) {
            problems.add("Funnel " + role + " '" + member.get() + "' is not a dimension");
        } else if (time && dimension.get().getType() != DimensionType.TIME) {
            problems.add("Funnel time dimension '" + member.get() + "' must be of type time");
        }
        return member.get();
    }

    private SqlFragment stepCte(ResolvedStep step) {
        SqlFragment bindingKey = context.getMembers().dimension(step.bindingKey());
        SqlFragment time = context.getMembers().dimension(step.timeDimension());
        Set<String> filterMembers = CubeSource.members(step.step().getFilters());

        SqlFragment.Builder cte = SqlFragment.builder()
                .sql("step_" + step.index() + " AS (\n  SELECT ")
                .append(bindingKey).sql(" AS binding_key, MIN(").append(time).sql(") AS step_time")
                .sql("\n  " + source.from(step.cube(), filterMembers, "  "));

        List<SqlFragment> conditions = new ArrayList<>();
        conditions.add(stepFilters(step));
        if (step.index() > 0) {
            String previous = "step_" + (step.index() - 1);
            cte.sql("\n  INNER JOIN " + previous + " ON ").append(bindingKey).sql(" = " + previous + ".binding_key");
            SqlFragment previousTime = SqlFragment.raw(previous + ".step_time");
            conditions.add(time.append(" > ").append(previousTime));
            if (step.window() != null) {
                conditions.add(time.append(" <= ").append(dialect.addInterval(previousTime, step.window())));
            }
        }
        SqlFragment where = SqlFragment.join(" AND ", conditions);
        if (!where.isEmpty()) {
            cte.sql("\n  WHERE ").append(where);
        }
        return cte.sql("\n  GROUP BY ").append(bindingKey).sql("\n)").build();
    }

    /**
     * The step as a standalone query, with the previous step's keys spelled out as an IN filter.
     */
    private SqlFragment debugSql(ResolvedStep step) {
        SqlFragment bindingKey = context.getMembers().dimension(step.bindingKey());
        SqlFragment time = context.getMembers().dimension(step.timeDimension());

        List<SqlFragment> conditions = new ArrayList<>();
        conditions.add(stepFilters(step));
        if (step.index() > 0) {
            conditions.add(bindingKey.append(" IN (SELECT binding_key FROM step_" + (step.index() - 1) + ")"));
        }
        SqlFragment.Builder sql = SqlFragment.builder()
                .sql("SELECT ").append(bindingKey).sql(" AS binding_key, MIN(").append(time).sql(") AS step_time ")
                .sql(source.from(step.cube(), CubeSource.members(step.step().getFilters()), ""));
        SqlFragment where = SqlFragment.join(" AND ", conditions);
        if (!where.isEmpty()) {
            sql.sql(" WHERE ").append(where);
        }
        return sql.sql(" GROUP BY ").append(bindingKey).build();
    }

    private SqlFragment stepFilters(ResolvedStep step) {
        return context.getFilters().build(step.step().getFilters(), member -> context.getMembers().dimension(member));
    }

    private SqlFragment joinedCte(int stepCount) {
        StringBuilder select = new StringBuilder("s0.binding_key AS binding_key, s0.step_time AS step_0_time");
        StringBuilder from = new StringBuilder("step_0 s0");
        for (int i = 1; i < stepCount; i++) {
            select.append(", s").append(i).append(".step_time AS step_").append(i).append("_time");
            from.append("\n  LEFT JOIN step_").append(i).append(" s").append(i)
                    .append(" ON s0.binding_key = s").append(i).append(".binding_key");
        }
        return SqlFragment.raw("funnel_joined AS (\n  SELECT " + select + "\n  FROM " + from + "\n)");
    }

    private SqlFragment metricsCte(int stepCount, boolean includeTimeMetrics, List<String> warnings) {
        List<SqlFragment> items = new ArrayList<>();
        items.add(SqlFragment.raw("COUNT(*) AS step_0_count"));
        for (int i = 1; i < stepCount; i++) {
            items.add(SqlFragment.raw("COUNT(step_" + i + "_time) AS step_" + i + "_count"));
        }

        if (includeTimeMetrics) {
            boolean percentilesSupported = dialect.percentile(SqlFragment.raw("1"), 50).isPresent();
            if (!percentilesSupported) {
                warnings.add("Median and p90 time to convert are not available on " + dialect.engine().value());
            }
            for (int i = 1; i < stepCount; i++) {
                SqlFragment current = SqlFragment.raw("step_" + i + "_time");
                SqlFragment previous = SqlFragment.raw("step_" + (i - 1) + "_time");
                SqlFragment seconds = dialect.secondsBetween(previous, current);
                SqlFragment completed = current.append(" IS NOT NULL");

                items.add(dialect.conditionalAggregate("AVG", seconds, completed).append(" AS step_" + i + "_avg_seconds"));
                items.add(dialect.conditionalAggregate("MIN", seconds, completed).append(" AS step_" + i + "_min_seconds"));
                items.add(dialect.conditionalAggregate("MAX", seconds, completed).append(" AS step_" + i + "_max_seconds"));
                if (percentilesSupported) {
                    items.add(percentileSubquery(seconds, completed, 50).append(" AS step_" + i + "_median_seconds"));
                    items.add(percentileSubquery(seconds, completed, 90).append(" AS step_" + i + "_p90_seconds"));
                }
            }
        }
        return SqlFragment.builder()
                .sql("funnel_metrics AS (\n  SELECT ")
                .append(SqlFragment.join(", ", items))
                .sql("\n  FROM funnel_joined\n)")
                .build();
    }

    private SqlFragment percentileSubquery(SqlFragment seconds, SqlFragment completed, int percentile) {
        return SqlFragment.builder()
                .sql("(SELECT ").append(dialect.percentile(seconds, percentile).orElseThrow())
                .sql(" FROM funnel_joined WHERE ").append(completed).sql(")")
                .build();
    }
}
