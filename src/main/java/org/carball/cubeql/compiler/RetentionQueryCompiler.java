package org.carball.cubeql.compiler;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.exception.IncompleteSpecException;
import org.carball.cubeql.model.query.Filter;
import org.carball.cubeql.model.query.MemberMapping;
import org.carball.cubeql.model.query.QueryMode;
import org.carball.cubeql.model.query.RetentionSpec;
import org.carball.cubeql.model.query.RetentionType;
import org.carball.cubeql.model.query.TimeGranularity;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.model.result.RetentionMetadata;
import org.carball.cubeql.model.schema.Dimension;
import org.carball.cubeql.model.schema.DimensionType;
import org.carball.cubeql.model.schema.SchemaSnapshot;
import org.carball.cubeql.sql.DateRangeResolver.Bounds;
import org.carball.cubeql.sql.RenderedSql;
import org.carball.cubeql.sql.SqlDialect;
import org.carball.cubeql.sql.SqlFragment;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles a cohort retention query. Entities enter a cohort at their first qualifying event in
 * the range; each later activity is bucketed by whole periods since that entry.
 */
@Slf4j
public class RetentionQueryCompiler {

    static final int MAX_PERIODS = 52;
    static final Set<TimeGranularity> GRANULARITIES =
            Set.of(TimeGranularity.DAY, TimeGranularity.WEEK, TimeGranularity.MONTH);

    private record ResolvedRetention(RetentionSpec spec, String cube, String bindingKey, String timeDimension,
                                     Bounds bounds, TimeGranularity granularity, RetentionType type,
                                     List<String> breakdowns) {}

    private final CompilationContext context;
    private final SchemaSnapshot snapshot;
    private final SqlDialect dialect;
    private final CubeSource source;

    public RetentionQueryCompiler(CompilationContext context) {
        this.context = context;
        this.snapshot = context.getSnapshot();
        this.dialect = context.getDialect();
        this.source = new CubeSource(context);
    }

    /**
     * @throws IncompleteSpecException listing everything missing from the retention request
     */
    public CompiledQuery compile(RetentionSpec retention) {
        ResolvedRetention resolved = resolve(retention);

        List<SqlFragment> ctes = List.of(
                cohortBase(resolved),
                activityPeriods(resolved),
                cohortSizes(resolved),
                resolved.type() == RetentionType.ROLLING ? rollingCounts(resolved) : classicCounts(resolved));

        SqlFragment sql = SqlFragment.builder()
                .sql("WITH ")
                .append(SqlFragment.join(",\n", ctes))
                .sql("\n")
                .append(finalSelect(resolved))
                .build();
        RenderedSql rendered = sql.render(dialect);
        log.debug("Compiled {} retention on {} over {} {} period(s)", resolved.type().value(), resolved.cube(),
                retention.getPeriods(), resolved.granularity().value());

        return CompiledQuery.builder()
                .sql(rendered.sql())
                .params(rendered.params())
                .mode(QueryMode.RETENTION)
                .schemaVersion(snapshot.getVersion())
                .retentionMetadata(new RetentionMetadata(
                        resolved.cube(),
                        resolved.bindingKey(),
                        resolved.timeDimension(),
                        resolved.granularity(),
                        retention.getPeriods(),
                        resolved.type(),
                        resolved.bounds().start(),
                        resolved.bounds().end(),
                        resolved.breakdowns()))
                .build();
    }

    private ResolvedRetention resolve(RetentionSpec retention) {
        List<String> problems = new ArrayList<>();
        if (retention.getTimeDimension() == null) {
            problems.add("Retention requires a time dimension");
        }
        if (retention.getBindingKey() == null) {
            problems.add("Retention requires a binding key");
        }
        if (retention.getPeriods() < 1 || retention.getPeriods() > MAX_PERIODS) {
            problems.add("periods must be between 1 and " + MAX_PERIODS + ", got: " + retention.getPeriods());
        }
        TimeGranularity granularity = retention.getGranularity() == null ? TimeGranularity.WEEK : retention.getGranularity();
        if (!GRANULARITIES.contains(granularity)) {
            problems.add("Retention granularity must be day, week or month, got: " + granularity.value());
        }

        Bounds bounds = null;
        if (retention.getDateRange() == null) {
            problems.add("Retention requires a date range");
        } else {
            try {
                bounds = context.getDates().resolve(retention.getDateRange());
                if (bounds.start().isAfter(bounds.end())) {
                    problems.add("Retention date range starts after it ends: " + retention.getDateRange().toJson());
                }
            } catch (IllegalArgumentException e) {
                problems.add("Invalid retention date range: " + e.getMessage());
            }
        }

        String cube = retention.getTimeDimension() == null ? null
                : retention.getTimeDimension().defaultCube().orElse(null);
        String timeDimension = null;
        String bindingKey = null;
        if (retention.getTimeDimension() != null) {
            if (cube == null || !snapshot.hasCube(cube)) {
                problems.add("Retention time dimension '" + retention.getTimeDimension() + "' names no known cube");
                cube = null;
            } else {
                timeDimension = member(retention.getTimeDimension(), cube, "time dimension", true, problems);
                if (retention.getBindingKey() != null) {
                    bindingKey = member(retention.getBindingKey(), cube, "binding key", false, problems);
                }
            }
        }

        List<String> breakdowns = retention.getBreakdownDimensions() == null
                ? List.of() : List.copyOf(new LinkedHashSet<>(retention.getBreakdownDimensions()));
        for (String breakdown : breakdowns) {
            if (!snapshot.isDimension(breakdown)) {
                problems.add("Breakdown '" + breakdown + "' is not a dimension");
            }
        }
        for (List<Filter> filters : List.of(nonNull(retention.getCohortFilters()), nonNull(retention.getActivityFilters()))) {
            for (String filterMember : CubeSource.members(filters)) {
                if (snapshot.isMeasure(filterMember)) {
                    problems.add("Retention filters may only use dimensions, got measure '" + filterMember + "'");
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new IncompleteSpecException(problems);
        }
        nonNull(retention.getCohortFilters())
                .forEach(filter -> filter.forEachCondition(condition -> context.getFilters().validate(condition)));
        nonNull(retention.getActivityFilters())
                .forEach(filter -> filter.forEachCondition(condition -> context.getFilters().validate(condition)));

        RetentionType type = retention.getRetentionType() == null ? RetentionType.CLASSIC : retention.getRetentionType();
        return new ResolvedRetention(retention, cube, bindingKey, timeDimension, bounds, granularity, type, breakdowns);
    }

    private String member(MemberMapping mapping, String cube, String role, boolean time, List<String> problems) {
        Optional<String> member = mapping.forCube(cube);
        if (member.isEmpty()) {
            problems.add("No retention " + role + " mapped for cube '" + cube + "'");
            return null;
        }
        Optional<Dimension> dimension = snapshot.findDimension(member.get());
        if (dimension.isEmpty()) {
            problems.add("Retention " + role + " '" + member.get() + "' is not a dimension");
        } else if (time && dimension.get().getType() != DimensionType.TIME) {
            problems.add("Retention time dimension '" + member.get() + "' must be of type time");
        }
        return member.get();
    }

    private SqlFragment cohortBase(ResolvedRetention retention) {
        SqlFragment bindingKey = dimension(retention.bindingKey());
        SqlFragment time = dimension(retention.timeDimension());
        SqlFragment entry = dialect.truncateTime(retention.granularity(), time);
        SqlFragment start = dialect.castToDate(SqlFragment.param(retention.bounds().start().toLocalDate()));
        SqlFragment end = dialect.nextDay(dialect.castToDate(SqlFragment.param(retention.bounds().end().toLocalDate())));

        List<SqlFragment> select = new ArrayList<>();
        select.add(bindingKey.append(" AS binding_key"));
        select.add(SqlFragment.raw("MIN(").append(entry).append(") AS cohort_entry"));
        List<SqlFragment> groupBy = new ArrayList<>();
        groupBy.add(bindingKey);
        for (int i = 0; i < retention.breakdowns().size(); i++) {
            SqlFragment breakdown = dimension(retention.breakdowns().get(i));
            select.add(SqlFragment.raw("MIN(").append(breakdown).append(") AS breakdown_" + i));
            groupBy.add(breakdown);
        }

        Set<String> joined = new LinkedHashSet<>(CubeSource.members(retention.spec().getCohortFilters()));
        joined.addAll(retention.breakdowns());

        List<SqlFragment> conditions = new ArrayList<>();
        conditions.add(context.getFilters().build(nonNull(retention.spec().getCohortFilters()), this::dimension));
        conditions.add(time.append(" >= ").append(start));
        conditions.add(time.append(" < ").append(end));

        SqlFragment firstEntry = SqlFragment.raw("MIN(").append(entry).append(")");
        return SqlFragment.builder()
                .sql("cohort_base AS (\n  SELECT ")
                .append(SqlFragment.join(", ", select))
                .sql("\n  " + source.from(retention.cube(), joined, "  "))
                .sql("\n  WHERE ").append(SqlFragment.join(" AND ", conditions))
                .sql("\n  GROUP BY ").append(SqlFragment.join(", ", groupBy))
                .sql("\n  HAVING ").append(firstEntry).sql(" >= ").append(start)
                .sql(" AND ").append(firstEntry).sql(" < ").append(end)
                .sql("\n)")
                .build();
    }

    private SqlFragment activityPeriods(ResolvedRetention retention) {
        SqlFragment bindingKey = dimension(retention.bindingKey());
        SqlFragment time = dimension(retention.timeDimension());
        SqlFragment period = dialect.periodsBetween(SqlFragment.raw("cohort_base.cohort_entry"),
                dialect.truncateTime(retention.granularity(), time), retention.granularity());
        List<String> breakdowns = breakdownColumns(retention, "cohort_base.");

        List<SqlFragment> select = new ArrayList<>();
        select.add(SqlFragment.raw("cohort_base.binding_key"));
        select.add(period.append(" AS period_number"));
        breakdowns.forEach(column -> select.add(SqlFragment.raw(column)));
        List<SqlFragment> groupBy = new ArrayList<>();
        groupBy.add(SqlFragment.raw("cohort_base.binding_key"));
        groupBy.add(period);
        breakdowns.forEach(column -> groupBy.add(SqlFragment.raw(column)));

        List<SqlFragment> conditions = new ArrayList<>();
        conditions.add(context.getFilters().build(nonNull(retention.spec().getActivityFilters()), this::dimension));
        conditions.add(time.append(" >= cohort_base.cohort_entry"));

        return SqlFragment.builder()
                .sql("activity_periods AS (\n  SELECT ")
                .append(SqlFragment.join(", ", select))
                .sql("\n  " + source.from(retention.cube(), CubeSource.members(retention.spec().getActivityFilters()), "  "))
                .sql("\n  INNER JOIN cohort_base ON ").append(bindingKey).sql(" = cohort_base.binding_key")
                .sql("\n  WHERE ").append(SqlFragment.join(" AND ", conditions))
                .sql("\n  GROUP BY ").append(SqlFragment.join(", ", groupBy))
                .sql("\n)")
                .build();
    }

    private SqlFragment cohortSizes(ResolvedRetention retention) {
        List<String> breakdowns = breakdownColumns(retention, "");
        StringBuilder cte = new StringBuilder("cohort_sizes AS (\n  SELECT ");
        breakdowns.forEach(column -> cte.append(column).append(", "));
        cte.append("COUNT(*) AS cohort_size\n  FROM cohort_base");
        if (!breakdowns.isEmpty()) {
            cte.append("\n  GROUP BY ").append(String.join(", ", breakdowns));
        }
        return SqlFragment.raw(cte.append("\n)").toString());
    }

    private SqlFragment classicCounts(ResolvedRetention retention) {
        List<String> breakdowns = breakdownColumns(retention, "");
        StringBuilder cte = new StringBuilder("retention_counts AS (\n  SELECT period_number, ");
        breakdowns.forEach(column -> cte.append(column).append(", "));
        cte.append("COUNT(DISTINCT binding_key) AS retained_users\n  FROM activity_periods")
                .append("\n  WHERE period_number >= 0 AND period_number <= ").append(retention.spec().getPeriods())
                .append("\n  GROUP BY period_number");
        breakdowns.forEach(column -> cte.append(", ").append(column));
        return SqlFragment.raw(cte.append("\n)").toString());
    }

    /**
     * Rolling retention counts an entity in every period up to its last active one.
     */
    private SqlFragment rollingCounts(ResolvedRetention retention) {
        List<String> breakdowns = breakdownColumns(retention, "");
        List<String> qualified = breakdownColumns(retention, "ump.");
        StringBuilder inner = new StringBuilder("SELECT binding_key, ");
        breakdowns.forEach(column -> inner.append(column).append(", "));
        inner.append("MAX(period_number) AS max_period FROM activity_periods")
                .append(" WHERE period_number >= 0 AND period_number <= ").append(retention.spec().getPeriods())
                .append(" GROUP BY binding_key");
        breakdowns.forEach(column -> inner.append(", ").append(column));

        StringBuilder cte = new StringBuilder("retention_counts AS (\n  SELECT p.period_number, ");
        for (int i = 0; i < breakdowns.size(); i++) {
            cte.append(qualified.get(i)).append(" AS ").append(breakdowns.get(i)).append(", ");
        }
        cte.append("COUNT(DISTINCT CASE WHEN ump.max_period >= p.period_number THEN ump.binding_key END)")
                .append(" AS retained_users")
                .append("\n  FROM (").append(inner).append(") ump")
                .append("\n  CROSS JOIN ").append(dialect.periodSeries(retention.spec().getPeriods())).append(" p")
                .append("\n  GROUP BY p.period_number");
        qualified.forEach(column -> cte.append(", ").append(column));
        return SqlFragment.raw(cte.append("\n)").toString());
    }

    private SqlFragment finalSelect(ResolvedRetention retention) {
        List<String> breakdowns = breakdownColumns(retention, "");
        StringBuilder select = new StringBuilder("SELECT rc.period_number AS period, cs.cohort_size, rc.retained_users, ")
                .append("rc.retained_users * 1.0 / NULLIF(cs.cohort_size, 0) AS retention_rate");
        breakdowns.forEach(column -> select.append(", rc.").append(column));
        select.append("\nFROM retention_counts rc\nINNER JOIN cohort_sizes cs ON ");
        if (breakdowns.isEmpty()) {
            select.append("1 = 1");
        } else {
            List<String> on = new ArrayList<>();
            for (String column : breakdowns) {
                on.add("COALESCE(" + dialect.castToText(SqlFragment.raw("rc." + column)) + ", '') = COALESCE("
                        + dialect.castToText(SqlFragment.raw("cs." + column)) + ", '')");
            }
            select.append(String.join(" AND ", on));
        }
        select.append("\nORDER BY ");
        breakdowns.forEach(column -> select.append("rc.").append(column).append(", "));
        select.append("rc.period_number");
        return SqlFragment.raw(select.toString());
    }

    private static List<String> breakdownColumns(ResolvedRetention retention, String prefix) {
        List<String> columns = new ArrayList<>();
        for (int i = 0; i < retention.breakdowns().size(); i++) {
            columns.add(prefix + "breakdown_" + i);
        }
        return columns;
    }

    private static List<Filter> nonNull(List<Filter> filters) {
        return filters == null ? List.of() : filters;
    }

    private SqlFragment dimension(String member) {
        return context.getMembers().dimension(member);
    }
}
