package org.carball.cubeql.sql;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.Measure;
import org.carball.cubeql.model.schema.MeasureReferences;
import org.carball.cubeql.model.schema.MeasureType;
import org.carball.cubeql.model.schema.MemberRef;
import org.carball.cubeql.model.schema.SchemaSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Builds aggregate expressions for measures, expanding calculated measures into the aggregates
 * they reference.
 */
@Slf4j
public class MeasureSqlBuilder {

    private final SchemaSnapshot snapshot;
    private final SqlDialect dialect;

    public MeasureSqlBuilder(SchemaSnapshot snapshot, SqlDialect dialect) {
        this.snapshot = snapshot;
        this.dialect = dialect;
    }

    /**
     * Aggregate for a measure in the outer query.
     *
     * @param preAggregated outer expressions for measures already aggregated in a CTE
     * @param runningOrder  ORDER BY list for running totals, empty when the query has no time axis
     */
    public SqlFragment build(String member, Map<String, SqlFragment> preAggregated, SqlFragment runningOrder) {
        SqlFragment cteExpression = preAggregated.get(member);
        if (cteExpression != null) {
            return cteExpression;
        }
        Measure measure = require(member);
        if (measure.getType() == MeasureType.CALCULATED) {
            return expandCalculated(member, measure, preAggregated, runningOrder);
        }
        Cube cube = cubeOf(member);
        SqlFragment aggregate = aggregate(measure, cube);
        if (measure.getType() == MeasureType.RUNNING_TOTAL && !runningOrder.isEmpty()) {
            return SqlFragment.builder()
                    .sql("SUM(").append(aggregate).sql(") OVER (ORDER BY ").append(runningOrder).sql(")")
                    .build();
        }
        return aggregate;
    }

    public SqlFragment build(String member) {
        return build(member, Map.of(), SqlFragment.empty());
    }

    /**
     * Plain aggregate of a non-calculated measure against its cube's table. A measure without
     * {@code sql} aggregates the cube's primary key, so rows a LEFT JOIN adds for a missing match
     * are not counted.
     */
    public SqlFragment aggregate(Measure measure, Cube cube) {
        String alias = cube.alias();
        SqlFragment expression = measure.getSql() == null || measure.getSql().isBlank()
                ? rowKey(cube)
                : MemberSqlResolver.qualify(measure.getSql(), alias);

        if (!measure.getFilters().isEmpty()) {
            List<SqlFragment> conditions = measure.getFilters().stream()
                    .map(filter -> MemberSqlResolver.condition(filter, alias).parenthesized())
                    .toList();
            SqlFragment value = measure.getSql() == null || measure.getSql().isBlank()
                    ? SqlFragment.raw("1") : expression;
            expression = SqlFragment.builder()
                    .sql("CASE WHEN ").append(SqlFragment.join(" AND ", conditions))
                    .sql(" THEN ").append(value).sql(" END")
                    .build();
        }

        switch (measure.getType()) {
            case COUNT:
                return wrap("COUNT(", expression);
            case COUNT_DISTINCT:
                return wrap("COUNT(DISTINCT ", expression);
            case SUM:
            case RUNNING_TOTAL:
                return wrap("SUM(", expression);
            case AVG:
                return dialect.avg(expression);
            case MIN:
                return wrap("MIN(", expression);
            case MAX:
                return wrap("MAX(", expression);
            case NUMBER:
                return expression;
            case STDDEV:
                return dialect.stddev(expression);
            case VARIANCE:
                return dialect.variance(expression);
            case MEDIAN:
            case P95:
            case P99:
                return percentile(measure, expression);
            default:
                throw new IllegalArgumentException("Measure '" + measure.getName()
                        + "' of type " + measure.getType().getValue() + " cannot be aggregated directly");
        }
    }

    /**
     * Outer aggregate over a column a CTE already aggregated. Statistical measures cannot be
     * recombined exactly and take the largest per-key value.
     */
    public SqlFragment reaggregate(MeasureType type, SqlFragment column) {
        switch (type) {
            case AVG:
                return wrap("AVG(", column);
            case MIN:
                return wrap("MIN(", column);
            case MAX:
            case MEDIAN:
            case P95:
            case P99:
            case STDDEV:
            case VARIANCE:
                return wrap("MAX(", column);
            case COUNT:
            case COUNT_DISTINCT:
            case SUM:
            case NUMBER:
            case RUNNING_TOTAL:
            default:
                return wrap("SUM(", column);
        }
    }

    private SqlFragment expandCalculated(String member, Measure measure,
                                         Map<String, SqlFragment> preAggregated, SqlFragment runningOrder) {
        String cubeName = MemberRef.parse(member).cubeName();
        String template = measure.getCalculatedSql();
        Matcher matcher = MeasureReferences.REFERENCE.matcher(template);
        SqlFragment.Builder builder = SqlFragment.builder();
        int last = 0;
        while (matcher.find()) {
            builder.sql(template.substring(last, matcher.start()));
            String reference = matcher.group(1);
            if ("CUBE".equals(reference)) {
                builder.sql(cubeOf(member).alias());
            } else {
                String qualified = reference.contains(".") ? reference : cubeName + "." + reference;
                builder.append(build(qualified, preAggregated, runningOrder).parenthesized());
            }
            last = matcher.end();
        }
        builder.sql(template.substring(last));
        return builder.build();
    }

    private SqlFragment percentile(Measure measure, SqlFragment expression) {
        Optional<SqlFragment> percentile = dialect.percentile(expression, measure.getType().percentile());
        if (percentile.isEmpty()) {
            log.warn("{} is not supported on {}, returning NULL for measure '{}'",
                    measure.getType().getValue(), dialect.engine().value(), measure.getName());
            return SqlFragment.raw("MAX(NULL)");
        }
        return percentile.get();
    }

    private static SqlFragment rowKey(Cube cube) {
        return cube.primaryKeys().stream()
                .findFirst()
                .map(key -> MemberSqlResolver.qualify(key.getSql(), cube.alias()))
                .orElse(SqlFragment.raw("*"));
    }

    private Measure require(String member) {
        return snapshot.findMeasure(member)
                .orElseThrow(() -> new IllegalArgumentException("Unknown measure: " + member));
    }

    private Cube cubeOf(String member) {
        return snapshot.findCube(MemberRef.parse(member).cubeName())
                .orElseThrow(() -> new IllegalArgumentException("Unknown cube in member: " + member));
    }

    private static SqlFragment wrap(String prefix, SqlFragment expression) {
        return SqlFragment.builder().sql(prefix).append(expression).sql(")").build();
    }
}
