package org.carball.cubeql.sql;

import org.carball.cubeql.model.query.TimeGranularity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite 3 forms over ISO-8601 text timestamps. SQLite has no date truncation, ILIKE, array type,
 * ordered-set aggregates or LATERAL; time is handled with {@code datetime()} modifiers and
 * {@code julianday()} arithmetic. Standard deviation needs the math functions SQLite ships since
 * 3.35.
 */
public class SqliteDialect implements SqlDialect {

    @Override
    public DatabaseEngine engine() {
        return DatabaseEngine.SQLITE;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String placeholder(int index) {
        return "?";
    }

    @Override
    public SqlFragment truncateTime(TimeGranularity granularity, SqlFragment expression) {
        switch (granularity) {
            case YEAR:
                return datetime(expression, "'start of year'");
            case QUARTER:
                return SqlFragment.builder()
                        .sql("datetime(").append(expression)
                        .sql(", 'start of year', '+' || (((CAST(strftime('%m', ").append(expression)
                        .sql(") AS INTEGER) - 1) / 3) * 3) || ' months')")
                        .build();
            case MONTH:
                return datetime(expression, "'start of month'");
            case WEEK:
                // Back six days, then forward to the next Monday: the Monday on or before the value
                return datetime(expression, "'start of day', '-6 days', 'weekday 1'");
            case DAY:
                return datetime(expression, "'start of day'");
            case HOUR:
                return strftime(expression, "%Y-%m-%d %H:00:00");
            case MINUTE:
                return strftime(expression, "%Y-%m-%d %H:%M:00");
            case SECOND:
            default:
                return strftime(expression, "%Y-%m-%d %H:%M:%S");
        }
    }

    private static SqlFragment datetime(SqlFragment expression, String modifiers) {
        return SqlFragment.builder().sql("datetime(").append(expression).sql(", " + modifiers + ")").build();
    }

    private static SqlFragment strftime(SqlFragment expression, String format) {
        return SqlFragment.builder().sql("strftime('" + format + "', ").append(expression).sql(")").build();
    }

    @Override
    public SqlFragment avg(SqlFragment expression) {
        return SqlFragment.builder().sql("IFNULL(AVG(").append(expression).sql("), 0)").build();
    }

    @Override
    public SqlFragment stddev(SqlFragment expression) {
        return SqlFragment.builder().sql("IFNULL(SQRT(").append(populationVariance(expression)).sql("), 0)").build();
    }

    @Override
    public SqlFragment variance(SqlFragment expression) {
        return SqlFragment.builder().sql("IFNULL(").append(populationVariance(expression)).sql(", 0)").build();
    }

    /**
     * {@code E[x^2] - E[x]^2}; SQLite has no VAR_POP.
     */
    private static SqlFragment populationVariance(SqlFragment expression) {
        return SqlFragment.builder()
                .sql("(AVG((").append(expression).sql(") * (").append(expression)
                .sql(")) - AVG(").append(expression).sql(") * AVG(").append(expression).sql("))")
                .build();
    }

    @Override
    public Optional<SqlFragment> percentile(SqlFragment expression, int percentile) {
        return Optional.empty();
    }

    @Override
    public SqlFragment caseInsensitiveLike(SqlFragment expression, SqlFragment pattern, boolean negate) {
        return SqlFragment.builder()
                .sql("LOWER(").append(expression)
                .sql(negate ? ") NOT LIKE LOWER(" : ") LIKE LOWER(")
                .append(pattern)
                .sql(")")
                .build();
    }

    /**
     * SQLite only has REGEXP when the connection registers a {@code regexp()} function, so the
     * pattern is matched as a GLOB instead.
     */
    @Override
    public SqlFragment regexMatch(SqlFragment expression, SqlFragment pattern, boolean negate) {
        return SqlFragment.builder()
                .append(expression)
                .sql(negate ? " NOT GLOB " : " GLOB ")
                .append(pattern)
                .build();
    }

    @Override
    public SqlFragment addInterval(SqlFragment timestamp, IsoDuration duration) {
        List<String> modifiers = new ArrayList<>();
        if (duration.years() > 0) {
            modifiers.add("'+" + duration.years() + " years'");
        }
        if (duration.months() > 0) {
            modifiers.add("'+" + duration.months() + " months'");
        }
        long remaining = duration.totalSeconds()
                - (long) duration.years() * 365 * 86_400L
                - (long) duration.months() * 30 * 86_400L;
        if (remaining > 0 || modifiers.isEmpty()) {
            modifiers.add("'+" + remaining + " seconds'");
        }
        return datetime(timestamp, String.join(", ", modifiers));
    }

    @Override
    public SqlFragment secondsBetween(SqlFragment start, SqlFragment end) {
        return SqlFragment.builder()
                .sql("(CAST(strftime('%s', ").append(end).sql(") AS INTEGER) - CAST(strftime('%s', ")
                .append(start).sql(") AS INTEGER))")
                .build();
    }

    @Override
    public SqlFragment conditionalAggregate(String function, SqlFragment expression, SqlFragment condition) {
        SqlFragment value = expression == null ? SqlFragment.raw("1") : expression;
        return SqlFragment.builder()
                .sql(function + "(CASE WHEN ").append(condition)
                .sql(" THEN ").append(value)
                .sql(" END)")
                .build();
    }

    @Override
    public SqlFragment periodsBetween(SqlFragment start, SqlFragment end, TimeGranularity granularity) {
        switch (granularity) {
            case DAY:
                return SqlFragment.builder()
                        .sql("CAST(julianday(").append(end).sql(") - julianday(").append(start)
                        .sql(") AS INTEGER)")
                        .build();
            case WEEK:
                return SqlFragment.builder()
                        .sql("CAST((julianday(").append(end).sql(") - julianday(").append(start)
                        .sql(")) / 7 AS INTEGER)")
                        .build();
            case MONTH:
                return SqlFragment.builder()
                        .sql("((CAST(strftime('%Y', ").append(end).sql(") AS INTEGER) - CAST(strftime('%Y', ")
                        .append(start).sql(") AS INTEGER)) * 12 + (CAST(strftime('%m', ").append(end)
                        .sql(") AS INTEGER) - CAST(strftime('%m', ").append(start).sql(") AS INTEGER)))")
                        .build();
            default:
                throw new IllegalArgumentException("Unsupported period granularity: " + granularity.value());
        }
    }

    @Override
    public SqlFragment periodSeries(int periods) {
        return SqlFragment.raw("(WITH RECURSIVE periods(period_number) AS (SELECT 0 UNION ALL "
                + "SELECT period_number + 1 FROM periods WHERE period_number < " + periods
                + ") SELECT period_number FROM periods)");
    }

    @Override
    public SqlFragment castToDate(SqlFragment expression) {
        return SqlFragment.builder().sql("date(").append(expression).sql(")").build();
    }

    @Override
    public SqlFragment nextDay(SqlFragment date) {
        return SqlFragment.builder().sql("date(").append(date).sql(", '+1 day')").build();
    }

    @Override
    public SqlFragment castToText(SqlFragment expression) {
        return SqlFragment.builder().sql("CAST(").append(expression).sql(" AS TEXT)").build();
    }

    @Override
    public SqlFragment concat(List<SqlFragment> parts) {
        return SqlFragment.join(" || ", parts);
    }

    @Override
    public boolean supportsArrayOperators() {
        return false;
    }

    @Override
    public SqlFragment arrayCondition(SqlFragment expression, String operator, List<Object> values) {
        throw new UnsupportedOperationException("SQLite has no array operators");
    }

    @Override
    public boolean supportsLateralJoins() {
        return false;
    }

    @Override
    public String booleanLiteral(boolean value) {
        return value ? "1" : "0";
    }
}
