package org.carball.cubeql.sql;

import org.carball.cubeql.model.query.TimeGranularity;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 8 forms. MySQL has no ILIKE, no ordered-set aggregates and no array type.
 */
public class MySqlDialect implements SqlDialect {

    @Override
    public DatabaseEngine engine() {
        return DatabaseEngine.MYSQL;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    @Override
    public String placeholder(int index) {
        return "?";
    }

    @Override
    public SqlFragment truncateTime(TimeGranularity granularity, SqlFragment expression) {
        switch (granularity) {
            case YEAR:
                return dateFormat(expression, "%Y-01-01 00:00:00");
            case QUARTER:
                return SqlFragment.builder()
                        .sql("CAST(DATE_ADD(MAKEDATE(YEAR(").append(expression)
                        .sql("), 1), INTERVAL (QUARTER(").append(expression)
                        .sql(") - 1) QUARTER) AS DATETIME)")
                        .build();
            case MONTH:
                return dateFormat(expression, "%Y-%m-01 00:00:00");
            case WEEK:
                return SqlFragment.builder()
                        .sql("CAST(DATE_SUB(DATE(").append(expression)
                        .sql("), INTERVAL WEEKDAY(").append(expression)
                        .sql(") DAY) AS DATETIME)")
                        .build();
            case DAY:
                return dateFormat(expression, "%Y-%m-%d 00:00:00");
            case HOUR:
                return dateFormat(expression, "%Y-%m-%d %H:00:00");
            case MINUTE:
                return dateFormat(expression, "%Y-%m-%d %H:%i:00");
            case SECOND:
            default:
                return dateFormat(expression, "%Y-%m-%d %H:%i:%s");
        }
    }

    private SqlFragment dateFormat(SqlFragment expression, String format) {
        return SqlFragment.builder()
                .sql("CAST(DATE_FORMAT(").append(expression)
                .sql(", '" + format + "') AS DATETIME)")
                .build();
    }

    @Override
    public SqlFragment avg(SqlFragment expression) {
        return SqlFragment.builder().sql("IFNULL(AVG(").append(expression).sql("), 0)").build();
    }

    @Override
    public SqlFragment stddev(SqlFragment expression) {
        return SqlFragment.builder().sql("IFNULL(STDDEV_POP(").append(expression).sql("), 0)").build();
    }

    @Override
    public SqlFragment variance(SqlFragment expression) {
        return SqlFragment.builder().sql("IFNULL(VAR_POP(").append(expression).sql("), 0)").build();
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

    @Override
    public SqlFragment regexMatch(SqlFragment expression, SqlFragment pattern, boolean negate) {
        return SqlFragment.builder()
                .append(expression)
                .sql(negate ? " NOT REGEXP " : " REGEXP ")
                .append(pattern)
                .build();
    }

    @Override
    public SqlFragment addInterval(SqlFragment timestamp, IsoDuration duration) {
        SqlFragment result = timestamp;
        if (duration.years() > 0) {
            result = dateAdd(result, duration.years(), "YEAR");
        }
        if (duration.months() > 0) {
            result = dateAdd(result, duration.months(), "MONTH");
        }
        long remaining = duration.totalSeconds()
                - (long) duration.years() * 365 * 86_400L
                - (long) duration.months() * 30 * 86_400L;
        if (remaining > 0 || result == timestamp) {
            result = dateAdd(result, remaining, "SECOND");
        }
        return result;
    }

    private SqlFragment dateAdd(SqlFragment timestamp, long amount, String unit) {
        return SqlFragment.builder()
                .sql("DATE_ADD(").append(timestamp)
                .sql(", INTERVAL " + amount + " " + unit + ")")
                .build();
    }

    @Override
    public SqlFragment secondsBetween(SqlFragment start, SqlFragment end) {
        return SqlFragment.builder()
                .sql("TIMESTAMPDIFF(SECOND, ").append(start).sql(", ").append(end).sql(")")
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
            case MONTH:
            case WEEK:
            case DAY:
                return SqlFragment.builder()
                        .sql("TIMESTAMPDIFF(" + granularity.name() + ", ").append(start)
                        .sql(", ").append(end).sql(")")
                        .build();
            default:
                throw new IllegalArgumentException("Unsupported period granularity: " + granularity.value());
        }
    }

    @Override
    public SqlFragment periodSeries(int periods) {
        StringBuilder series = new StringBuilder("(SELECT 0 AS period_number");
        for (int i = 1; i <= periods; i++) {
            series.append(" UNION ALL SELECT ").append(i);
        }
        return SqlFragment.raw(series.append(")").toString());
    }

    @Override
    public SqlFragment castToDate(SqlFragment expression) {
        return SqlFragment.builder().sql("DATE(").append(expression).sql(")").build();
    }

    @Override
    public SqlFragment nextDay(SqlFragment date) {
        return SqlFragment.builder().sql("DATE_ADD(").append(date).sql(", INTERVAL 1 DAY)").build();
    }

    @Override
    public SqlFragment castToText(SqlFragment expression) {
        return SqlFragment.builder().sql("CAST(").append(expression).sql(" AS CHAR)").build();
    }

    @Override
    public SqlFragment concat(List<SqlFragment> parts) {
        return SqlFragment.join(", ", parts).prepend("CONCAT(").append(")");
    }

    @Override
    public boolean supportsArrayOperators() {
        return false;
    }

    @Override
    public SqlFragment arrayCondition(SqlFragment expression, String operator, List<Object> values) {
        throw new UnsupportedOperationException("MySQL has no array operators");
    }

    @Override
    public boolean supportsLateralJoins() {
        return false;
    }
}
