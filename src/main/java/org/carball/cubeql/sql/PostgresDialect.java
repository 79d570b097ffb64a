package org.carball.cubeql.sql;

import org.carball.cubeql.model.query.TimeGranularity;

import java.util.List;
import java.util.Optional;

public class PostgresDialect implements SqlDialect {

    @Override
    public DatabaseEngine engine() {
        return DatabaseEngine.POSTGRES;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String placeholder(int index) {
        return "$" + index;
    }

    @Override
    public SqlFragment truncateTime(TimeGranularity granularity, SqlFragment expression) {
        SqlFragment truncated = SqlFragment.builder()
                .sql("DATE_TRUNC('" + granularity.value() + "', ")
                .append(expression)
                .sql("::timestamp)")
                .build();
        return granularity == TimeGranularity.DAY ? truncated.append("::timestamp") : truncated;
    }

    @Override
    public SqlFragment avg(SqlFragment expression) {
        return SqlFragment.builder().sql("COALESCE(AVG(").append(expression).sql("), 0)").build();
    }

    @Override
    public SqlFragment stddev(SqlFragment expression) {
        return SqlFragment.builder().sql("COALESCE(STDDEV_POP(").append(expression).sql("), 0)").build();
    }

    @Override
    public SqlFragment variance(SqlFragment expression) {
        return SqlFragment.builder().sql("COALESCE(VAR_POP(").append(expression).sql("), 0)").build();
    }

    @Override
    public Optional<SqlFragment> percentile(SqlFragment expression, int percentile) {
        String fraction = percentile % 100 == 0 ? String.valueOf(percentile / 100)
                : String.valueOf(percentile / 100.0);
        return Optional.of(SqlFragment.builder()
                .sql("PERCENTILE_CONT(" + fraction + ") WITHIN GROUP (ORDER BY ")
                .append(expression)
                .sql(")")
                .build());
    }

    @Override
    public SqlFragment caseInsensitiveLike(SqlFragment expression, SqlFragment pattern, boolean negate) {
        return SqlFragment.builder()
                .append(expression)
                .sql(negate ? " NOT ILIKE " : " ILIKE ")
                .append(pattern)
                .build();
    }

    @Override
    public SqlFragment regexMatch(SqlFragment expression, SqlFragment pattern, boolean negate) {
        return SqlFragment.builder()
                .append(expression)
                .sql(negate ? " !~* " : " ~* ")
                .append(pattern)
                .build();
    }

    @Override
    public SqlFragment addInterval(SqlFragment timestamp, IsoDuration duration) {
        return SqlFragment.builder()
                .sql("(")
                .append(timestamp)
                .sql(" + INTERVAL '" + duration.toIntervalText() + "')")
                .build();
    }

    @Override
    public SqlFragment secondsBetween(SqlFragment start, SqlFragment end) {
        return SqlFragment.builder()
                .sql("EXTRACT(EPOCH FROM (")
                .append(end)
                .sql(" - ")
                .append(start)
                .sql("))")
                .build();
    }

    @Override
    public SqlFragment conditionalAggregate(String function, SqlFragment expression, SqlFragment condition) {
        SqlFragment.Builder builder = SqlFragment.builder().sql(function + "(");
        if (expression == null) {
            builder.sql("*");
        } else {
            builder.append(expression);
        }
        return builder.sql(") FILTER (WHERE ").append(condition).sql(")").build();
    }

    @Override
    public SqlFragment periodsBetween(SqlFragment start, SqlFragment end, TimeGranularity granularity) {
        switch (granularity) {
            case MONTH:
                return SqlFragment.builder()
                        .sql("((EXTRACT(YEAR FROM ").append(end).sql(") - EXTRACT(YEAR FROM ").append(start)
                        .sql(")) * 12 + (EXTRACT(MONTH FROM ").append(end).sql(") - EXTRACT(MONTH FROM ").append(start)
                        .sql(")))::integer")
                        .build();
            case WEEK:
                return SqlFragment.builder()
                        .sql("FLOOR(EXTRACT(EPOCH FROM (").append(end).sql(" - ").append(start)
                        .sql(")) / 604800)::integer")
                        .build();
            case DAY:
                return SqlFragment.builder()
                        .sql("FLOOR(EXTRACT(EPOCH FROM (").append(end).sql(" - ").append(start)
                        .sql(")) / 86400)::integer")
                        .build();
            default:
                throw new IllegalArgumentException("Unsupported period granularity: " + granularity.value());
        }
    }

    @Override
    public SqlFragment periodSeries(int periods) {
        return SqlFragment.raw("(SELECT generate_series(0, " + periods + ") AS period_number)");
    }

    @Override
    public SqlFragment castToDate(SqlFragment expression) {
        return expression.append("::date");
    }

    @Override
    public SqlFragment nextDay(SqlFragment date) {
        return SqlFragment.builder().sql("(").append(date).sql(" + interval '1 day')").build();
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
        return true;
    }

    @Override
    public SqlFragment arrayCondition(SqlFragment expression, String operator, List<Object> values) {
        String symbol;
        switch (operator) {
            case "arrayContains":
                symbol = " @> ";
                break;
            case "arrayOverlaps":
                symbol = " && ";
                break;
            case "arrayContained":
                symbol = " <@ ";
                break;
            default:
                throw new IllegalArgumentException("Unknown array operator: " + operator);
        }
        SqlFragment array = SqlFragment.join(", ", values.stream().map(SqlFragment::param).toList());
        return SqlFragment.builder()
                .append(expression)
                .sql(symbol + "ARRAY[")
                .append(array)
                .sql("]")
                .build();
    }

    @Override
    public boolean supportsLateralJoins() {
        return true;
    }
}
