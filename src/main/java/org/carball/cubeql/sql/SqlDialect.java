package org.carball.cubeql.sql;

import org.carball.cubeql.model.query.TimeGranularity;

import java.util.List;
import java.util.Optional;

/**
 * Engine-specific SQL forms. Everything the compilers emit that differs between databases goes
 * through here; the rest is plain ANSI SQL.
 */
public interface SqlDialect {

    DatabaseEngine engine();

    String quoteIdentifier(String identifier);

    /**
     * Placeholder for the parameter at a 1-based position.
     */
    String placeholder(int index);

    SqlFragment truncateTime(TimeGranularity granularity, SqlFragment expression);

    SqlFragment avg(SqlFragment expression);

    SqlFragment stddev(SqlFragment expression);

    SqlFragment variance(SqlFragment expression);

    /**
     * Continuous percentile, or empty when the engine has no ordered-set aggregate.
     */
    Optional<SqlFragment> percentile(SqlFragment expression, int percentile);

    SqlFragment caseInsensitiveLike(SqlFragment expression, SqlFragment pattern, boolean negate);

    SqlFragment regexMatch(SqlFragment expression, SqlFragment pattern, boolean negate);

    SqlFragment addInterval(SqlFragment timestamp, IsoDuration duration);

    /**
     * {@code end - start} in seconds.
     */
    SqlFragment secondsBetween(SqlFragment start, SqlFragment end);

    /**
     * Aggregate restricted to rows matching a condition; {@code expression} may be null for COUNT(*).
     */
    SqlFragment conditionalAggregate(String function, SqlFragment expression, SqlFragment condition);

    /**
     * Whole periods between two already truncated timestamps.
     */
    SqlFragment periodsBetween(SqlFragment start, SqlFragment end, TimeGranularity granularity);

    /**
     * A derived table with one {@code period_number} column holding 0..periods.
     */
    SqlFragment periodSeries(int periods);

    SqlFragment castToDate(SqlFragment expression);

    SqlFragment nextDay(SqlFragment date);

    SqlFragment castToText(SqlFragment expression);

    SqlFragment concat(List<SqlFragment> parts);

    boolean supportsArrayOperators();

    /**
     * Array containment: {@code arrayContains}, {@code arrayOverlaps} or {@code arrayContained}.
     */
    SqlFragment arrayCondition(SqlFragment expression, String operator, List<Object> values);

    boolean supportsLateralJoins();

    default String booleanLiteral(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    static SqlDialect forEngine(DatabaseEngine engine) {
        return engine.dialect();
    }
}
