package org.carball.cubeql.sql;

import org.carball.cubeql.model.query.TimeGranularity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SqlDialectTest {

    private final SqlDialect postgres = new PostgresDialect();
    private final SqlDialect mysql = new MySqlDialect();
    private final SqlDialect sqlite = new SqliteDialect();
    private final SqlFragment column = SqlFragment.raw("orders.created_at");

    @Test
    public void shouldTruncateTimeWithDateTruncOnPostgres() {
        assertThat(postgres.truncateTime(TimeGranularity.MONTH, column).toString())
                .isEqualTo("DATE_TRUNC('month', orders.created_at::timestamp)");
        assertThat(postgres.truncateTime(TimeGranularity.DAY, column).toString())
                .isEqualTo("DATE_TRUNC('day', orders.created_at::timestamp)::timestamp");
    }

    @Test
    public void shouldTruncateTimeWithDateFormatOnMySql() {
        assertThat(mysql.truncateTime(TimeGranularity.MONTH, column).toString())
                .isEqualTo("CAST(DATE_FORMAT(orders.created_at, '%Y-%m-01 00:00:00') AS DATETIME)");
        assertThat(mysql.truncateTime(TimeGranularity.WEEK, column).toString())
                .isEqualTo("CAST(DATE_SUB(DATE(orders.created_at), INTERVAL WEEKDAY(orders.created_at) DAY) AS DATETIME)");
    }

    @Test
    public void shouldTruncateTimeWithDatetimeModifiersOnSqlite() {
        assertThat(sqlite.truncateTime(TimeGranularity.MONTH, column).toString())
                .isEqualTo("datetime(orders.created_at, 'start of month')");
        assertThat(sqlite.truncateTime(TimeGranularity.WEEK, column).toString())
                .isEqualTo("datetime(orders.created_at, 'start of day', '-6 days', 'weekday 1')");
        assertThat(sqlite.truncateTime(TimeGranularity.HOUR, column).toString())
                .isEqualTo("strftime('%Y-%m-%d %H:00:00', orders.created_at)");
        assertThat(sqlite.truncateTime(TimeGranularity.QUARTER, column).toString())
                .isEqualTo("datetime(orders.created_at, 'start of year', "
                        + "'+' || (((CAST(strftime('%m', orders.created_at) AS INTEGER) - 1) / 3) * 3) || ' months')");
    }

    @Test
    public void shouldQuoteIdentifiersPerEngine() {
        assertThat(postgres.quoteIdentifier("Orders.count")).isEqualTo("\"Orders.count\"");
        assertThat(postgres.quoteIdentifier("a\"b")).isEqualTo("\"a\"\"b\"");
        assertThat(mysql.quoteIdentifier("Orders.count")).isEqualTo("`Orders.count`");
        assertThat(sqlite.quoteIdentifier("Orders.count")).isEqualTo("\"Orders.count\"");
        assertThat(sqlite.placeholder(3)).isEqualTo("?");
    }

    @Test
    public void shouldAddIntervalsInEachDialect() {
        // Given
        IsoDuration oneDay = IsoDuration.parse("P1D");
        SqlFragment previous = SqlFragment.raw("step_0.step_time");

        // When
        String pg = postgres.addInterval(previous, oneDay).toString();
        String my = mysql.addInterval(previous, oneDay).toString();

        // Then
        assertThat(pg).isEqualTo("(step_0.step_time + INTERVAL '1 days')");
        assertThat(my).isEqualTo("DATE_ADD(step_0.step_time, INTERVAL 86400 SECOND)");
    }

    @Test
    public void shouldAddCalendarUnitsSeparatelyOnMySql() {
        String sql = mysql.addInterval(SqlFragment.raw("t"), IsoDuration.parse("P1M2D")).toString();

        assertThat(sql).isEqualTo("DATE_ADD(DATE_ADD(t, INTERVAL 1 MONTH), INTERVAL 172800 SECOND)");
    }

    @Test
    public void shouldAddIntervalsAsDatetimeModifiersOnSqlite() {
        assertThat(sqlite.addInterval(SqlFragment.raw("t"), IsoDuration.parse("P1M2D")).toString())
                .isEqualTo("datetime(t, '+1 months', '+172800 seconds')");
        assertThat(sqlite.addInterval(SqlFragment.raw("t"), IsoDuration.parse("PT0S")).toString())
                .isEqualTo("datetime(t, '+0 seconds')");
        assertThat(sqlite.secondsBetween(SqlFragment.raw("a"), SqlFragment.raw("b")).toString())
                .isEqualTo("(CAST(strftime('%s', b) AS INTEGER) - CAST(strftime('%s', a) AS INTEGER))");
    }

    @Test
    public void shouldComputeSpreadWithoutNativeAggregatesOnSqlite() {
        assertThat(sqlite.variance(SqlFragment.raw("x")).toString())
                .isEqualTo("IFNULL((AVG((x) * (x)) - AVG(x) * AVG(x)), 0)");
        assertThat(sqlite.stddev(SqlFragment.raw("x")).toString())
                .isEqualTo("IFNULL(SQRT((AVG((x) * (x)) - AVG(x) * AVG(x))), 0)");
        assertThat(sqlite.percentile(SqlFragment.raw("x"), 50)).isEmpty();
    }

    @Test
    public void shouldOnlyOfferPercentilesOnPostgres() {
        assertThat(postgres.percentile(SqlFragment.raw("x"), 50))
                .hasValueSatisfying(f -> assertThat(f.toString())
                        .isEqualTo("PERCENTILE_CONT(0.5) WITHIN GROUP (ORDER BY x)"));
        assertThat(postgres.percentile(SqlFragment.raw("x"), 95))
                .hasValueSatisfying(f -> assertThat(f.toString()).contains("PERCENTILE_CONT(0.95)"));
        assertThat(mysql.percentile(SqlFragment.raw("x"), 50)).isEmpty();
    }

    @Test
    public void shouldRenderConditionalAggregates() {
        SqlFragment seconds = SqlFragment.raw("s");
        SqlFragment done = SqlFragment.raw("t IS NOT NULL");

        assertThat(postgres.conditionalAggregate("AVG", seconds, done).toString())
                .isEqualTo("AVG(s) FILTER (WHERE t IS NOT NULL)");
        assertThat(mysql.conditionalAggregate("AVG", seconds, done).toString())
                .isEqualTo("AVG(CASE WHEN t IS NOT NULL THEN s END)");
    }

    @Test
    public void shouldMatchCaseInsensitivelyPerEngine() {
        SqlFragment pattern = SqlFragment.param("%x%");

        assertThat(postgres.caseInsensitiveLike(column, pattern, false).toString())
                .isEqualTo("orders.created_at ILIKE ?");
        assertThat(mysql.caseInsensitiveLike(column, pattern, true).toString())
                .isEqualTo("LOWER(orders.created_at) NOT LIKE LOWER(?)");
    }

    @Test
    public void shouldBuildPeriodSeries() {
        assertThat(postgres.periodSeries(3).toString())
                .isEqualTo("(SELECT generate_series(0, 3) AS period_number)");
        assertThat(mysql.periodSeries(2).toString())
                .isEqualTo("(SELECT 0 AS period_number UNION ALL SELECT 1 UNION ALL SELECT 2)");
        assertThat(sqlite.periodSeries(4).toString())
                .isEqualTo("(WITH RECURSIVE periods(period_number) AS (SELECT 0 UNION ALL "
                        + "SELECT period_number + 1 FROM periods WHERE period_number < 4) SELECT period_number FROM periods)");
    }

    @Test
    public void shouldRejectArrayOperatorsOnMySql() {
        assertThat(mysql.supportsArrayOperators()).isFalse();
        assertThatThrownBy(() -> mysql.arrayCondition(column, "arrayContains", List.of("a")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void shouldLeaveOutUnsupportedFeaturesOnSqlite() {
        assertThat(sqlite.supportsArrayOperators()).isFalse();
        assertThat(sqlite.supportsLateralJoins()).isFalse();
        assertThat(sqlite.booleanLiteral(true)).isEqualTo("1");
        assertThat(sqlite.regexMatch(column, SqlFragment.param("*-2024"), true).toString())
                .isEqualTo("orders.created_at NOT GLOB ?");
        assertThat(sqlite.periodsBetween(SqlFragment.raw("a"), SqlFragment.raw("b"), TimeGranularity.WEEK).toString())
                .isEqualTo("CAST((julianday(b) - julianday(a)) / 7 AS INTEGER)");
        assertThatThrownBy(() -> sqlite.periodsBetween(column, column, TimeGranularity.HOUR))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldRenderArrayOperatorsOnPostgres() {
        SqlFragment condition = postgres.arrayCondition(SqlFragment.raw("tags"), "arrayOverlaps", List.of("a", "b"));

        RenderedSql rendered = condition.render(postgres);

        assertThat(rendered.sql()).isEqualTo("tags && ARRAY[$1, $2]");
        assertThat(rendered.params()).containsExactly("a", "b");
    }

    @Test
    public void shouldResolveDialectFromEngineName() {
        assertThat(DatabaseEngine.fromValue("postgresql")).isEqualTo(DatabaseEngine.POSTGRES);
        assertThat(DatabaseEngine.fromValue("MySQL").dialect()).isInstanceOf(MySqlDialect.class);
        assertThat(DatabaseEngine.fromValue("sqlite").dialect()).isInstanceOf(SqliteDialect.class);
        assertThatThrownBy(() -> DatabaseEngine.fromValue("oracle"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("oracle");
    }
}
