package org.carball.cubeql.explain;

import org.carball.cubeql.sql.DatabaseEngine;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SqliteExplainParserTest {

    private static final String SQL = "SELECT * FROM employees";

    private final SqliteExplainParser parser = new SqliteExplainParser();

    @Test
    public void shouldClassifyAccessPaths() {
        // Given
        List<Map<String, Object>> rows = List.of(
                row(2, 0, "SCAN employees"),
                row(3, 0, "SEARCH departments USING INTEGER PRIMARY KEY (rowid=?)"),
                row(4, 0, "SEARCH offices USING COVERING INDEX idx_offices_city (city=? AND active=?)"),
                row(5, 0, "SEARCH teams"),
                row(6, 0, "USE TEMP B-TREE FOR ORDER BY"));

        // When
        ExplainResult result = parser.parse(rows, SQL, List.of());

        // Then
        assertThat(result.operations()).extracting(PlanOperation::type)
                .containsExactly("Seq Scan", "Primary Key Lookup", "Index Scan", "Search", "Sort");
        PlanOperation lookup = result.operations().get(1);
        assertThat(lookup.table()).isEqualTo("departments");
        assertThat(lookup.filter()).isEqualTo("rowid=?");
        PlanOperation indexed = result.operations().get(2);
        assertThat(indexed.index()).isEqualTo("idx_offices_city");
        assertThat(indexed.filter()).isEqualTo("city=? AND active=?");
        assertThat(result.operations().get(0).filter()).isNull();
        assertThat(result.operations().get(0).details()).containsExactly("SCAN employees");
    }

    @Test
    public void shouldNameTempBTreePurpose() {
        assertThat(SqliteExplainParser.operation("USE TEMP B-TREE FOR GROUP BY").type()).isEqualTo("Group");
        assertThat(SqliteExplainParser.operation("USE TEMP B-TREE FOR DISTINCT").type()).isEqualTo("Distinct");
        assertThat(SqliteExplainParser.operation("USE TEMP B-TREE").type()).isEqualTo("Temp B-Tree");
        assertThat(SqliteExplainParser.operation("SUBQUERY 1").type()).isEqualTo("Subquery");
        assertThat(SqliteExplainParser.operation("SCAN CONSTANT ROW").type()).isEqualTo("Constant Row");
    }

    @Test
    public void shouldNestRowsUnderTheirParent() {
        // Given
        List<Map<String, Object>> rows = List.of(
                row(1, 0, "COMPOUND QUERY"),
                row(2, 1, "LEFT-MOST SUBQUERY"),
                row(3, 2, "SCAN active_users"),
                row(4, 1, "UNION ALL"),
                row(5, 4, "SCAN archived_users"),
                row(7, 0, "CO-ROUTINE orders_agg"),
                row(8, 7, "SEARCH orders USING INDEX idx_orders_customer (customer_id=?)"));

        // When
        ExplainResult result = parser.parse(rows, SQL, List.of());

        // Then
        assertThat(result.operations()).extracting(PlanOperation::type).containsExactly("Compound Query", "Coroutine");
        PlanOperation compound = result.operations().get(0);
        assertThat(compound.children()).extracting(PlanOperation::type).containsExactly("LEFT-MOST SUBQUERY", "UNION ALL");
        assertThat(compound.children().get(1).children().get(0).table()).isEqualTo("archived_users");
        PlanOperation coroutine = result.operations().get(1);
        assertThat(coroutine.table()).isEqualTo("orders_agg");
        assertThat(coroutine.children().get(0).index()).isEqualTo("idx_orders_customer");
    }

    @Test
    public void shouldKeepOrphansAtTopLevel() {
        ExplainResult result = parser.parse(List.of(row(5, 999, "SCAN orphan_table")), SQL, List.of());

        assertThat(result.operations()).hasSize(1);
        assertThat(result.operations().get(0).table()).isEqualTo("orphan_table");
    }

    @Test
    public void shouldSummarizeScansAndIndexes() {
        // Given
        List<Map<String, Object>> rows = List.of(
                row(2, 0, "SEARCH t1 USING INDEX idx_same (a=?)"),
                row(3, 0, "search T2 using index idx_same (b=?)"),
                row(4, 0, "SEARCH   t3   USING   INDEX   idx_t3   (id=?)"),
                row(5, 0, "scan T4"));

        // When
        ExplainSummary summary = parser.parse(rows, SQL, List.of()).summary();

        // Then
        assertThat(summary.database()).isEqualTo(DatabaseEngine.SQLITE);
        assertThat(summary.hasSequentialScans()).isTrue();
        assertThat(summary.usedIndexes()).containsExactly("idx_same", "idx_t3");
        assertThat(summary.totalCost()).isNull();
        assertThat(summary.planningTime()).isNull();
        assertThat(summary.executionTime()).isNull();
    }

    @Test
    public void shouldNotCountIndexSearchAsSequentialScan() {
        ExplainResult result = parser.parse(
                List.of(row(0, 0, "SEARCH employees USING AUTOMATIC COVERING INDEX (org_id=?)")), SQL, List.of());

        assertThat(result.summary().hasSequentialScans()).isFalse();
        assertThat(result.operations().get(0).type()).isEqualTo("Index Scan");
        assertThat(result.summary().usedIndexes()).isEmpty();
    }

    @Test
    public void shouldKeepRawPlanAndRequest() {
        // Given
        List<Object> params = List.of("org-1");

        // When
        ExplainResult result = parser.parse(List.of(row(2, 0, "SCAN employees")),
                "SELECT * FROM employees WHERE org_id = ?", params);

        // Then
        assertThat(result.raw()).isEqualTo("id\tparent\tdetail\n2\t0\tSCAN employees");
        assertThat(result.sql()).isEqualTo("SELECT * FROM employees WHERE org_id = ?");
        assertThat(result.params()).isEqualTo(params);
    }

    @Test
    public void shouldHandleEmptyPlan() {
        ExplainResult result = parser.parse(List.of(), SQL, List.of());

        assertThat(result.operations()).isEmpty();
        assertThat(result.raw()).isEmpty();
        assertThat(result.summary().hasSequentialScans()).isFalse();
    }

    @Test
    public void shouldKeepUnknownDetailAsType() {
        ExplainResult result = parser.parse(List.of(row(0, 0, "MULTI-INDEX OR")), SQL, List.of());

        assertThat(result.operations().get(0).type()).isEqualTo("MULTI-INDEX OR");
    }

    @Test
    public void shouldRejectNonNumericIds() {
        Map<String, Object> row = new LinkedHashMap<>(row(0, 0, "SCAN t"));
        row.put("parent", "root");

        assertThatThrownBy(() -> parser.parse(List.of(row), SQL, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parent");
    }

    private static Map<String, Object> row(int id, int parent, String detail) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("parent", parent);
        row.put("notused", 0);
        row.put("detail", detail);
        return row;
    }
}
