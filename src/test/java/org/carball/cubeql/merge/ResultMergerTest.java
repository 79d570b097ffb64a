package org.carball.cubeql.merge;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResultMergerTest {

    @Test
    public void shouldTagConcatenatedRows() {
        // Given
        List<List<Map<String, Object>>> results = List.of(
                List.of(row("Orders.status", "paid", "Orders.count", 3)),
                List.of(row("Orders.status", "paid", "Orders.count", 5)));

        // When
        List<Map<String, Object>> merged = ResultMerger.concat(results, List.of("This year"));

        // Then
        assertThat(merged).hasSize(2);
        assertThat(merged.get(0)).containsEntry(ResultMerger.QUERY_INDEX, 0)
                .containsEntry(ResultMerger.QUERY_LABEL, "This year");
        assertThat(merged.get(1)).containsEntry(ResultMerger.QUERY_INDEX, 1)
                .containsEntry(ResultMerger.QUERY_LABEL, "Query 2")
                .containsEntry("Orders.count", 5);
    }

    @Test
    public void shouldAlignRowsOnMergeKeys() {
        // Given
        List<List<Map<String, Object>>> results = List.of(
                List.of(row("Orders.status", "pending", "Orders.count", 2),
                        row("Orders.status", "completed", "Orders.count", 7)),
                List.of(row("Orders.status", "completed", "Orders.totalAmount", 120.5),
                        row("Orders.status", "cancelled", "Orders.totalAmount", 10.0)));

        // When
        List<Map<String, Object>> merged = ResultMerger.mergeByKey(results,
                List.of(List.of("Orders.count"), List.of("Orders.totalAmount")), List.of("Orders.status"));

        // Then
        assertThat(merged).extracting(r -> r.get("Orders.status"))
                .containsExactly("cancelled", "completed", "pending");
        assertThat(merged.get(1)).containsEntry("Orders.count", 7).containsEntry("Orders.totalAmount", 120.5);
        assertThat(merged.get(0)).doesNotContainKey("Orders.count");
    }

    @Test
    public void shouldKeepFirstValueOfCollidingMeasure() {
        List<Map<String, Object>> merged = ResultMerger.mergeByKey(
                List.of(List.of(row("Orders.status", "paid", "Orders.count", 1)),
                        List.of(row("Orders.status", "paid", "Orders.count", 99))),
                List.of(List.of("Orders.count"), List.of("Orders.count")), List.of("Orders.status"));

        assertThat(merged).singleElement().satisfies(r -> assertThat(r).containsEntry("Orders.count", 1));
    }

    @Test
    public void shouldRequireMergeKey() {
        assertThatThrownBy(() -> ResultMerger.mergeByKey(List.of(), List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Map<String, Object> row(String key, Object keyValue, String measure, Object value) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(key, keyValue);
        row.put(measure, value);
        return row;
    }
}
