package org.carball.cubeql.merge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combines the rows returned for a multi-query request. Rows are plain column maps as read from
 * a JDBC result set.
 */
public final class ResultMerger {

    public static final String QUERY_INDEX = "__queryIndex";
    public static final String QUERY_LABEL = "__queryLabel";

    private ResultMerger() {
    }

    /**
     * Appends every query's rows, tagging each with its query index and label.
     */
    public static List<Map<String, Object>> concat(List<List<Map<String, Object>>> results, List<String> labels) {
        List<Map<String, Object>> merged = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            String label = MultiQueryMergeEngine.label(labels, i);
            for (Map<String, Object> row : results.get(i)) {
                Map<String, Object> tagged = new LinkedHashMap<>(row);
                tagged.put(QUERY_INDEX, i);
                tagged.put(QUERY_LABEL, label);
                merged.add(tagged);
            }
        }
        return merged;
    }

    /**
     * Aligns rows on the merge keys. A measure present in several queries keeps the first
     * query's value; other columns are taken from the first query only. Rows come back sorted
     * by the first key.
     *
     * @param measures the measures each query selected, in query order
     */
    public static List<Map<String, Object>> mergeByKey(List<List<Map<String, Object>>> results,
                                                       List<List<String>> measures, List<String> mergeKeys) {
        if (mergeKeys.isEmpty()) {
            throw new IllegalArgumentException("Merging rows needs at least one merge key");
        }
        Map<String, Map<String, Object>> merged = new LinkedHashMap<>();
        for (int i = 0; i < results.size(); i++) {
            List<String> queryMeasures = i < measures.size() ? measures.get(i) : List.of();
            for (Map<String, Object> row : results.get(i)) {
                Map<String, Object> target = merged.computeIfAbsent(compositeKey(row, mergeKeys), k -> {
                    Map<String, Object> base = new LinkedHashMap<>();
                    mergeKeys.forEach(key -> base.put(key, row.get(key)));
                    return base;
                });
                for (String measure : queryMeasures) {
                    if (!target.containsKey(measure)) {
                        target.put(measure, row.get(measure));
                    }
                }
                if (i == 0) {
                    for (Map.Entry<String, Object> column : row.entrySet()) {
                        if (!mergeKeys.contains(column.getKey()) && !queryMeasures.contains(column.getKey())) {
                            target.putIfAbsent(column.getKey(), column.getValue());
                        }
                    }
                }
            }
        }
        List<Map<String, Object>> rows = new ArrayList<>(merged.values());
        String firstKey = mergeKeys.get(0);
        rows.sort(Comparator.comparing(row -> Objects.toString(row.get(firstKey), "")));
        return rows;
    }

    static String compositeKey(Map<String, Object> row, List<String> mergeKeys) {
        List<String> parts = new ArrayList<>();
        for (String key : mergeKeys) {
            parts.add(Objects.toString(row.get(key), ""));
        }
        return String.join("|", parts);
    }
}
