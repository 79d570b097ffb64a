package org.carball.cubeql.transform;

import org.carball.cubeql.model.result.RetentionMetadata;
import org.carball.cubeql.model.result.RetentionResult;
import org.carball.cubeql.model.result.RetentionRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Types the retention rows and pivots them into a cohort by period matrix. Periods with no
 * retained entities are reported as 0.
 */
public class RetentionResultTransformer {

    static final String ALL_COHORTS = "All";

    public RetentionResult transform(List<Map<String, Object>> rows, RetentionMetadata metadata) {
        List<String> breakdowns = metadata.breakdownDimensions() == null ? List.of() : metadata.breakdownDimensions();
        List<RetentionRow> typed = new ArrayList<>();
        Map<String, List<Double>> matrix = new LinkedHashMap<>();

        for (Map<String, Object> row : rows) {
            Map<String, Object> breakdownValues = new LinkedHashMap<>();
            List<String> labelParts = new ArrayList<>();
            for (int i = 0; i < breakdowns.size(); i++) {
                Object value = row.get("breakdown_" + i);
                breakdownValues.put(breakdowns.get(i), value);
                labelParts.add(Objects.toString(value, "(none)"));
            }
            int period = (int) Rows.longValue(row, "period");
            Double rate = Rows.doubleValue(row, "retention_rate");
            RetentionRow retentionRow = new RetentionRow(
                    period,
                    Rows.longValue(row, "cohort_size"),
                    Rows.longValue(row, "retained_users"),
                    rate == null ? 0.0 : rate,
                    breakdownValues);
            typed.add(retentionRow);

            String cohort = labelParts.isEmpty() ? ALL_COHORTS : String.join(" / ", labelParts);
            List<Double> cells = matrix.computeIfAbsent(cohort,
                    c -> new ArrayList<>(Collections.nCopies(metadata.periods() + 1, 0.0)));
            if (period >= 0 && period < cells.size()) {
                cells.set(period, retentionRow.retentionRate());
            }
        }
        Map<String, List<Double>> frozen = new LinkedHashMap<>();
        matrix.forEach((cohort, cells) -> frozen.put(cohort, List.copyOf(cells)));
        return new RetentionResult(List.copyOf(typed), metadata.periods(), frozen);
    }
}
