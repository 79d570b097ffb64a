package org.carball.cubeql.transform;

import org.carball.cubeql.model.result.FunnelMetadata;
import org.carball.cubeql.model.result.FunnelMetadata.FunnelStepMetadata;
import org.carball.cubeql.model.result.FunnelStepResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the single {@code funnel_metrics} row into one result per step.
 */
public class FunnelResultTransformer {

    public List<FunnelStepResult> transform(Map<String, Object> metrics, FunnelMetadata metadata) {
        List<FunnelStepResult> results = new ArrayList<>();
        long first = 0;
        long previous = 0;
        for (FunnelStepMetadata step : metadata.steps()) {
            int i = step.index();
            long count = Rows.longValue(metrics, "step_" + i + "_count");
            Double conversion = null;
            Double cumulative = i == 0 ? 1.0 : rate(count, first);
            if (i == 0) {
                first = count;
            } else {
                conversion = rate(count, previous);
            }
            boolean timed = i > 0 && metadata.includeTimeMetrics();
            results.add(new FunnelStepResult(
                    step.name(),
                    i,
                    count,
                    conversion,
                    cumulative,
                    timed ? Rows.doubleValue(metrics, "step_" + i + "_avg_seconds") : null,
                    timed ? Rows.doubleValue(metrics, "step_" + i + "_min_seconds") : null,
                    timed ? Rows.doubleValue(metrics, "step_" + i + "_max_seconds") : null,
                    timed ? Rows.doubleValue(metrics, "step_" + i + "_median_seconds") : null,
                    timed ? Rows.doubleValue(metrics, "step_" + i + "_p90_seconds") : null));
            previous = count;
        }
        return results;
    }

    private static double rate(long count, long base) {
        return base == 0 ? 0.0 : (double) count / base;
    }
}
