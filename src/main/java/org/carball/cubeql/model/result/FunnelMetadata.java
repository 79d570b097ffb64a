package org.carball.cubeql.model.result;

import java.util.List;

public record FunnelMetadata(
    String bindingKey,
    String timeDimension,
    boolean includeTimeMetrics,
    List<FunnelStepMetadata> steps
) {

    /**
     * One step as it runs inside the funnel. {@code debugSql} spells out the restriction to the
     * previous step's binding keys that the chained CTEs apply implicitly.
     */
    public record FunnelStepMetadata(
        int index,
        String name,
        String cube,
        String timeToConvert,
        String debugSql,
        List<Object> debugParams
    ) {}
}
