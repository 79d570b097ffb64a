package org.carball.cubeql.model.analysis;

import java.util.List;

public record PreAggregationAnalysis(
    String cubeName,
    String cteAlias,
    String reason,
    List<String> measures,
    List<String> joinKeys
) {}
