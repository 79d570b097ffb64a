package org.carball.cubeql.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RetentionRow(
    int period,
    long cohortSize,
    long retainedUsers,
    double retentionRate,
    Map<String, Object> breakdownValues
) {}
