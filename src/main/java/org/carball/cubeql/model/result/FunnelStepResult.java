package org.carball.cubeql.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Conversion rates are fractions between 0 and 1; the first step has no conversion rate.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunnelStepResult(
    String step,
    int stepIndex,
    long count,
    Double conversionRate,
    Double cumulativeConversionRate,
    Double avgSecondsToConvert,
    Double minSecondsToConvert,
    Double maxSecondsToConvert,
    Double medianSecondsToConvert,
    Double p90SecondsToConvert
) {}
