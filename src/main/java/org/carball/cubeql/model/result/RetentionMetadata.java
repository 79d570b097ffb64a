package org.carball.cubeql.model.result;

import org.carball.cubeql.model.query.RetentionType;
import org.carball.cubeql.model.query.TimeGranularity;

import java.time.LocalDateTime;
import java.util.List;

public record RetentionMetadata(
    String cube,
    String bindingKey,
    String timeDimension,
    TimeGranularity granularity,
    int periods,
    RetentionType retentionType,
    LocalDateTime rangeStart,
    LocalDateTime rangeEnd,
    List<String> breakdownDimensions
) {}
