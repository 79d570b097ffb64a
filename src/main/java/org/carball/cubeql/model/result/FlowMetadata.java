package org.carball.cubeql.model.result;

import org.carball.cubeql.model.query.FlowJoinStrategy;
import org.carball.cubeql.model.query.FlowOutputMode;

import java.util.List;

public record FlowMetadata(
    String startingStep,
    String bindingKey,
    String timeDimension,
    String eventDimension,
    int stepsBefore,
    int stepsAfter,
    FlowOutputMode outputMode,
    FlowJoinStrategy joinStrategy,
    List<String> layers
) {}
