package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FlowOutputMode {
    SANKEY,
    SUNBURST;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static FlowOutputMode fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
