package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FlowJoinStrategy {
    AUTO,
    LATERAL,
    WINDOW;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static FlowJoinStrategy fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
