package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MergeStrategy {
    CONCAT,
    MERGE,
    FUNNEL;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MergeStrategy fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
