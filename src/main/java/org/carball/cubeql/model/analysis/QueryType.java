package org.carball.cubeql.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QueryType {
    SINGLE_CUBE,
    MULTI_CUBE_JOIN,
    MULTI_CUBE_CTE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
