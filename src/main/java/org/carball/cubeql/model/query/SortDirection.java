package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SortDirection {
    ASC,
    DESC;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SortDirection fromValue(String value) {
        if ("desc".equalsIgnoreCase(value)) {
            return DESC;
        }
        if ("asc".equalsIgnoreCase(value)) {
            return ASC;
        }
        throw new IllegalArgumentException("Sort direction must be 'asc' or 'desc', got: " + value);
    }
}
