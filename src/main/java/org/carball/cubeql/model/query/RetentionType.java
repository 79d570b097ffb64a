package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classic counts entities active in exactly period N; rolling counts entities active in period N
 * or any later one.
 */
public enum RetentionType {
    CLASSIC,
    ROLLING;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static RetentionType fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
