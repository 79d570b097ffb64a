package org.carball.cubeql.model.schema;

import lombok.Getter;

import java.util.Arrays;

@Getter
public enum DimensionType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    TIME("time");

    private final String value;

    DimensionType(String value) {
        this.value = value;
    }

    public static DimensionType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown dimension type: " + value));
    }
}
