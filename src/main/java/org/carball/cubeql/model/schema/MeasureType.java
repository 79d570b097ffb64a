package org.carball.cubeql.model.schema;

import lombok.Getter;

import java.util.Arrays;

@Getter
public enum MeasureType {
    COUNT("count"),
    COUNT_DISTINCT("countDistinct"),
    SUM("sum"),
    AVG("avg"),
    MIN("min"),
    MAX("max"),
    RUNNING_TOTAL("runningTotal"),
    CALCULATED("calculated"),
    NUMBER("number"),
    MEDIAN("median"),
    P95("p95"),
    P99("p99"),
    STDDEV("stddev"),
    VARIANCE("variance");

    private final String value;

    MeasureType(String value) {
        this.value = value;
    }

    public boolean isPercentile() {
        return this == MEDIAN || this == P95 || this == P99;
    }

    public int percentile() {
        switch (this) {
            case MEDIAN:
                return 50;
            case P95:
                return 95;
            case P99:
                return 99;
            default:
                throw new IllegalStateException(value + " is not a percentile measure");
        }
    }

    public static MeasureType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown measure type: " + value));
    }
}
