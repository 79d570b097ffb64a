package org.carball.cubeql.model.schema;

import lombok.Getter;

import java.util.Arrays;

@Getter
public enum RelationshipType {
    BELONGS_TO("belongsTo"),
    HAS_ONE("hasOne"),
    HAS_MANY("hasMany"),
    BELONGS_TO_MANY("belongsToMany");

    private final String value;

    RelationshipType(String value) {
        this.value = value;
    }

    /**
     * True when following this edge can multiply the rows of the side it starts from.
     */
    public boolean isToMany() {
        return this == HAS_MANY || this == BELONGS_TO_MANY;
    }

    /**
     * The kind seen when the edge is walked from its target back to its source.
     */
    public RelationshipType inverse() {
        switch (this) {
            case BELONGS_TO:
                return HAS_MANY;
            case HAS_ONE:
            case HAS_MANY:
                return BELONGS_TO;
            default:
                return BELONGS_TO_MANY;
        }
    }

    public JoinType defaultJoinType() {
        return this == BELONGS_TO ? JoinType.INNER : JoinType.LEFT;
    }

    public static RelationshipType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown relationship type: " + value));
    }
}
