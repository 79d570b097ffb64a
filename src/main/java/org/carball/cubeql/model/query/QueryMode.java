package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The analysis modes a query can be compiled in. Exactly one compiler handles each.
 */
public enum QueryMode {
    QUERY,
    FUNNEL,
    FLOW,
    RETENTION;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
