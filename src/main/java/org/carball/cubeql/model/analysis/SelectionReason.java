package org.carball.cubeql.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which tier of the primary-cube heuristic decided the FROM table.
 */
public enum SelectionReason {
    SINGLE_CUBE,
    MOST_DIMENSIONS,
    MOST_CONNECTED,
    ALPHABETICAL_FALLBACK;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
