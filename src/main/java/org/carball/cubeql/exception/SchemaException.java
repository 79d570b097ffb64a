package org.carball.cubeql.exception;

import lombok.Getter;

import java.util.List;

/**
 * Malformed cube or relationship definitions. Carries every problem found, not just the first.
 */
@Getter
public class SchemaException extends CompilationException {

    private final List<String> problems;

    public SchemaException(String message) {
        this(List.of(message));
    }

    public SchemaException(List<String> problems) {
        super("schema_error", "Invalid schema: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
