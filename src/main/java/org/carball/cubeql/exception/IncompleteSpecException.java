package org.carball.cubeql.exception;

import lombok.Getter;

import java.util.List;

/**
 * A query, funnel, flow, retention or multi-query request is missing something it needs.
 */
@Getter
public class IncompleteSpecException extends CompilationException {

    private final List<String> problems;

    public IncompleteSpecException(String message) {
        this(List.of(message));
    }

    public IncompleteSpecException(List<String> problems) {
        super("incomplete_spec", String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
