package org.carball.cubeql.exception;

import lombok.Getter;

@Getter
public class InvalidFilterException extends CompilationException {

    private final String member;
    private final String operator;

    public InvalidFilterException(String member, String operator, String message) {
        super("invalid_filter", message);
        this.member = member;
        this.operator = operator;
    }
}
