package org.carball.cubeql.exception;

import lombok.Getter;

/**
 * Base type for every error raised while loading a schema or compiling a query.
 * The error code is stable and meant for machines; the message is meant for people.
 */
@Getter
public class CompilationException extends RuntimeException {

    private final String errorCode;

    public CompilationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CompilationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
