package org.carball.cubeql.exception;

/**
 * The database refused or failed an EXPLAIN request. Never affects a compiled query.
 */
public class ExplainException extends Exception {

    public ExplainException(String message) {
        super(message);
    }

    public ExplainException(String message, Throwable cause) {
        super(message, cause);
    }
}
