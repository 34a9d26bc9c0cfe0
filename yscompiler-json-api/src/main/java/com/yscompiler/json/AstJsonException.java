package com.yscompiler.json;

/**
 * Exception thrown when an AST cannot be written as JSON or read back from it.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
