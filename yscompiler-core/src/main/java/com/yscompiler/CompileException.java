package com.yscompiler;

/**
 * Base class for every error raised while compiling a document.
 */
public class CompileException extends RuntimeException {

    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
