package com.yscompiler.construct;

import com.yscompiler.CompileException;

/**
 * Internal invariant of the constructor violated.
 */
public class ConstructException extends CompileException {

    public ConstructException(String message) {
        super(message);
    }
}
