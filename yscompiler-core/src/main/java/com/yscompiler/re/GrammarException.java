package com.yscompiler.re;

import com.yscompiler.CompileException;

/**
 * A pattern definition is broken: it references an undefined pattern, is
 * defined twice, or does not compile. This is a defect in the grammar itself.
 */
public class GrammarException extends CompileException {

    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
