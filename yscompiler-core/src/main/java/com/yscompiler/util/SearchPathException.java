package com.yscompiler.util;

import com.yscompiler.CompileException;

public class SearchPathException extends CompileException {

    public SearchPathException(String message) {
        super(message);
    }
}
