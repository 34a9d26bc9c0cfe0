package com.yscompiler.print;

import com.yscompiler.CompileException;

public class UnknownNodeException extends CompileException {

    private final transient Object node;

    public UnknownNodeException(Object node) {
        super("Unknown AST node type: " + node);
        this.node = node;
    }

    public Object getNode() {
        return node;
    }
}
