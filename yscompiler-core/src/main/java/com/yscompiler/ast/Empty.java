package com.yscompiler.ast;

public record Empty() implements Node {
    @Override
    public String type() {
        return "Empty";
    }
}
