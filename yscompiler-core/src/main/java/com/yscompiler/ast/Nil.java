package com.yscompiler.ast;

public record Nil() implements Node {
    @Override
    public String type() {
        return "Nil";
    }
}
