package com.yscompiler.ast;

public record Bln(boolean value) implements Node {
    @Override
    public String type() {
        return "Bln";
    }
}
