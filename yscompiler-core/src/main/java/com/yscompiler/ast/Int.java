package com.yscompiler.ast;

import java.util.Objects;

public record Int(String text) implements Node {
    public Int {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String type() {
        return "Int";
    }
}
