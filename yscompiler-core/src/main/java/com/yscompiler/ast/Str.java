package com.yscompiler.ast;

import java.util.Objects;

public record Str(String text) implements Node {
    public Str {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String type() {
        return "Str";
    }
}
