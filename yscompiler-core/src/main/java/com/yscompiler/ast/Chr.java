package com.yscompiler.ast;

import java.util.Objects;

public record Chr(String text) implements Node {
    public Chr {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String type() {
        return "Chr";
    }
}
