package com.yscompiler.ast;

import java.util.Objects;

public record Spc(String text) implements Node {
    public Spc {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String type() {
        return "Spc";
    }
}
