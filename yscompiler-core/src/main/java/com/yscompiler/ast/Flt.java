package com.yscompiler.ast;

import java.util.Objects;

public record Flt(String text) implements Node {
    public Flt {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String type() {
        return "Flt";
    }
}
