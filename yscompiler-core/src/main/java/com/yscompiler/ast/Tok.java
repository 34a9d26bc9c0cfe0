package com.yscompiler.ast;

import java.util.Objects;

public record Tok(String text) implements Node {
    public Tok {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String type() {
        return "Tok";
    }
}
