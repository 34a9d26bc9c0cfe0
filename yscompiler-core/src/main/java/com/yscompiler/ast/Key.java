package com.yscompiler.ast;

import java.util.Objects;

public record Key(String text) implements Node {
    public Key {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String type() {
        return "Key";
    }
}
