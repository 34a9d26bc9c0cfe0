package com.yscompiler.ast;

import java.util.Objects;

public record Sym(String name) implements Node {
    public Sym {
        Objects.requireNonNull(name, "name");
    }

    public boolean is(String other) {
        return name.equals(other);
    }

    @Override
    public String type() {
        return "Sym";
    }
}
