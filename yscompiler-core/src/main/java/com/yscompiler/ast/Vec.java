package com.yscompiler.ast;

import java.util.List;

public record Vec(List<Node> children) implements Node {
    public Vec {
        children = List.copyOf(children);
    }

    public Vec(Node... children) {
        this(List.of(children));
    }

    @Override
    public String type() {
        return "Vec";
    }
}
