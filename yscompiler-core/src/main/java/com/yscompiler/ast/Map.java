package com.yscompiler.ast;

import java.util.List;

/**
 * A map literal. Children alternate key, value.
 */
public record Map(List<Node> children) implements Node {
    public Map {
        children = List.copyOf(children);
        if (children.size() % 2 != 0) {
            throw new IllegalArgumentException(
                "Map needs an even number of children, got " + children.size());
        }
    }

    public Map(Node... children) {
        this(List.of(children));
    }

    @Override
    public String type() {
        return "Map";
    }
}
