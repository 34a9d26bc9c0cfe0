package com.yscompiler.ast;

import java.util.Objects;

public record Leaf(Node node) implements RawNode {
    public Leaf {
        Objects.requireNonNull(node, "node");
    }

    @Override
    public String type() {
        return node.type();
    }
}
