package com.yscompiler.ast;

import java.util.List;

/**
 * An implicit statement block.
 */
public record Forms(List<RawNode> children) implements RawNode {
    public Forms {
        children = List.copyOf(children);
    }

    public Forms(RawNode... children) {
        this(List.of(children));
    }

    @Override
    public String type() {
        return "Forms";
    }
}
