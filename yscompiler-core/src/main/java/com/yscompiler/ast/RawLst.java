package com.yscompiler.ast;

import java.util.List;

/**
 * A list whose children have not been lowered yet.
 */
public record RawLst(List<RawNode> children) implements RawNode {
    public RawLst {
        children = List.copyOf(children);
    }

    public RawLst(RawNode... children) {
        this(List.of(children));
    }

    @Override
    public String type() {
        return "Lst";
    }
}
