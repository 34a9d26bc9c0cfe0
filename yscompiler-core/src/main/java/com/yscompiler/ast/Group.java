package com.yscompiler.ast;

import java.util.List;

/**
 * Several nodes standing in one key or value position of a mapping, such as
 * {@code defn foo [x]}. They are spliced into the enclosing call.
 */
public record Group(List<RawNode> members) implements RawNode {
    public Group {
        members = List.copyOf(members);
    }

    public Group(RawNode... members) {
        this(List.of(members));
    }

    @Override
    public String type() {
        return "Group";
    }
}
