package com.yscompiler.ast;

import java.util.Arrays;

/**
 * A node of the provisional tree handed over by the parser.
 *
 * <p>{@link Pairs} and {@link Forms} only exist here; the constructor lowers
 * them into canonical {@link Node}s. Canonical nodes that need no lowering
 * travel inside a {@link Leaf}.</p>
 */
public sealed interface RawNode permits Pairs, Forms, RawLst, Group, Leaf {

    String type();

    static Leaf of(Node node) {
        return new Leaf(node);
    }

    static Group group(Node... nodes) {
        return new Group(Arrays.stream(nodes).<RawNode>map(RawNode::of).toList());
    }
}
