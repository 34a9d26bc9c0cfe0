package com.yscompiler.construct;

import com.yscompiler.ast.Node;

import java.util.List;

/**
 * Result of lowering one provisional node: either a single node, or a run of
 * nodes that the parent splices into its own children.
 */
sealed interface Built {

    List<Node> nodes();

    static Built one(Node node) {
        return new One(node);
    }

    static Built many(List<Node> nodes) {
        return new Many(nodes);
    }

    record One(Node node) implements Built {
        @Override
        public List<Node> nodes() {
            return List.of(node);
        }
    }

    record Many(List<Node> nodes) implements Built {
        public Many {
            nodes = List.copyOf(nodes);
        }
    }
}
