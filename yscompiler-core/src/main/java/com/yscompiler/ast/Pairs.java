package com.yscompiler.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A YAML mapping as parsed: keys and values alternate.
 *
 * <p>A value may be {@code null} when the mapping entry has no value. Keys are
 * never null.</p>
 */
public record Pairs(List<RawNode> nodes) implements RawNode {
    public Pairs {
        if (nodes.size() % 2 != 0) {
            throw new IllegalArgumentException(
                "Pairs needs alternating keys and values, got " + nodes.size() + " nodes");
        }
        for (int i = 0; i < nodes.size(); i += 2) {
            Objects.requireNonNull(nodes.get(i), "key " + i / 2);
        }
        nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    public Pairs(RawNode... nodes) {
        this(Arrays.asList(nodes));
    }

    public int size() {
        return nodes.size() / 2;
    }

    public RawNode key(int index) {
        return nodes.get(index * 2);
    }

    public RawNode value(int index) {
        return nodes.get(index * 2 + 1);
    }

    @Override
    public String type() {
        return "Pairs";
    }
}
