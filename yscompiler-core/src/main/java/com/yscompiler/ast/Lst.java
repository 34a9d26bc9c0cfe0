package com.yscompiler.ast;

import java.util.List;

/**
 * A parenthesized list; in the target language this is a call form.
 */
public record Lst(List<Node> children) implements Node {
    public Lst {
        children = List.copyOf(children);
    }

    public Lst(Node... children) {
        this(List.of(children));
    }

    /**
     * Whether this is a call whose operator is the symbol {@code name}.
     */
    public boolean isCallTo(String name) {
        return !children.isEmpty()
            && children.get(0) instanceof Sym sym
            && sym.is(name);
    }

    @Override
    public String type() {
        return "Lst";
    }
}
