package com.yscompiler.construct;

/**
 * Traversal state passed down while lowering the provisional tree.
 *
 * @param level nesting depth of the node being lowered; the root is 0
 */
public record Context(int level) {

    public static final Context ROOT = new Context(0);

    public Context {
        if (level < 0) {
            throw new ConstructException("Traversal context has negative level " + level);
        }
    }

    Context descend() {
        return new Context(level + 1);
    }
}
