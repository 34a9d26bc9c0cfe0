package com.yscompiler.ast;

/**
 * Base interface for all canonical AST nodes.
 *
 * <p>The set of node types is closed. Provisional parser output ({@link RawNode})
 * is a separate hierarchy, so a {@code Node} tree can always be printed.</p>
 */
public sealed interface Node permits
    Empty,
    Lst,
    Vec,
    Map,
    Str,
    Chr,
    Spc,
    Sym,
    Tok,
    Key,
    Int,
    Flt,
    Bln,
    Nil {

    /**
     * The tag name of this node, e.g. {@code "Sym"}.
     */
    String type();
}
