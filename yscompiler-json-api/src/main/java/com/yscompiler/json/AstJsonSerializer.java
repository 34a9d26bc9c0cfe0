package com.yscompiler.json;

import com.yscompiler.ast.Node;
import com.yscompiler.ast.Top;

/**
 * Interface for serializing canonical AST nodes to tagged JSON, e.g.
 * {@code {"Lst":[{"Sym":"inc"},{"Int":"1"}]}}.
 */
public interface AstJsonSerializer {

    /**
     * Serializes an AST node to a JSON string.
     *
     * @param node the AST node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a whole program as {@code {"Top":[...]}}.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(Top top) throws AstJsonException;

    /**
     * Serializes a whole program to a pretty-printed JSON string.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Top top) throws AstJsonException;
}
