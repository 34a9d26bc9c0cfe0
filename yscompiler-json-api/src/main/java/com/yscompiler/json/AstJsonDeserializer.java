package com.yscompiler.json;

import com.yscompiler.ast.Node;
import com.yscompiler.ast.RawNode;
import com.yscompiler.ast.Top;

/**
 * Interface for reading AST nodes from tagged JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a provisional tree as produced by the YAMLScript parser.
     * {@code Pairs} and {@code Forms} are allowed here, a JSON array is a
     * {@link com.yscompiler.ast.Group} and {@code null} is a missing mapping value.
     *
     * @param json the JSON string to deserialize
     * @return the provisional tree
     * @throws AstJsonException if deserialization fails
     */
    RawNode deserializeRaw(String json) throws AstJsonException;

    /**
     * Deserializes a canonical node.
     *
     * @param json the JSON string to deserialize
     * @return the node
     * @throws AstJsonException if deserialization fails or the JSON holds a provisional node
     */
    Node deserialize(String json) throws AstJsonException;

    /**
     * Deserializes a {@code {"Top":[...]}} program.
     *
     * @throws AstJsonException if deserialization fails
     */
    Top deserializeTop(String json) throws AstJsonException;
}
