package com.yscompiler.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = YsJackson.createObjectMapper();
 * RawNode document = mapper.readValue(json, RawNode.class);
 * String ast = mapper.writeValueAsString(new Compiler().construct(document));
 * </pre>
 */
public final class YsJackson {

    private YsJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper that reads and writes {@code Node},
     * {@code RawNode} and {@code Top} in the tagged notation.
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
