package com.yscompiler.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.yscompiler.ast.Node;
import com.yscompiler.ast.RawNode;
import com.yscompiler.ast.Top;
import com.yscompiler.json.AstJsonDeserializer;
import com.yscompiler.json.AstJsonException;
import com.yscompiler.json.AstJsonProvider;
import com.yscompiler.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(YsJackson.createObjectMapper());
    }

    JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        // Records are looked up by their declared interface so every node goes through AstModule
        private final ObjectWriter nodeWriter;
        private final ObjectWriter topWriter;

        JacksonSerializer(ObjectMapper mapper) {
            this.nodeWriter = mapper.writerFor(Node.class);
            this.topWriter = mapper.writerFor(Top.class);
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return nodeWriter.writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize AST node", e);
            }
        }

        @Override
        public String serialize(Top top) throws AstJsonException {
            try {
                return topWriter.writeValueAsString(top);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize program", e);
            }
        }

        @Override
        public String serializePretty(Top top) throws AstJsonException {
            try {
                return topWriter.withDefaultPrettyPrinter().writeValueAsString(top);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize program", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public RawNode deserializeRaw(String json) throws AstJsonException {
            RawNode node;
            try {
                node = mapper.readValue(json, RawNode.class);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize parser output", e);
            }
            // A bare JSON null never reaches the custom deserializer
            if (node == null) {
                throw new AstJsonException("Parser output must not be null");
            }
            return node;
        }

        @Override
        public Node deserialize(String json) throws AstJsonException {
            try {
                Node node = mapper.readValue(json, Node.class);
                if (node == null) {
                    throw new AstJsonException("AST node must not be null");
                }
                return node;
            } catch (AstJsonException e) {
                throw e;
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize AST node", e);
            }
        }

        @Override
        public Top deserializeTop(String json) throws AstJsonException {
            try {
                Top top = mapper.readValue(json, Top.class);
                if (top == null) {
                    throw new AstJsonException("Program must not be null");
                }
                return top;
            } catch (AstJsonException e) {
                throw e;
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize Top", e);
            }
        }
    }
}
