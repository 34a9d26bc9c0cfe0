package com.yscompiler.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.yscompiler.ast.Bln;
import com.yscompiler.ast.Chr;
import com.yscompiler.ast.Empty;
import com.yscompiler.ast.Flt;
import com.yscompiler.ast.Int;
import com.yscompiler.ast.Key;
import com.yscompiler.ast.Lst;
import com.yscompiler.ast.Map;
import com.yscompiler.ast.Nil;
import com.yscompiler.ast.Node;
import com.yscompiler.ast.RawNode;
import com.yscompiler.ast.Spc;
import com.yscompiler.ast.Str;
import com.yscompiler.ast.Sym;
import com.yscompiler.ast.Tok;
import com.yscompiler.ast.Top;
import com.yscompiler.ast.Vec;

import java.io.IOException;
import java.util.List;

/**
 * Jackson module that maps the AST to the tagged JSON notation.
 *
 * This module handles:
 * - Canonical nodes in both directions ({@code {"Sym":"inc"}}, {@code "Nil"})
 * - Programs as {@code {"Top":[...]}} in both directions
 * - Reading provisional parser output (Pairs, Forms, groups and missing values)
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, null, "com.yscompiler", "yscompiler-jackson"));

        NodeSerializer nodeSerializer = new NodeSerializer();
        addSerializer(Node.class, nodeSerializer);
        addSerializer(Top.class, new TopSerializer(nodeSerializer));

        addDeserializer(Node.class, new NodeDeserializer());
        addDeserializer(RawNode.class, new RawNodeDeserializer());
        addDeserializer(Top.class, new TopDeserializer());
    }

    // ==================== Serializers ====================

    static final class NodeSerializer extends StdSerializer<Node> {

        NodeSerializer() {
            super(Node.class);
        }

        @Override
        public void serialize(Node node, JsonGenerator gen, SerializerProvider provider) throws IOException {
            // Payload-less nodes use the bare tag shorthand
            if (node instanceof Nil || node instanceof Empty) {
                gen.writeString(node.type());
                return;
            }
            gen.writeStartObject();
            gen.writeFieldName(node.type());
            if (node instanceof Lst lst) {
                writeNodes(lst.children(), gen, provider);
            } else if (node instanceof Vec vec) {
                writeNodes(vec.children(), gen, provider);
            } else if (node instanceof Map map) {
                writeNodes(map.children(), gen, provider);
            } else if (node instanceof Bln bln) {
                gen.writeBoolean(bln.value());
            } else {
                gen.writeString(text(node));
            }
            gen.writeEndObject();
        }

        void writeNodes(List<Node> nodes, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartArray();
            for (Node child : nodes) {
                serialize(child, gen, provider);
            }
            gen.writeEndArray();
        }

        private static String text(Node node) {
            if (node instanceof Str str) {
                return str.text();
            } else if (node instanceof Chr chr) {
                return chr.text();
            } else if (node instanceof Spc spc) {
                return spc.text();
            } else if (node instanceof Sym sym) {
                return sym.name();
            } else if (node instanceof Tok tok) {
                return tok.text();
            } else if (node instanceof Key key) {
                return key.text();
            } else if (node instanceof Int integer) {
                return integer.text();
            } else if (node instanceof Flt flt) {
                return flt.text();
            }
            throw new IllegalStateException("No text payload for node type " + node.type());
        }
    }

    static final class TopSerializer extends StdSerializer<Top> {

        private final NodeSerializer nodeSerializer;

        TopSerializer(NodeSerializer nodeSerializer) {
            super(Top.class);
            this.nodeSerializer = nodeSerializer;
        }

        @Override
        public void serialize(Top top, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeFieldName(top.type());
            nodeSerializer.writeNodes(top.forms(), gen, provider);
            gen.writeEndObject();
        }
    }

    // ==================== Deserializers ====================

    static final class NodeDeserializer extends StdDeserializer<Node> {

        NodeDeserializer() {
            super(Node.class);
        }

        @Override
        public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return new TaggedNodeReader(ctxt).node(ctxt.readTree(p));
        }
    }

    static final class RawNodeDeserializer extends StdDeserializer<RawNode> {

        RawNodeDeserializer() {
            super(RawNode.class);
        }

        @Override
        public RawNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return new TaggedNodeReader(ctxt).raw(ctxt.readTree(p));
        }
    }

    static final class TopDeserializer extends StdDeserializer<Top> {

        TopDeserializer() {
            super(Top.class);
        }

        @Override
        public Top deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return new TaggedNodeReader(ctxt).top(ctxt.readTree(p));
        }
    }
}
