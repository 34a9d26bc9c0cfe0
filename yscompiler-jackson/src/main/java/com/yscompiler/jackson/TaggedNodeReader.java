package com.yscompiler.jackson;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.yscompiler.ast.Bln;
import com.yscompiler.ast.Chr;
import com.yscompiler.ast.Empty;
import com.yscompiler.ast.Flt;
import com.yscompiler.ast.Forms;
import com.yscompiler.ast.Group;
import com.yscompiler.ast.Int;
import com.yscompiler.ast.Key;
import com.yscompiler.ast.Leaf;
import com.yscompiler.ast.Lst;
import com.yscompiler.ast.Map;
import com.yscompiler.ast.Nil;
import com.yscompiler.ast.Node;
import com.yscompiler.ast.Pairs;
import com.yscompiler.ast.RawLst;
import com.yscompiler.ast.RawNode;
import com.yscompiler.ast.Spc;
import com.yscompiler.ast.Str;
import com.yscompiler.ast.Sym;
import com.yscompiler.ast.Tok;
import com.yscompiler.ast.Top;
import com.yscompiler.ast.Vec;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts tagged JSON trees into AST nodes.
 *
 * <p>A node is either a bare tag string ({@code "Nil"}), which stands for
 * {@code {"Nil": true}}, or an object with exactly one field, the tag, whose
 * value is the payload. Problems are reported through the
 * {@link DeserializationContext} so they surface as Jackson mapping errors.</p>
 */
final class TaggedNodeReader {

    private final DeserializationContext ctxt;

    TaggedNodeReader(DeserializationContext ctxt) {
        this.ctxt = ctxt;
    }

    private record Tagged(String tag, JsonNode payload) {}

    private Tagged tagged(JsonNode json, Class<?> target) throws JsonMappingException {
        if (json.isTextual()) {
            return new Tagged(json.textValue(), BooleanNode.TRUE);
        }
        if (json.isObject() && json.size() == 1) {
            String tag = json.fieldNames().next();
            return new Tagged(tag, json.get(tag));
        }
        return ctxt.reportInputMismatch(target,
            "Expected a tag name or an object with a single tag field, got: %s", json);
    }

    // ==================== Canonical nodes ====================

    Node node(JsonNode json) throws JsonMappingException {
        Tagged tagged = tagged(json, Node.class);
        JsonNode payload = tagged.payload();
        return switch (tagged.tag()) {
            case "Empty" -> new Empty();
            case "Nil" -> new Nil();
            case "Lst" -> new Lst(nodes(payload, "Lst"));
            case "Vec" -> new Vec(nodes(payload, "Vec"));
            case "Map" -> map(nodes(payload, "Map"));
            case "Bln" -> new Bln(bool(payload));
            case "Str" -> new Str(text(payload, "Str"));
            case "Chr" -> new Chr(text(payload, "Chr"));
            case "Spc" -> new Spc(text(payload, "Spc"));
            case "Sym" -> new Sym(text(payload, "Sym"));
            case "Tok" -> new Tok(text(payload, "Tok"));
            case "Key" -> new Key(text(payload, "Key"));
            case "Int" -> new Int(text(payload, "Int"));
            case "Flt" -> new Flt(text(payload, "Flt"));
            case "Pairs", "Forms" -> ctxt.reportInputMismatch(Node.class,
                "Provisional node '%s' cannot appear in a canonical AST", tagged.tag());
            default -> ctxt.reportInputMismatch(Node.class, "Unknown node tag '%s'", tagged.tag());
        };
    }

    private List<Node> nodes(JsonNode payload, String tag) throws JsonMappingException {
        if (!payload.isArray()) {
            return ctxt.reportInputMismatch(Node.class, "'%s' payload must be an array, got: %s", tag, payload);
        }
        List<Node> nodes = new ArrayList<>(payload.size());
        for (JsonNode child : payload) {
            nodes.add(node(child));
        }
        return nodes;
    }

    private Map map(List<Node> children) throws JsonMappingException {
        if (children.size() % 2 != 0) {
            return ctxt.reportInputMismatch(Node.class,
                "'Map' payload needs alternating keys and values, got %d nodes", children.size());
        }
        return new Map(children);
    }

    private boolean bool(JsonNode payload) throws JsonMappingException {
        if (!payload.isBoolean()) {
            return ctxt.reportInputMismatch(Node.class, "'Bln' payload must be a boolean, got: %s", payload);
        }
        return payload.booleanValue();
    }

    // Numbers and booleans are accepted for convenience: {"Int": 42}
    private String text(JsonNode payload, String tag) throws JsonMappingException {
        if (payload.isTextual()) {
            return payload.textValue();
        }
        if (payload.isNumber() || payload.isBoolean()) {
            return payload.asText();
        }
        return ctxt.reportInputMismatch(Node.class, "'%s' payload must be text, got: %s", tag, payload);
    }

    // ==================== Provisional nodes ====================

    RawNode raw(JsonNode json) throws JsonMappingException {
        if (json == null || json.isNull()) {
            return ctxt.reportInputMismatch(RawNode.class, "null is only allowed as a mapping value");
        }
        if (json.isArray()) {
            return new Group(raws(json));
        }
        Tagged tagged = tagged(json, RawNode.class);
        JsonNode payload = tagged.payload();
        switch (tagged.tag()) {
            case "Pairs":
                return pairs(payload);
            case "Forms":
                return new Forms(raws(array(payload, "Forms")));
            case "Lst":
                return new RawLst(raws(array(payload, "Lst")));
            default:
                return new Leaf(node(json));
        }
    }

    private JsonNode array(JsonNode payload, String tag) throws JsonMappingException {
        if (!payload.isArray()) {
            return ctxt.reportInputMismatch(RawNode.class, "'%s' payload must be an array, got: %s", tag, payload);
        }
        return payload;
    }

    private List<RawNode> raws(JsonNode array) throws JsonMappingException {
        List<RawNode> nodes = new ArrayList<>(array.size());
        for (JsonNode child : array) {
            nodes.add(raw(child));
        }
        return nodes;
    }

    private Pairs pairs(JsonNode payload) throws JsonMappingException {
        array(payload, "Pairs");
        if (payload.size() % 2 != 0) {
            return ctxt.reportInputMismatch(RawNode.class,
                "'Pairs' payload needs alternating keys and values, got %d nodes", payload.size());
        }
        List<RawNode> nodes = new ArrayList<>(payload.size());
        for (int i = 0; i < payload.size(); i++) {
            JsonNode child = payload.get(i);
            boolean isValue = i % 2 == 1;
            nodes.add(isValue && child.isNull() ? null : raw(child));
        }
        return new Pairs(nodes);
    }

    // ==================== Program ====================

    Top top(JsonNode json) throws JsonMappingException {
        Tagged tagged = tagged(json, Top.class);
        if (!"Top".equals(tagged.tag()) || !tagged.payload().isArray()) {
            return ctxt.reportInputMismatch(Top.class, "Expected {\"Top\": [...]}, got: %s", json);
        }
        List<Node> forms = new ArrayList<>();
        for (JsonNode form : tagged.payload()) {
            forms.add(node(form));
        }
        return new Top(forms);
    }
}
