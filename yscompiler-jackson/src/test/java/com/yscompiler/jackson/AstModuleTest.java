package com.yscompiler.jackson;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yscompiler.ast.Bln;
import com.yscompiler.ast.Empty;
import com.yscompiler.ast.Forms;
import com.yscompiler.ast.Group;
import com.yscompiler.ast.Int;
import com.yscompiler.ast.Key;
import com.yscompiler.ast.Lst;
import com.yscompiler.ast.Map;
import com.yscompiler.ast.Nil;
import com.yscompiler.ast.Node;
import com.yscompiler.ast.Pairs;
import com.yscompiler.ast.RawLst;
import com.yscompiler.ast.RawNode;
import com.yscompiler.ast.Str;
import com.yscompiler.ast.Sym;
import com.yscompiler.ast.Top;
import com.yscompiler.ast.Vec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AstModuleTest {

    private final ObjectMapper mapper = YsJackson.createObjectMapper();

    @Test
    @DisplayName("Canonical nodes are written as single-field tag objects")
    void testSerializeNodes() throws Exception {
        Node call = new Lst(new Sym("inc"), new Int("1"), new Str("a\"b"), new Bln(false), new Nil());
        assertEquals(
            "{\"Lst\":[{\"Sym\":\"inc\"},{\"Int\":\"1\"},{\"Str\":\"a\\\"b\"},{\"Bln\":false},\"Nil\"]}",
            mapper.writerFor(Node.class).writeValueAsString(call));
    }

    @Test
    void testSerializeTop() throws Exception {
        Top top = new Top(new Vec(new Key(":a")), new Map(new Key(":k"), new Empty()));
        assertEquals(
            "{\"Top\":[{\"Vec\":[{\"Key\":\":a\"}]},{\"Map\":[{\"Key\":\":k\"},\"Empty\"]}]}",
            mapper.writeValueAsString(top));
    }

    @Test
    void testReadCanonicalNode() throws Exception {
        Node node = mapper.readValue(
            "{\"Lst\": [{\"Sym\": \"+\"}, {\"Int\": 2}, \"Nil\", {\"Bln\": true}]}", Node.class);
        assertEquals(new Lst(new Sym("+"), new Int("2"), new Nil(), new Bln(true)), node);
    }

    @Test
    void testWrittenTopReadsBack() throws Exception {
        Top top = new Top(
            new Lst(new Sym("ns"), new Sym("demo")),
            new Lst(new Sym("println"), new Str("line\nbreak"), new Map(new Key(":x"), new Int("1"))));
        assertEquals(top, mapper.readValue(mapper.writeValueAsString(top), Top.class));
    }

    @Test
    @DisplayName("Parser output keeps Pairs, Forms, groups and missing values")
    void testReadRawTree() throws Exception {
        String json = """
            {"Forms": [
              {"Lst": [{"Sym": "ns"}, {"Sym": "demo"}]},
              {"Pairs": [
                [{"Sym": "let"}, {"Sym": "x"}], {"Int": "1"},
                {"Sym": "newline"}, null
              ]}
            ]}
            """;
        RawNode expected = new Forms(
            new RawLst(RawNode.of(new Sym("ns")), RawNode.of(new Sym("demo"))),
            new Pairs(
                RawNode.group(new Sym("let"), new Sym("x")), RawNode.of(new Int("1")),
                RawNode.of(new Sym("newline")), null));
        assertEquals(expected, mapper.readValue(json, RawNode.class));
    }

    @Test
    void testEmptyArrayIsEmptyGroup() throws Exception {
        assertEquals(new Group(), mapper.readValue("[]", RawNode.class));
    }

    @Test
    void testProvisionalNodeRejectedInCanonicalTree() {
        JsonMappingException e = assertThrows(JsonMappingException.class,
            () -> mapper.readValue("{\"Lst\": [{\"Pairs\": []}]}", Node.class));
        assertTrue(e.getMessage().contains("Pairs"));
    }

    @Test
    void testUnknownTagRejected() {
        JsonMappingException e = assertThrows(JsonMappingException.class,
            () -> mapper.readValue("{\"Set\": []}", Node.class));
        assertTrue(e.getMessage().contains("Unknown node tag 'Set'"));
    }

    @Test
    void testMalformedShapesRejected() {
        assertThrows(JsonMappingException.class,
            () -> mapper.readValue("{\"Sym\": \"a\", \"Int\": \"1\"}", Node.class));
        assertThrows(JsonMappingException.class,
            () -> mapper.readValue("{\"Map\": [{\"Key\": \":odd\"}]}", Node.class));
        assertThrows(JsonMappingException.class,
            () -> mapper.readValue("{\"Bln\": \"yes\"}", Node.class));
        assertThrows(JsonMappingException.class,
            () -> mapper.readValue("{\"Vec\": {\"Sym\": \"a\"}}", Node.class));
    }

    @Test
    void testNullOnlyAllowedAsMappingValue() {
        assertThrows(JsonMappingException.class,
            () -> mapper.readValue("{\"Pairs\": [null, {\"Int\": \"1\"}]}", RawNode.class));
        assertThrows(JsonMappingException.class,
            () -> mapper.readValue("{\"Forms\": [null]}", RawNode.class));
        assertThrows(JsonMappingException.class,
            () -> mapper.readValue("{\"Pairs\": [{\"Sym\": \"a\"}]}", RawNode.class));
    }

    @Test
    void testTopRequiresTopTag() {
        assertThrows(JsonMappingException.class,
            () -> mapper.readValue("{\"Lst\": []}", Top.class));
    }
}
