package com.yscompiler.jackson;

import com.yscompiler.Compiler;
import com.yscompiler.ast.Int;
import com.yscompiler.ast.Lst;
import com.yscompiler.ast.Pairs;
import com.yscompiler.ast.RawNode;
import com.yscompiler.ast.Sym;
import com.yscompiler.ast.Top;
import com.yscompiler.json.AstJsonException;
import com.yscompiler.json.AstJsonProvider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    @Test
    void testRegisteredAsService() {
        AstJsonProvider provider = AstJsonProvider.getProvider();
        assertInstanceOf(JacksonAstJsonProvider.class, provider);
        assertEquals("Jackson", provider.getName());
    }

    @Test
    void testConstructedProgramSerializes() {
        AstJsonProvider provider = new JacksonAstJsonProvider();
        RawNode document = provider.getDeserializer().deserializeRaw(
            "{\"Pairs\": [{\"Sym\": \"inc\"}, {\"Int\": \"41\"}]}");
        assertEquals(new Pairs(RawNode.of(new Sym("inc")), RawNode.of(new Int("41"))), document);

        Top top = new Compiler().construct(document);
        assertEquals("{\"Top\":[{\"Lst\":[{\"Sym\":\"inc\"},{\"Int\":\"41\"}]}]}",
            provider.getSerializer().serialize(top));
        assertEquals("{\"Sym\":\"inc\"}", provider.getSerializer().serialize(new Sym("inc")));
    }

    @Test
    void testPrettyOutputReadsBack() {
        AstJsonProvider provider = new JacksonAstJsonProvider();
        Top top = new Top(new Lst(new Sym("inc"), new Int("1")));
        String pretty = provider.getSerializer().serializePretty(top);
        assertTrue(pretty.contains("\n"));
        assertEquals(top, provider.getDeserializer().deserializeTop(pretty));
    }

    @Test
    void testFailuresAreWrapped() {
        AstJsonProvider provider = new JacksonAstJsonProvider();
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeRaw("{\"Pairs\": "));
        assertNotNull(e.getCause());
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeRaw("null"));
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserialize("{\"Forms\": []}"));
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeTop("null"));
    }
}
