package com.yscompiler.tool;

import com.yscompiler.Compiler;
import com.yscompiler.ast.RawNode;
import com.yscompiler.json.AstJsonProvider;
import com.yscompiler.print.CodeFormatter;
import com.yscompiler.print.FormatOptions;
import com.yscompiler.print.Printer;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Compiles each {@code programs/<name>.ys.json} parser dump and compares it with {@code programs/<name>.clj}.
 */
public class ProgramsTest {

    private final Compiler compiler = new Compiler(new Printer(CodeFormatter.IDENTITY, FormatOptions.DEFAULT));

    private static String resource(String path) throws IOException {
        try (InputStream in = ProgramsTest.class.getResourceAsStream(path)) {
            assertNotNull(in, "Missing test resource " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"hello", "script"})
    void testProgram(String name) throws IOException {
        RawNode document = AstJsonProvider.getProvider().getDeserializer()
            .deserializeRaw(resource("/programs/" + name + ".ys.json"));
        assertEquals(resource("/programs/" + name + ".clj").strip(), compiler.compile(document));
    }
}
