package com.yscompiler;

import com.yscompiler.ast.Forms;
import com.yscompiler.ast.Group;
import com.yscompiler.ast.Int;
import com.yscompiler.ast.Pairs;
import com.yscompiler.ast.RawLst;
import com.yscompiler.ast.RawNode;
import com.yscompiler.ast.Str;
import com.yscompiler.ast.Sym;
import com.yscompiler.ast.Vec;
import com.yscompiler.print.CodeFormatter;
import com.yscompiler.print.FormatOptions;
import com.yscompiler.print.Printer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerTest {

    private final Compiler compiler = new Compiler(new Printer(CodeFormatter.IDENTITY, FormatOptions.DEFAULT));

    @Test
    void testCompileProgram() {
        // !yamlscript/v0
        // ns: hello
        // defn main(name):
        //   greeting =: "Hello, "
        //   say: greeting name
        // defn say(a b):
        //   println: str(a b)
        RawNode doc = new Forms(
            new RawLst(RawNode.of(new Sym("ns")), RawNode.of(new Sym("hello"))),
            new Pairs(
                new Group(RawNode.of(new Sym("defn")), RawNode.of(new Sym("main")),
                    RawNode.of(new Vec(new Sym("name")))),
                new Pairs(
                    new Group(RawNode.of(new Sym("let")), RawNode.of(new Sym("greeting"))),
                    RawNode.of(new Str("Hello, ")),
                    RawNode.of(new Sym("say")),
                    RawNode.group(new Sym("greeting"), new Sym("name")))),
            new Pairs(
                new Group(RawNode.of(new Sym("defn")), RawNode.of(new Sym("say")),
                    RawNode.of(new Vec(new Sym("a"), new Sym("b")))),
                new Pairs(
                    RawNode.of(new Sym("println")),
                    new RawLst(RawNode.of(new Sym("str")), RawNode.of(new Sym("a")), RawNode.of(new Sym("b"))))));

        String expected = String.join("\n",
            "(ns hello)",
            "(declare say)",
            "(defn main [name] (let [greeting \"Hello, \"] (say greeting name)))",
            "(defn say [a b] (println (str a b)))",
            "(apply main ARGV)");
        assertEquals(expected, compiler.compile(doc));
    }

    @Test
    void testCompileSingleExpression() {
        assertEquals("42", compiler.compile(RawNode.of(new Int("42"))));
    }

    @Test
    void testErrorsAreCompileExceptions() {
        assertThrows(CompileException.class,
            () -> com.yscompiler.re.Grammar.pattern("missing"));
    }
}
