package com.yscompiler;

import com.yscompiler.ast.RawNode;
import com.yscompiler.ast.Top;
import com.yscompiler.construct.Constructor;
import com.yscompiler.print.Printer;
import org.apache.log4j.Logger;

import java.util.Objects;

/**
 * Turns a provisional YAMLScript tree into Clojure source.
 *
 * <pre>{@code
 * String code = new Compiler().compile(parsedDocument);
 * }</pre>
 */
public class Compiler {

    private static final Logger LOG = Logger.getLogger(Compiler.class);

    private final Printer printer;

    public Compiler() {
        this(new Printer());
    }

    public Compiler(Printer printer) {
        this.printer = Objects.requireNonNull(printer, "printer");
    }

    /**
     * Lowers the tree without printing it.
     *
     * @throws CompileException if lowering fails
     */
    public Top construct(RawNode document) {
        long start = System.nanoTime();
        Top top = Constructor.construct(document);
        if (LOG.isDebugEnabled()) {
            LOG.debug(String.format("Constructed %d forms in %.2f ms",
                top.forms().size(), (System.nanoTime() - start) / 1_000_000.0));
        }
        return top;
    }

    /**
     * @throws CompileException if lowering or printing fails
     */
    public String compile(RawNode document) {
        return printer.print(construct(document));
    }

    public Printer getPrinter() {
        return printer;
    }
}
