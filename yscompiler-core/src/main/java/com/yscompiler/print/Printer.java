package com.yscompiler.print;

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
import com.yscompiler.ast.Spc;
import com.yscompiler.ast.Str;
import com.yscompiler.ast.Sym;
import com.yscompiler.ast.Tok;
import com.yscompiler.ast.Top;
import com.yscompiler.ast.Vec;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders a canonical AST as Clojure source text.
 */
public final class Printer {

    private static final Logger LOG = Logger.getLogger(Printer.class);

    private final CodeFormatter formatter;
    private final FormatOptions options;

    public Printer() {
        this(CodeFormatter.discover(), FormatOptions.DEFAULT);
    }

    public Printer(CodeFormatter formatter, FormatOptions options) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.options = Objects.requireNonNull(options, "options");
    }

    public FormatOptions getOptions() {
        return options;
    }

    /**
     * Prints each top-level form on its own line and passes the result through
     * the formatter.
     */
    public String print(Top top) {
        String code = top.forms().stream()
            .map(Printer::printNode)
            .collect(Collectors.joining("\n"));
        if (LOG.isTraceEnabled()) {
            LOG.trace("Unformatted code:\n" + code);
        }
        return formatter.format(code, options);
    }

    public static String printNode(Node node) {
        if (node instanceof Empty) {
            return "";
        } else if (node instanceof Lst lst) {
            return "(" + printAll(lst.children(), " ") + ")";
        } else if (node instanceof Vec vec) {
            return "[" + printAll(vec.children(), " ") + "]";
        } else if (node instanceof Map map) {
            return "{" + String.join(", ", printEntries(map.children())) + "}";
        } else if (node instanceof Str str) {
            return "\"" + escape(str.text()) + "\"";
        } else if (node instanceof Chr chr) {
            return "\\" + chr.text();
        } else if (node instanceof Spc spc) {
            return spc.text().replace("::", ".");
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
        } else if (node instanceof Bln bln) {
            return String.valueOf(bln.value());
        } else if (node instanceof Nil) {
            return "nil";
        }
        throw new UnknownNodeException(node);
    }

    private static String printAll(List<Node> nodes, String separator) {
        return nodes.stream()
            .map(Printer::printNode)
            .collect(Collectors.joining(separator));
    }

    private static List<String> printEntries(List<Node> children) {
        List<String> entries = new ArrayList<>(children.size() / 2);
        for (int i = 0; i + 1 < children.size(); i += 2) {
            entries.add(printNode(children.get(i)) + " " + printNode(children.get(i + 1)));
        }
        return entries;
    }

    /**
     * Escapes backslash, double quote and newline. Every other character,
     * tabs and non-ASCII included, is kept as is.
     */
    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
