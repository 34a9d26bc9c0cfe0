package com.yscompiler.construct;

import com.yscompiler.ast.Forms;
import com.yscompiler.ast.Group;
import com.yscompiler.ast.Leaf;
import com.yscompiler.ast.Lst;
import com.yscompiler.ast.Map;
import com.yscompiler.ast.Node;
import com.yscompiler.ast.Nil;
import com.yscompiler.ast.Pairs;
import com.yscompiler.ast.RawLst;
import com.yscompiler.ast.RawNode;
import com.yscompiler.ast.Str;
import com.yscompiler.ast.Sym;
import com.yscompiler.ast.Top;
import com.yscompiler.ast.Vec;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers the provisional tree produced by the YAMLScript parser into a
 * canonical Clojure AST.
 *
 * <p>Mappings become calls: {@code {println: "hi"}} is {@code (println "hi")}.
 * Leading {@code x =} entries of a mapping collapse into one {@code let}.
 * After lowering, two whole-program passes run: functions used before their
 * {@code defn} get a {@code declare}, and a program defining {@code main}
 * ends with {@code (apply main ARGV)}.</p>
 */
public final class Constructor {

    private static final Logger LOG = Logger.getLogger(Constructor.class);

    static final Sym ARROW = new Sym("=>");
    static final Sym LET = new Sym("let");
    static final Sym DO = new Sym("do");
    static final Sym NS = new Sym("ns");
    static final Sym DEFN = new Sym("defn");
    static final Sym DECLARE = new Sym("declare");
    static final Sym MAIN = new Sym("main");

    static final Lst CALL_MAIN = new Lst(new Sym("apply"), MAIN, new Sym("ARGV"));

    private Constructor() {
        // Utility class
    }

    /**
     * Lowers a whole document.
     *
     * @param root the parser's provisional tree
     * @return the program; a single resulting form is wrapped into a one-form program
     */
    public static Top construct(RawNode root) {
        Built built = constructNode(root, Context.ROOT);
        Top top = new Top(built.nodes());
        top = declareForwardReferences(top);
        top = callMain(top);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Constructed " + top.forms().size() + " top-level forms");
        }
        return top;
    }

    static Built constructNode(RawNode node, Context ctx) {
        if (ctx == null) {
            throw new ConstructException("Traversal context missing while lowering " + node);
        }
        Context inner = ctx.descend();
        if (node instanceof Pairs pairs) {
            return Built.many(constructPairs(entries(pairs), inner));
        } else if (node instanceof Forms forms) {
            return constructForms(forms, inner);
        } else if (node instanceof RawLst list) {
            return Built.one(new Lst(constructAll(list.children(), inner)));
        } else if (node instanceof Group group) {
            return Built.many(constructAll(group.members(), inner));
        } else if (node instanceof Leaf leaf) {
            return Built.one(leaf.node());
        }
        throw new ConstructException("Unexpected provisional node at level " + ctx.level() + ": " + node);
    }

    private static List<Node> constructAll(List<RawNode> nodes, Context ctx) {
        List<Node> result = new ArrayList<>();
        for (RawNode child : nodes) {
            result.addAll(constructNode(child, ctx).nodes());
        }
        return result;
    }

    private static Built constructForms(Forms forms, Context ctx) {
        List<Node> result = new ArrayList<>();
        for (RawNode child : forms.children()) {
            Built built = constructNode(child, ctx);
            if (built instanceof Built.One one && ARROW.equals(one.node())) {
                continue;
            }
            result.addAll(built.nodes());
        }
        return Built.many(result);
    }

    // ========== Mappings ==========

    private record Entry(RawNode key, RawNode value) {}

    private static List<Entry> entries(Pairs pairs) {
        List<Entry> entries = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            entries.add(new Entry(pairs.key(i), pairs.value(i)));
        }
        return entries;
    }

    private static List<Node> constructPairs(List<Entry> entries, Context ctx) {
        List<Node> forms = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            int end = i;
            while (end < entries.size() && isLetKey(entries.get(end).key())) {
                end++;
            }
            if (end > i) {
                forms.add(constructLet(entries.subList(i, end), entries.subList(end, entries.size()), ctx));
                break;
            }
            forms.addAll(constructCall(entries.get(i), ctx));
        }
        return forms;
    }

    /**
     * A key like {@code x =} arrives as the group {@code let x}.
     */
    private static boolean isLetKey(RawNode key) {
        return key instanceof Group group
            && !group.members().isEmpty()
            && group.members().get(0) instanceof Leaf first
            && LET.equals(first.node());
    }

    private static Lst constructLet(List<Entry> lets, List<Entry> body, Context ctx) {
        List<Node> bindings = new ArrayList<>();
        for (Entry entry : lets) {
            for (Node term : constructNode(entry.key(), ctx).nodes()) {
                if (!LET.equals(term)) {
                    bindings.add(term);
                }
            }
            bindings.add(bindingValue(entry.value(), ctx));
        }
        List<Node> call = new ArrayList<>();
        call.add(LET);
        call.add(new Vec(bindings));
        call.addAll(constructPairs(body, ctx));
        return new Lst(call);
    }

    private static Node bindingValue(RawNode value, Context ctx) {
        if (value == null) {
            return new Nil();
        }
        Built built = constructNode(value, ctx);
        if (built instanceof Built.One one) {
            return one.node();
        }
        List<Node> forms = built.nodes();
        if (forms.size() == 1) {
            return forms.get(0);
        }
        List<Node> block = new ArrayList<>();
        block.add(DO);
        block.addAll(forms);
        return new Lst(block);
    }

    private static List<Node> constructCall(Entry entry, Context ctx) {
        Built key = constructNode(entry.key(), ctx);
        Built value = entry.value() == null ? null : constructNode(entry.value(), ctx);

        if (key instanceof Built.One arrow && ARROW.equals(arrow.node())) {
            return value == null ? List.of() : value.nodes();
        }
        if (value == null && key instanceof Built.One str && str.node() instanceof Str) {
            return List.of(str.node());
        }
        List<Node> terms = new ArrayList<>(key.nodes());
        if (value != null) {
            terms.addAll(value.nodes());
        }
        return List.of(new Lst(terms));
    }

    // ========== Whole-program passes ==========

    static Optional<String> defnName(Node node) {
        if (node instanceof Lst lst
            && lst.isCallTo(DEFN.name())
            && lst.children().size() > 1
            && lst.children().get(1) instanceof Sym name) {
            return Optional.of(name.name());
        }
        return Optional.empty();
    }

    /**
     * Adds {@code (declare f g)} for every top-level function referenced
     * before its {@code defn}. It goes right after a leading {@code ns} form,
     * else first.
     */
    static Top declareForwardReferences(Top top) {
        Set<String> defnNames = new LinkedHashSet<>();
        for (Node form : top.forms()) {
            defnName(form).ifPresent(defnNames::add);
        }
        if (defnNames.isEmpty()) {
            return top;
        }

        Set<String> defined = new LinkedHashSet<>();
        Set<String> forward = new LinkedHashSet<>();
        for (Node form : top.forms()) {
            collectForwardReferences(form, defnNames, defined, forward);
        }
        if (forward.isEmpty()) {
            return top;
        }
        LOG.debug("Declaring forward references: " + forward);

        List<Node> declare = new ArrayList<>();
        declare.add(DECLARE);
        for (String name : forward) {
            declare.add(new Sym(name));
        }

        List<Node> forms = new ArrayList<>(top.forms());
        boolean hasNs = !forms.isEmpty()
            && forms.get(0) instanceof Lst first
            && first.isCallTo(NS.name());
        forms.add(hasNs ? 1 : 0, new Lst(declare));
        return new Top(forms);
    }

    /**
     * Pre-order walk. A {@code defn} marks its name defined before its body is
     * visited, so self-recursion needs no declaration.
     */
    private static void collectForwardReferences(
        Node node,
        Set<String> defnNames,
        Set<String> defined,
        Set<String> forward
    ) {
        if (node instanceof Lst lst) {
            defnName(lst).ifPresent(defined::add);
            for (Node child : lst.children()) {
                collectForwardReferences(child, defnNames, defined, forward);
            }
        } else if (node instanceof Vec vec) {
            for (Node child : vec.children()) {
                collectForwardReferences(child, defnNames, defined, forward);
            }
        } else if (node instanceof Map map) {
            for (Node child : map.children()) {
                collectForwardReferences(child, defnNames, defined, forward);
            }
        } else if (node instanceof Sym sym
            && defnNames.contains(sym.name())
            && !defined.contains(sym.name())) {
            forward.add(sym.name());
        }
    }

    static Top callMain(Top top) {
        boolean hasMain = top.forms().stream()
            .map(Constructor::defnName)
            .anyMatch(name -> name.isPresent() && name.get().equals(MAIN.name()));
        if (!hasMain) {
            return top;
        }
        LOG.debug("Program defines main; appending entry point call");
        List<Node> forms = new ArrayList<>(top.forms());
        forms.add(CALL_MAIN);
        return new Top(forms);
    }
}
