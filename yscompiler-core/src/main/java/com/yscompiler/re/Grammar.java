package com.yscompiler.re;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The lexical grammar of YAMLScript expressions as named patterns.
 *
 * <p>Tokenizers address the patterns by name, e.g. {@code Grammar.pattern("psym")}
 * detects a call site and {@code Grammar.pattern("xnum")} a numeric literal.
 * The table is built once when the class loads and never changes.</p>
 */
public final class Grammar {

    /**
     * Deepest parenthesis nesting that {@code bpar} recognizes. Deeper text
     * simply does not match.
     */
    public static final int MAX_PAREN_DEPTH = 6;

    private static final PatternLibrary LIBRARY = build();

    private static final Pattern DEFK = LIBRARY.pattern("defk");
    private static final Pattern DFNK = LIBRARY.pattern("dfnk");

    private Grammar() {
        // Utility class
    }

    private static PatternLibrary build() {
        PatternLibrary re = new PatternLibrary();

        re.define("char", "\\\\(?:newline|space|tab|formfeed|backspace|return|.)");
        re.define("comm", ";.*(?:\\n|\\z)");
        re.define("ignr", "(?:|#!.*\\n?|[\\s,]+|;.*\\n?)");

        re.define("inum", "-?\\d+");
        re.define("fnum", "$inum\\.\\d*(?:e$inum)?");
        re.define("xnum", "(?:$fnum|$inum)");

        re.define("xsym", "(?:=~)");
        re.define("osym", "(?:[-+*/%<=>~|&.]{1,3})");
        re.define("anon", "(?:\\\\\\()");
        re.define("narg", "(?:%\\d+)");

        re.define("regx", "/(?=\\S)(?:\\\\.|[^\\\\/\\n])+/");
        re.define("dstr", "\"(?:\\\\.|[^\\\\\"])*\"");
        re.define("sstr", "'(?:''|[^'])*'");

        re.define("pnum", "(?:\\d+)");
        re.define("anum", "[a-zA-Z0-9]");
        re.define("symw", "(?:$anum+(?:-$anum+)*)");
        re.define("pkey", "(?:$symw|$pnum|$dstr|$sstr)");
        re.define("path", "(?:$symw(?:\\.$pkey)+)");
        re.define("keyw", "(?::$symw)");

        re.define("csym", "(?:[-a-zA-Z0-9_*+?!<=>]+(?:\\.(?= ))?)");
        re.define("ysym", "(?:$symw[?!.]?)");
        re.define("dsym", "(?:$symw=)");
        re.define("nspc", "(?:$symw(?:::$symw)+)");
        re.define("fsym", "(?:(?:$nspc|$symw)/$ysym)");
        re.define("psym", "(?:(?:$fsym|$ysym)\\()");
        re.define("esym", "(?:\\*$symw\\*)");

        re.define("defk", "^($symw) +=$");
        re.define("dfnk", "^defn ($ysym)(?:\\((.*)\\))?$");

        re.define("bpar", balancedParens(MAX_PAREN_DEPTH));

        return re;
    }

    // \( [^)(]* (?: <one level less> [^)(]* )* \)
    static String balancedParens(int depth) {
        String inner = "\\([^)(]*\\)";
        for (int level = 2; level <= depth; level++) {
            inner = "\\([^)(]*(?:" + inner + "[^)(]*)*\\)";
        }
        return "(?:" + inner + ")";
    }

    /**
     * @throws GrammarException if no pattern has this name
     */
    public static Pattern pattern(String name) {
        return LIBRARY.pattern(name);
    }

    public static String definition(String name) {
        return LIBRARY.definition(name);
    }

    /**
     * All pattern names, in the order they are defined.
     */
    public static List<String> names() {
        return LIBRARY.names();
    }

    /**
     * Expands an ad hoc template against the grammar, e.g. {@code "^$ysym: "}.
     */
    public static Pattern expand(String template) {
        return LIBRARY.expand(template);
    }

    /**
     * Recognizes a {@code name =} mapping key, which binds a value with
     * {@code def} (top level) or {@code let} (inside a body).
     *
     * @return the bound name
     */
    public static Optional<String> matchDefKey(String key) {
        Matcher matcher = DEFK.matcher(key);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1));
    }

    /**
     * Recognizes a {@code defn name(params)} mapping key. The parameter list is
     * optional; {@code defn name} alone yields an empty parameter text.
     */
    public static Optional<DefnSignature> matchDefnKey(String key) {
        Matcher matcher = DFNK.matcher(key);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new DefnSignature(matcher.group(1), Optional.ofNullable(matcher.group(2))));
    }
}
