package com.yscompiler.re;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * An ordered table of named regex templates.
 *
 * <p>A template may refer to any pattern defined before it as {@code $name}.
 * The reference is replaced by the referenced pattern's expanded text, so the
 * result is one flat regex, not a composition of matchers. Because a pattern can
 * only refer backwards, expansion always terminates.</p>
 *
 * <pre>{@code
 * PatternLibrary re = new PatternLibrary();
 * re.define("inum", "-?\\d+");
 * Pattern fnum = re.define("fnum", "$inum\\.\\d*");   // -?\d+\.\d*
 * }</pre>
 */
public final class PatternLibrary {

    // A name is a run of letters; the whole run is the name, so $symw never resolves $sym.
    private static final Pattern REFERENCE = Pattern.compile("\\$([a-zA-Z]+)");

    private final LinkedHashMap<String, String> definitions = new LinkedHashMap<>();
    private final LinkedHashMap<String, Pattern> patterns = new LinkedHashMap<>();

    /**
     * Expands {@code template} against the patterns defined so far and stores
     * it under {@code name}.
     *
     * @return the compiled pattern
     * @throws GrammarException if the name is taken, a reference is undefined,
     *         or the expanded text is not a valid regex
     */
    public Pattern define(String name, String template) {
        if (definitions.containsKey(name)) {
            throw new GrammarException("Pattern '" + name + "' is already defined");
        }
        String text = interpolate(template);
        Pattern pattern = compile(name, text);
        definitions.put(name, text);
        patterns.put(name, pattern);
        return pattern;
    }

    /**
     * Expands and compiles a template without storing it.
     *
     * @throws GrammarException if a reference is undefined or the result does not compile
     */
    public Pattern expand(String template) {
        return compile(template, interpolate(template));
    }

    /**
     * Replaces every {@code $name} in {@code template} with the definition text
     * of that pattern, until none is left.
     */
    public String interpolate(String template) {
        String text = template;
        Matcher matcher = REFERENCE.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = definitions.get(name);
            if (value == null) {
                throw new GrammarException(
                    "Unresolved pattern reference '$" + name + "' in template: " + template);
            }
            text = text.replaceAll(
                "\\$" + name + "(?![a-zA-Z])",
                Matcher.quoteReplacement(value));
            matcher = REFERENCE.matcher(text);
        }
        return text;
    }

    public boolean isDefined(String name) {
        return definitions.containsKey(name);
    }

    /**
     * @throws GrammarException if there is no pattern with this name
     */
    public Pattern pattern(String name) {
        Pattern pattern = patterns.get(name);
        if (pattern == null) {
            throw new GrammarException("No pattern named '" + name + "'");
        }
        return pattern;
    }

    /**
     * The expanded regex text of a defined pattern.
     */
    public String definition(String name) {
        return pattern(name).pattern();
    }

    /**
     * Pattern names in definition order.
     */
    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(definitions.keySet()));
    }

    private static Pattern compile(String what, String text) {
        try {
            return Pattern.compile(text);
        } catch (PatternSyntaxException e) {
            throw new GrammarException("Pattern '" + what + "' does not compile: " + e.getDescription(), e);
        }
    }
}
