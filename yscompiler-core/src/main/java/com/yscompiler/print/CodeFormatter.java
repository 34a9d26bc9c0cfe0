package com.yscompiler.print;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Lays out printed Clojure code. The printer only produces one line per
 * top-level form; indentation and line breaking are the formatter's job.
 *
 * <p>Implementations are discovered via Java's ServiceLoader mechanism. With
 * none on the classpath, {@link #IDENTITY} is used.</p>
 */
@FunctionalInterface
public interface CodeFormatter {

    /**
     * Returns the code unchanged.
     */
    CodeFormatter IDENTITY = (code, options) -> code;

    /**
     * @param code    newline-separated top-level forms
     * @param options style settings
     * @return the formatted code
     */
    String format(String code, FormatOptions options);

    /**
     * Gets the first CodeFormatter registered via ServiceLoader, or
     * {@link #IDENTITY} if there is none.
     */
    static CodeFormatter discover() {
        ServiceLoader<CodeFormatter> loader = ServiceLoader.load(CodeFormatter.class);
        Iterator<CodeFormatter> iterator = loader.iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        return IDENTITY;
    }
}
