package com.yscompiler.json;

import java.util.ServiceLoader;

/**
 * Entry point to a JSON binding for the AST: a matching pair of
 * {@link AstJsonSerializer} and {@link AstJsonDeserializer}.
 *
 * <p>The binding lives in a separate module (yscompiler-jackson) and registers
 * itself under {@code META-INF/services}, so callers depend only on this API:</p>
 * <pre>{@code
 * AstJsonProvider json = AstJsonProvider.getProvider();
 * RawNode document = json.getDeserializer().deserializeRaw(parserOutput);
 * String ast = json.getSerializer().serializePretty(new Compiler().construct(document));
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name of the binding, used in log messages.
     */
    String getName();

    /**
     * Loads the binding registered on the classpath.
     *
     * @throws IllegalStateException if no binding is registered
     */
    static AstJsonProvider getProvider() {
        return ServiceLoader.load(AstJsonProvider.class)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No " + AstJsonProvider.class.getSimpleName() + " registered; add yscompiler-jackson to the classpath"));
    }
}
