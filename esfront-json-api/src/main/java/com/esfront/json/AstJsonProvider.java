package com.esfront.json;

import com.esfront.Lexer;
import com.esfront.Parser;

import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * JSON export for esfront syntax trees and token streams, implemented by a
 * provider registered under {@code META-INF/services}.
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /** Name used by {@link #getProvider(String)}, e.g. "Jackson". */
    String getName();

    /**
     * Parses {@code source} as a script or module and serializes the resulting {@code Program}.
     *
     * @throws com.esfront.ParseException if the source does not parse
     */
    default String programToJson(String source, boolean module) {
        return getSerializer().serialize(Parser.parse(source, module));
    }

    /** Lexes all of {@code source} and serializes the token stream, error tokens included. */
    default String tokensToJson(String source, boolean module) {
        return getSerializer().serializeTokens(new Lexer(source, false, module).tokenize());
    }

    static Optional<AstJsonProvider> find(String name) {
        return providers().filter(p -> p.getName().equalsIgnoreCase(name)).findFirst();
    }

    /** @throws IllegalStateException if no provider is on the classpath */
    static AstJsonProvider getProvider() {
        return providers().findFirst()
                .orElseThrow(() -> new IllegalStateException("No AstJsonProvider on the classpath; add esfront-jackson"));
    }

    /** @throws IllegalStateException if no provider has that name */
    static AstJsonProvider getProvider(String name) {
        return find(name)
                .orElseThrow(() -> new IllegalStateException("No AstJsonProvider named '" + name + "'"));
    }

    static boolean isProviderAvailable() {
        return providers().findAny().isPresent();
    }

    private static Stream<AstJsonProvider> providers() {
        return ServiceLoader.load(AstJsonProvider.class).stream().map(ServiceLoader.Provider::get);
    }
}
