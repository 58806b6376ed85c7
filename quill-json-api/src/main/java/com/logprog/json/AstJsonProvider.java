package com.logprog.json;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Entry point for reading and writing program syntax trees as JSON.
 *
 * <p>Implementations are found with {@link ServiceLoader}; putting a provider JAR such as
 * quill-jackson on the classpath is enough to make it available. A front end written in
 * another language can dump its tree in this format and have it unparsed here.</p>
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * StatementList program = provider.getDeserializer().deserializeProgram(json);
 * String source = new Unparser().unparse(program);
 * }</pre>
 */
public interface AstJsonProvider {

    /**
     * Returns the serializer for converting AST nodes to JSON.
     */
    AstJsonSerializer getSerializer();

    /**
     * Returns the deserializer for converting JSON to AST nodes.
     */
    AstJsonDeserializer getDeserializer();

    /**
     * Returns the name of this provider, e.g. "Jackson". Used to pick a provider
     * with {@link #getProvider(String)}.
     */
    String getName();

    /**
     * Gets the first provider found on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider on the classpath; add quill-jackson to your dependencies");
    }

    /**
     * Gets the provider whose name matches {@code name}, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No AstJsonProvider named '" + name + "'; available: " + availableProviders());
    }

    /**
     * Names of all providers on the classpath, in discovery order.
     */
    static List<String> availableProviders() {
        List<String> names = new ArrayList<>();
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            names.add(provider.getName());
        }
        return names;
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
