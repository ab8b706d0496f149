package com.shellast.json;

import java.util.Iterator;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Entry point for handing shell trees between processes as JSON: an external
 * parser writes the tree, this side reads it and renders shell source.
 * Providers register under {@code META-INF/services}; shellast-jackson is
 * the stock one.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * File file = provider.getDeserializer().deserializeFile(json);
 * String source = file.render();
 * }</pre>
 */
public interface AstJsonProvider {

    Logger LOG = Logger.getLogger(AstJsonProvider.class.getName());

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Name used by {@link #getProvider(String)}, compared ignoring case.
     */
    String getName();

    /**
     * First registered provider.
     *
     * @throws IllegalStateException if none is registered
     */
    static AstJsonProvider getProvider() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        Iterator<AstJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            AstJsonProvider provider = iterator.next();
            LOG.fine(() -> "Using AstJsonProvider " + provider.getName());
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add shellast-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * @throws IllegalStateException if no registered provider is called {@code name}
     */
    static AstJsonProvider getProvider(String name) {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        for (AstJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
            LOG.finer(() -> "Skipping AstJsonProvider " + provider.getName());
        }
        throw new IllegalStateException(
            "No AstJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider JAR is on the classpath."
        );
    }

    static boolean isProviderAvailable() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        return loader.iterator().hasNext();
    }
}
