package net.es.netapps.ncxml.xml;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Maps namespace URIs to the short prefixes we would like to see in serialized
 * XML.  Prefixes only make documents easier to read; they have no bearing on
 * parsing or on element equality.
 *
 * Registries are immutable once built, so independent registries can be handed
 * to different serializers.
 */
public final class NamespaceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(NamespaceRegistry.class);

    /**
     * The namespaces this client and the vendor models it knows about use.
     */
    public static final NamespaceRegistry DEFAULT = builder()
        .register("nc", Namespaces.BASE_NS_1_0)
        .register("aaa", Namespaces.TAILF_AAA_1_1)
        .register("execd", Namespaces.TAILF_EXECD_1_1)
        .register("cpi", Namespaces.CISCO_CPI_1_0)
        .register("fm", Namespaces.FLOWMON_1_0)
        .register("conf", Namespaces.NOKIA_SROS_CONF)
        .register("state", Namespaces.NOKIA_SROS_STATE)
        .build();

    // Namespace URI to prefix.
    private final ImmutableMap<String, String> prefixes;

    private NamespaceRegistry(Map<String, String> prefixes) {
        this.prefixes = ImmutableMap.copyOf(prefixes);
    }

    /**
     * Look up the preferred prefix for a namespace URI.
     *
     * @param uri the namespace URI.
     * @return the registered prefix, or empty if the namespace is unknown.
     */
    public Optional<String> getPrefix(String uri) {
        if (uri == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(prefixes.get(uri));
    }

    public Map<String, String> getPrefixes() {
        return prefixes;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.prefixes.putAll(prefixes);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, String> prefixes = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Associate a prefix with a namespace URI.  The last registration for a
         * URI wins.
         *
         * @param prefix the preferred prefix.
         * @param uri the namespace URI.
         * @return this builder.
         */
        public Builder register(String prefix, String uri) {
            checkNotNull(prefix, "prefix");
            checkNotNull(uri, "uri");

            String previous = prefixes.put(uri, prefix);
            if (previous != null && !previous.equals(prefix)) {
                logger.debug("[NamespaceRegistry] replacing prefix {} with {} for {}", previous, prefix, uri);
            }
            return this;
        }

        public NamespaceRegistry build() {
            return new NamespaceRegistry(prefixes);
        }
    }
}
