package net.es.netapps.ncxml.capabilities;

import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * The set of capabilities a NETCONF peer announced in its hello.
 *
 * Capabilities can be looked up by full URI or by shorthand: the capability
 * {@code urn:ietf:params:netconf:capability:url:1.0?scheme=file} is also known
 * as {@code :url} and {@code :url:1.0}, and
 * {@code urn:ietf:params:netconf:base:1.1} as {@code :base} and
 * {@code :base:1.1}.
 */
public class Capabilities implements Iterable<String> {
    private static final String CAPABILITY_PREFIX = "urn:ietf:params:netconf:capability:";
    private static final String BASE_PREFIX = "urn:ietf:params:netconf:base:";

    private final ImmutableSet<String> uris;
    private final ImmutableSet<String> abbreviations;

    public Capabilities(Collection<String> uris) {
        this.uris = ImmutableSet.copyOf(uris);

        ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        this.uris.forEach(uri -> builder.addAll(abbreviate(uri)));
        this.abbreviations = builder.build();
    }

    public static Capabilities of(String... uris) {
        return new Capabilities(List.of(uris));
    }

    /**
     * Check whether a capability is present.
     *
     * @param key full capability URI or its shorthand.
     * @return true if the capability is present.
     */
    public boolean contains(String key) {
        return uris.contains(key) || abbreviations.contains(key);
    }

    /**
     * Assert that a capability is present.
     *
     * @param key full capability URI or its shorthand.
     * @throws MissingCapabilityException if it is not.
     */
    public void check(String key) throws MissingCapabilityException {
        if (!contains(key)) {
            throw new MissingCapabilityException(key);
        }
    }

    public ImmutableSet<String> getUris() {
        return uris;
    }

    @Override
    public Iterator<String> iterator() {
        return uris.iterator();
    }

    @Override
    public String toString() {
        return uris.toString();
    }

    static List<String> abbreviate(String uri) {
        String name;
        if (uri.startsWith(CAPABILITY_PREFIX)) {
            name = uri.substring(CAPABILITY_PREFIX.length());
        } else if (uri.startsWith(BASE_PREFIX)) {
            name = "base:" + uri.substring(BASE_PREFIX.length());
        } else {
            return List.of();
        }

        int query = name.indexOf('?');
        if (query >= 0) {
            name = name.substring(0, query);
        }

        String[] parts = name.split(":");
        if (parts.length < 2 || parts[0].isEmpty()) {
            return List.of(":" + name);
        }
        return List.of(":" + parts[0], ":" + parts[0] + ":" + parts[1]);
    }
}
