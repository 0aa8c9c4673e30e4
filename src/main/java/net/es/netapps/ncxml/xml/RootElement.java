package net.es.netapps.ncxml.xml;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Map;

/**
 * The identity of a document's root element: its qualified tag and its
 * attributes.  Produced by {@link XmlUtils#parseRoot(String)} without
 * building the rest of the document.
 */
@Data
@Builder
public class RootElement {
    private final String tag;

    @Singular
    private final Map<String, String> attributes;

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }
}
