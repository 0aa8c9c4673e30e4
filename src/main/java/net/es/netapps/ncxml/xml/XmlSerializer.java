package net.es.netapps.ncxml.xml;

import com.google.common.base.Strings;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.w3c.dom.ls.DOMImplementationLS;
import org.w3c.dom.ls.LSSerializer;

import javax.xml.XMLConstants;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Renders element trees as XML text, using the prefixes of a
 * {@link NamespaceRegistry} for the namespaces it knows about.
 *
 * The caller's tree is never modified: prefixes are applied to a copy.  Trees
 * from a parser that was not namespace aware are accepted too; their
 * {@code xmlns} attributes are honoured when the copy is made.
 */
public class XmlSerializer {
    public static final String DEFAULT_ENCODING = "UTF-8";

    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"%s\"?>";

    private final NamespaceRegistry registry;

    public XmlSerializer(NamespaceRegistry registry) {
        this.registry = checkNotNull(registry, "registry");
    }

    public NamespaceRegistry getRegistry() {
        return registry;
    }

    public String toXml(Element element) {
        return toXml(element, DEFAULT_ENCODING);
    }

    /**
     * Serialize an element as a standalone XML document.  The result always
     * starts with exactly one XML declaration naming the encoding.
     *
     * @param element root of the tree to serialize.
     * @param encoding character encoding named in the declaration.
     * @return the XML document.
     */
    public String toXml(Element element, String encoding) {
        String xml = write(element);
        return xml.startsWith("<?xml") ? xml : String.format(XML_DECLARATION, encoding) + xml;
    }

    /**
     * Serialize an element without an XML declaration, for embedding into an
     * envelope owned by someone else.
     *
     * @param element root of the tree to serialize.
     * @return the XML fragment.
     */
    public String toFragment(Element element) {
        return write(element);
    }

    private String write(Element element) {
        checkNotNull(element, "element");

        Document copy = XmlUtils.newDocument();
        Element root = copyOf(copy, element, inScope(element));
        copy.appendChild(root);
        applyPrefixes(copy, root, new HashMap<>());
        declareNamespaces(root);

        DOMImplementationLS ls = (DOMImplementationLS) copy.getImplementation().getFeature("LS", "3.0");
        LSSerializer serializer = ls.createLSSerializer();
        serializer.getDomConfig().setParameter("xml-declaration", false);
        return serializer.writeToString(copy.getDocumentElement());
    }

    // Namespace declarations visible to an element from its ancestors, nearest first.
    private static Map<String, String> inScope(Element element) {
        List<Element> ancestors = new ArrayList<>();
        for (Node parent = element.getParentNode(); parent instanceof Element; parent = parent.getParentNode()) {
            ancestors.add(0, (Element) parent);
        }
        Map<String, String> scope = new HashMap<>();
        for (Element ancestor : ancestors) {
            collectDeclarations(ancestor, scope);
        }
        return scope;
    }

    private static void collectDeclarations(Element element, Map<String, String> scope) {
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Node attribute = map.item(i);
            String name = attribute.getNodeName();
            if (XMLConstants.XMLNS_ATTRIBUTE.equals(name)) {
                scope.put(XMLConstants.DEFAULT_NS_PREFIX, attribute.getNodeValue());
            } else if (name.startsWith(XMLConstants.XMLNS_ATTRIBUTE + ":")) {
                scope.put(name.substring(XMLConstants.XMLNS_ATTRIBUTE.length() + 1), attribute.getNodeValue());
            }
        }
    }

    // Deep copy into a namespace aware tree.  Nodes built by a parser that was not
    // namespace aware carry their declarations as plain attributes, so their
    // namespaces are resolved from the declarations in scope.
    private static Element copyOf(Document document, Element element, Map<String, String> parentScope) {
        Map<String, String> scope = new HashMap<>(parentScope);
        collectDeclarations(element, scope);

        String name = element.getNodeName();
        String uri = element.getLocalName() != null
            ? element.getNamespaceURI()
            : resolve(scope, prefixOf(name), name);
        Element copy = document.createElementNS(Strings.emptyToNull(uri), name);

        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Attr attribute = (Attr) map.item(i);
            copy.setAttributeNS(namespaceOf(attribute, scope), attribute.getName(), attribute.getValue());
        }

        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node child = nodes.item(i);
            copy.appendChild(child.getNodeType() == Node.ELEMENT_NODE
                ? copyOf(document, (Element) child, scope)
                : document.importNode(child, true));
        }
        return copy;
    }

    private static String namespaceOf(Attr attribute, Map<String, String> scope) {
        if (attribute.getLocalName() != null) {
            return attribute.getNamespaceURI();
        }

        String name = attribute.getName();
        String prefix = prefixOf(name);
        if (XMLConstants.XMLNS_ATTRIBUTE.equals(name) || XMLConstants.XMLNS_ATTRIBUTE.equals(prefix)) {
            return XMLConstants.XMLNS_ATTRIBUTE_NS_URI;
        }
        if (XMLConstants.XML_NS_PREFIX.equals(prefix)) {
            return XMLConstants.XML_NS_URI;
        }
        // Unprefixed attributes are in no namespace, whatever the default is.
        return prefix.isEmpty() ? null : resolve(scope, prefix, name);
    }

    private static String resolve(Map<String, String> scope, String prefix, String name) {
        String uri = scope.get(prefix);
        checkArgument(prefix.isEmpty() || !Strings.isNullOrEmpty(uri), "Unbound prefix in [%s]", name);
        return uri;
    }

    private static String prefixOf(String name) {
        int colon = name.indexOf(':');
        return colon < 0 ? XMLConstants.DEFAULT_NS_PREFIX : name.substring(0, colon);
    }

    // Rename elements and attributes into their registered prefixes, children first
    // so renaming never invalidates a node we still have to visit.  Namespaced
    // attributes need a prefix, so unregistered ones get a generated one.
    private void applyPrefixes(Document document, Element element, Map<String, String> generated) {
        for (Element child : XmlUtils.children(element)) {
            applyPrefixes(document, child, generated);
        }

        List<Attr> attributes = new ArrayList<>();
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            attributes.add((Attr) map.item(i));
        }
        for (Attr attribute : attributes) {
            String uri = attribute.getNamespaceURI();
            if (uri == null || XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(uri)
                || XMLConstants.XML_NS_URI.equals(uri)) {
                continue;
            }

            String prefix = registry.getPrefix(uri)
                .filter(p -> !p.isEmpty())
                .orElseGet(() -> attribute.getPrefix() != null
                    ? attribute.getPrefix()
                    : generated.computeIfAbsent(uri, u -> "ns" + generated.size()));
            rename(document, attribute, uri, prefix);
        }

        String uri = element.getNamespaceURI();
        if (uri != null) {
            Optional<String> prefix = registry.getPrefix(uri);
            if (prefix.isPresent()) {
                rename(document, element, uri, prefix.get());
            }
        }
    }

    private void rename(Document document, Node node, String uri, String prefix) {
        String current = node.getPrefix() == null ? "" : node.getPrefix();
        if (prefix.equals(current)) {
            return;
        }

        String local = XmlUtils.localName(node);
        document.renameNode(node, uri, prefix.isEmpty() ? local : prefix + ":" + local);
    }

    // Declare every namespace the copy uses, so the output never depends on the
    // serializer's own namespace fixup.  Prefixes are bound on the root unless the
    // root already binds them; default namespaces are declared where they change.
    private void declareNamespaces(Element root) {
        Map<String, String> bindings = new LinkedHashMap<>();
        declareDefaults(root, null, bindings);
        bindings.forEach((prefix, uri) -> {
            if (!root.hasAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, prefix)) {
                root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI,
                    XMLConstants.XMLNS_ATTRIBUTE + ":" + prefix, uri);
            }
        });
    }

    private void declareDefaults(Element element, String inherited, Map<String, String> bindings) {
        String defaultNamespace = inherited;
        if (element.hasAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE)) {
            defaultNamespace = Strings.emptyToNull(
                element.getAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE));
        }

        String uri = element.getNamespaceURI();
        if (element.getPrefix() == null) {
            if (!Objects.equals(uri, defaultNamespace)) {
                element.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE,
                    Strings.nullToEmpty(uri));
                defaultNamespace = uri;
            }
        } else {
            bindings.putIfAbsent(element.getPrefix(), uri);
        }

        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Node attribute = map.item(i);
            String namespace = attribute.getNamespaceURI();
            if (attribute.getPrefix() != null && namespace != null
                && !XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(namespace)
                && !XMLConstants.XML_NS_URI.equals(namespace)) {
                bindings.putIfAbsent(attribute.getPrefix(), namespace);
            }
        }

        for (Element child : XmlUtils.children(element)) {
            declareDefaults(child, defaultNamespace, bindings);
        }
    }
}
