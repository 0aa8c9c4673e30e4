package net.es.netapps.ncxml.xml;

import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Methods for creating, parsing, and dealing with XML elements.
 *
 * Elements are namespace aware DOM elements.  Tags are handled in their
 * qualified form, {@code {namespace}local}, so comparing two tags never
 * depends on the prefixes a document happened to use.
 */
public final class XmlUtils {
    private static final Logger logger = LoggerFactory.getLogger(XmlUtils.class);

    private static final XmlSerializer SERIALIZER = new XmlSerializer(NamespaceRegistry.DEFAULT);

    private static final DocumentBuilderFactory DOCUMENT_BUILDER_FACTORY = DocumentBuilderFactory.newInstance();
    private static final XMLInputFactory INPUT_FACTORY = XMLInputFactory.newFactory();

    // Report parse problems through the exception only, never on stderr.
    private static final ErrorHandler ERROR_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException ex) {
            logger.debug("[XmlUtils] parser warning: {}", ex.getMessage());
        }

        @Override
        public void error(SAXParseException ex) throws SAXException {
            throw ex;
        }

        @Override
        public void fatalError(SAXParseException ex) throws SAXException {
            throw ex;
        }
    };

    static {
        DOCUMENT_BUILDER_FACTORY.setNamespaceAware(true);
        DOCUMENT_BUILDER_FACTORY.setExpandEntityReferences(false);
        try {
            DOCUMENT_BUILDER_FACTORY.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser does not support disabling DTDs", ex);
        }

        INPUT_FACTORY.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        INPUT_FACTORY.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        INPUT_FACTORY.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    private XmlUtils() {
    }

    /**
     * Qualify a tag name with the base NETCONF namespace.
     *
     * @param tag local name of the tag.
     * @return the qualified tag.
     */
    public static String qualify(String tag) {
        return qualify(tag, Namespaces.BASE_NS_1_0);
    }

    /**
     * Qualify a tag name with a namespace, i.e. {@code {namespace}tag}.  A null
     * namespace leaves the tag unqualified.
     *
     * @param tag local name of the tag.
     * @param namespace namespace to qualify with, may be null.
     * @return the qualified tag.
     */
    public static String qualify(String tag, String namespace) {
        return namespace == null ? tag : "{" + namespace + "}" + tag;
    }

    /**
     * Split a qualified tag back into its namespace and local name.
     */
    public static QName toQName(String tag) {
        return QName.valueOf(tag);
    }

    public static Document newDocument() {
        return newDocumentBuilder().newDocument();
    }

    public static Element newElement(String tag) {
        return newElement(tag, Collections.emptyMap());
    }

    /**
     * Create a new element, the root of its own document.
     *
     * @param tag qualified tag of the element.
     * @param attributes attributes keyed by (optionally qualified) name.
     * @return the new element.
     */
    public static Element newElement(String tag, Map<String, String> attributes) {
        Document document = newDocument();
        Element element = createElement(document, tag, attributes);
        document.appendChild(element);
        return element;
    }

    public static Element subElement(Element parent, String tag) {
        return subElement(parent, tag, Collections.emptyMap());
    }

    /**
     * Create a new element and append it as the last child of a parent.
     *
     * @param parent the parent element.
     * @param tag qualified tag of the child.
     * @param attributes attributes keyed by (optionally qualified) name.
     * @return the new child.
     */
    public static Element subElement(Element parent, String tag, Map<String, String> attributes) {
        Element child = createElement(parent.getOwnerDocument(), tag, attributes);
        parent.appendChild(child);
        return child;
    }

    /**
     * Append a copy of an element, which may belong to another document, as the
     * last child of a parent.
     *
     * @return the appended copy.
     */
    public static Element append(Element parent, Element child) {
        Element copy = (Element) parent.getOwnerDocument().importNode(child, true);
        parent.appendChild(copy);
        return copy;
    }

    private static Element createElement(Document document, String tag, Map<String, String> attributes) {
        QName name = toQName(tag);
        Element element = document.createElementNS(namespaceOf(name), name.getLocalPart());
        attributes.forEach((key, value) -> {
            QName attribute = toQName(key);
            element.setAttributeNS(namespaceOf(attribute), attribute.getLocalPart(), value);
        });
        return element;
    }

    private static String namespaceOf(QName name) {
        return Strings.emptyToNull(name.getNamespaceURI());
    }

    static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    /**
     * The qualified tag of an element or attribute.
     */
    public static String tagOf(Node node) {
        return qualify(localName(node), node.getNamespaceURI());
    }

    /**
     * The attributes of an element keyed by qualified name.  Namespace
     * declarations are not attributes and are left out.
     */
    public static Map<String, String> attributesOf(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Attr attribute = (Attr) map.item(i);
            if (isNamespaceDeclaration(attribute)) {
                continue;
            }
            attributes.put(tagOf(attribute), attribute.getValue());
        }
        return attributes;
    }

    private static boolean isNamespaceDeclaration(Attr attribute) {
        String name = attribute.getName();
        return XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())
            || XMLConstants.XMLNS_ATTRIBUTE.equals(name)
            || name.startsWith(XMLConstants.XMLNS_ATTRIBUTE + ":");
    }

    /**
     * The child elements of an element, in document order.
     */
    public static List<Element> children(Element element) {
        List<Element> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i).getNodeType() == Node.ELEMENT_NODE) {
                children.add((Element) nodes.item(i));
            }
        }
        return children;
    }

    /**
     * Find the first child element with the given qualified tag.
     *
     * @return the child, or null if there is none.
     */
    public static Element find(Element element, String tag) {
        for (Element child : children(element)) {
            if (tag.equals(tagOf(child))) {
                return child;
            }
        }
        return null;
    }

    public static List<Element> findAll(Element element, String tag) {
        List<Element> matches = new ArrayList<>();
        for (Element child : children(element)) {
            if (tag.equals(tagOf(child))) {
                matches.add(child);
            }
        }
        return matches;
    }

    /**
     * Text content of the first child with the given tag, or null.
     */
    public static String findText(Element element, String tag) {
        Element child = find(element, tag);
        return child == null ? null : child.getTextContent();
    }

    public static String toXml(Element element) {
        return SERIALIZER.toXml(element);
    }

    /**
     * Convert an element to an XML document, prefixed with an XML declaration
     * naming the encoding.
     *
     * @param element the element.
     * @param encoding character encoding.
     * @return the XML document.
     */
    public static String toXml(Element element, String encoding) {
        return SERIALIZER.toXml(element, encoding);
    }

    /**
     * Convert an element to XML text without an XML declaration.
     */
    public static String toFragment(Element element) {
        return SERIALIZER.toFragment(element);
    }

    /**
     * An element is already an element.
     */
    public static Element toElement(Element element) {
        return element;
    }

    /**
     * Parse an XML document into an element tree.
     *
     * @param xml the XML document.
     * @return the root element.
     * @throws XmlException if the document is not well-formed.
     */
    public static Element toElement(String xml) throws XmlException {
        if (xml == null) {
            throw new XmlException("No XML document to parse", null);
        }

        try {
            Document document = newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
            return document.getDocumentElement();
        } catch (SAXException | IOException ex) {
            logger.debug("[XmlUtils] failed to parse document: {}", ex.getMessage());
            throw new XmlException("Malformed XML document: " + ex.getMessage(), null, ex);
        }
    }

    /**
     * Efficiently parse the root element of an XML document.  Parsing stops at
     * the root's start tag, so nothing past it has to be well-formed.
     *
     * @param raw the XML document.
     * @return the qualified tag and attributes of the root element.
     * @throws XmlException if no root start tag could be read.
     */
    public static RootElement parseRoot(String raw) throws XmlException {
        if (raw == null) {
            throw new XmlException("No XML document to parse", null);
        }

        XMLStreamReader reader = null;
        try {
            reader = INPUT_FACTORY.createXMLStreamReader(new StringReader(raw));
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT) {
                    return readRoot(reader);
                }
            }
            throw new XmlException("XML document has no root element", null);
        } catch (XMLStreamException ex) {
            throw new XmlException("Malformed XML root element: " + ex.getMessage(), null, ex);
        } finally {
            close(reader);
        }
    }

    private static RootElement readRoot(XMLStreamReader reader) {
        RootElement.RootElementBuilder root = RootElement.builder()
            .tag(qualify(reader.getLocalName(), Strings.emptyToNull(reader.getNamespaceURI())));
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            String name = qualify(reader.getAttributeLocalName(i),
                Strings.emptyToNull(reader.getAttributeNamespace(i)));
            root.attribute(name, reader.getAttributeValue(i));
        }
        return root.build();
    }

    private static void close(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException ex) {
            logger.debug("[XmlUtils] failed to close stream reader", ex);
        }
    }

    public static Element validatedElement(String xml, String tag) throws XmlException {
        return validatedElement(toElement(xml), Collections.singleton(tag), null);
    }

    public static Element validatedElement(Element element, String tag) throws XmlException {
        return validatedElement(element, Collections.singleton(tag), null);
    }

    public static Element validatedElement(String xml, Collection<String> tags,
                                           List<? extends Collection<String>> attributes) throws XmlException {
        return validatedElement(toElement(xml), tags, attributes);
    }

    /**
     * Checks that the root element of a document meets the supplied criteria.
     * Only the root is inspected: its tag, and the presence of attributes.
     *
     * @param element the element to check.
     * @param tags allowable qualified tags; null or empty skips the tag check.
     * @param attributes required attributes, each a group of allowable
     *                   alternatives of which at least one must be present;
     *                   null or empty skips the attribute check.
     * @return the element.
     * @throws XmlException if the requirements are not met.
     */
    public static Element validatedElement(Element element, Collection<String> tags,
                                           List<? extends Collection<String>> attributes) throws XmlException {
        String tag = tagOf(element);
        if (tags != null && !tags.isEmpty() && !tags.contains(tag)) {
            throw new XmlException(String.format("Element [%s] does not meet requirement", tag), tag);
        }

        if (attributes != null && !attributes.isEmpty()) {
            Map<String, String> present = attributesOf(element);
            for (Collection<String> alternatives : attributes) {
                if (alternatives.stream().noneMatch(present::containsKey)) {
                    throw new XmlException(
                        String.format("Element [%s] does not have required attributes %s", tag, alternatives), tag);
                }
            }
        }

        return element;
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilder builder;
            synchronized (DOCUMENT_BUILDER_FACTORY) {
                builder = DOCUMENT_BUILDER_FACTORY.newDocumentBuilder();
            }
            builder.setErrorHandler(ERROR_HANDLER);
            return builder;
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("Cannot create XML document builder", ex);
        }
    }
}
