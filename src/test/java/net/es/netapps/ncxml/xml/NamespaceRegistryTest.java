package net.es.netapps.ncxml.xml;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

import static net.es.netapps.ncxml.xml.XmlUtils.qualify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NamespaceRegistryTest {

    @Test
    void defaultRegistryKnowsBaseNamespace() {
        assertEquals(Optional.of("nc"), NamespaceRegistry.DEFAULT.getPrefix(Namespaces.BASE_NS_1_0));
        assertEquals(Optional.of("aaa"), NamespaceRegistry.DEFAULT.getPrefix(Namespaces.TAILF_AAA_1_1));
        assertEquals(Optional.empty(), NamespaceRegistry.DEFAULT.getPrefix("urn:unknown"));
        assertEquals(Optional.empty(), NamespaceRegistry.DEFAULT.getPrefix(null));
    }

    @Test
    void lastRegistrationForUriWins() {
        NamespaceRegistry registry = NamespaceRegistry.builder()
            .register("a", "urn:x")
            .register("a", "urn:x")
            .register("b", "urn:x")
            .build();

        assertEquals(Optional.of("b"), registry.getPrefix("urn:x"));
        assertEquals(1, registry.getPrefixes().size());
    }

    @Test
    void replacingPrefixIsLogged() {
        Logger logger = (Logger) LoggerFactory.getLogger(NamespaceRegistry.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        Level originalLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);

        try {
            NamespaceRegistry.builder()
                .register("a", "urn:x")
                .register("a", "urn:x")
                .register("b", "urn:x")
                .build();
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(originalLevel);
            appender.stop();
        }

        List<ILoggingEvent> events = appender.list;
        assertEquals(1, events.size());
        assertTrue(events.get(0).getFormattedMessage().contains("replacing prefix a with b for urn:x"));
    }

    @Test
    void derivedRegistryLeavesOriginalAlone() {
        NamespaceRegistry derived = NamespaceRegistry.DEFAULT.toBuilder()
            .register("base", Namespaces.BASE_NS_1_0)
            .build();

        assertEquals(Optional.of("base"), derived.getPrefix(Namespaces.BASE_NS_1_0));
        assertEquals(Optional.of("nc"), NamespaceRegistry.DEFAULT.getPrefix(Namespaces.BASE_NS_1_0));
    }

    @Test
    void serializerUsesItsOwnRegistry() {
        Element get = XmlUtils.newElement(qualify("get"));

        XmlSerializer custom = new XmlSerializer(NamespaceRegistry.builder()
            .register("base", Namespaces.BASE_NS_1_0)
            .build());
        String xml = custom.toXml(get);
        assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?><base:get"), xml);
        assertTrue(xml.contains("xmlns:base=\"" + Namespaces.BASE_NS_1_0 + "\""), xml);

        String plain = new XmlSerializer(NamespaceRegistry.builder().build()).toFragment(get);
        assertTrue(plain.startsWith("<get"), plain);
        assertTrue(plain.contains("xmlns=\"" + Namespaces.BASE_NS_1_0 + "\""), plain);
    }

    @Test
    void serializerDoesNotTouchCallersTree() throws XmlException {
        Element get = XmlUtils.newElement(qualify("get"));
        XmlUtils.subElement(get, qualify("filter"));

        String xml = XmlUtils.toXml(get);

        assertNull(get.getPrefix());
        assertNull(XmlUtils.children(get).get(0).getPrefix());
        XmlAssertions.assertStructurallyEqual(get, XmlUtils.toElement(xml));
    }
}
