package net.es.netapps.ncxml.session;

import net.es.netapps.ncxml.capabilities.Capabilities;
import net.es.netapps.ncxml.operations.GetReply;
import net.es.netapps.ncxml.xml.Namespaces;
import net.es.netapps.ncxml.xml.XmlUtils;
import net.juniper.netconf.Device;
import net.juniper.netconf.NetconfException;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;

import static net.es.netapps.ncxml.xml.XmlUtils.qualify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeviceSessionTest {
    private static final String REPLY = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
        + "<rpc-reply xmlns=\"" + Namespaces.BASE_NS_1_0 + "\""
        + " xmlns:junos=\"http://xml.juniper.net/junos/*/junos\" message-id=\"1\">"
        + "<data><state xmlns=\"" + Namespaces.NOKIA_SROS_STATE + "\">"
        + "<port port-id=\"1/1/1\"><oper-state>up</oper-state></port>"
        + "</state></data></rpc-reply>";

    private final DeviceSession session = new DeviceSession("router.example.net", "admin", "secret", 60 * 1000);

    @Test
    void executeRequiresConnection() {
        NetconfException ex = assertThrows(NetconfException.class,
            () -> session.execute(XmlUtils.newElement(qualify("get"))));
        assertEquals("Device is not connected.", ex.getMessage());
    }

    @Test
    void capabilitiesRequireConnection() {
        assertThrows(NetconfException.class, session::getServerCapabilities);
    }

    @Test
    void closeRequiresConnection() {
        assertThrows(NetconfException.class, session::close);
    }

    @Test
    void toStringHidesPassword() {
        String text = session.toString();
        assertTrue(text.contains("router.example.net"), text);
        assertFalse(text.contains("secret"), text);
    }

    @Test
    void closeForgetsCapabilities() throws Exception {
        Device device = Device.builder()
            .hostName("router.example.net")
            .userName("admin")
            .password("secret")
            .strictHostKeyChecking(false)
            .build();
        Capabilities capabilities = Capabilities.of("urn:ietf:params:netconf:base:1.0");
        session.attach(device, capabilities);
        assertSame(capabilities, session.getServerCapabilities());

        session.close();

        assertThrows(NetconfException.class, session::getServerCapabilities);
        assertThrows(NetconfException.class, () -> session.execute(XmlUtils.newElement(qualify("get"))));
    }

    @Test
    void connectionStateHasNoPublicSetters() {
        boolean setters = Arrays.stream(DeviceSession.class.getDeclaredMethods())
            .filter(method -> Modifier.isPublic(method.getModifiers()))
            .map(Method::getName)
            .anyMatch(name -> name.startsWith("set"));
        assertFalse(setters);
    }

    @Test
    void rawReplyPrefersTextTheDeviceSent() throws Exception {
        String raw = DeviceSession.rawReply("\n" + REPLY + "\n]]>]]>", parse(REPLY));

        assertEquals(REPLY, raw);
        assertEquals(qualify("rpc-reply"), XmlUtils.parseRoot(raw).getTag());
    }

    @Test
    void rawReplyFromDomKeepsNamespaces() throws Exception {
        String raw = DeviceSession.rawReply(null, parse(REPLY));

        assertEquals(qualify("rpc-reply"), XmlUtils.parseRoot(raw).getTag());
        assertEquals("1", XmlUtils.parseRoot(raw).getAttributes().get("message-id"));

        Element data = new GetReply(raw).getDataElement();
        assertNotNull(data);
        Element state = XmlUtils.find(data, qualify("state", Namespaces.NOKIA_SROS_STATE));
        assertNotNull(state);
        Element port = XmlUtils.find(state, qualify("port", Namespaces.NOKIA_SROS_STATE));
        assertEquals("1/1/1", XmlUtils.attributesOf(port).get("port-id"));
        assertEquals("up", XmlUtils.findText(port, qualify("oper-state", Namespaces.NOKIA_SROS_STATE)));
    }

    @Test
    void rawReplyFallsBackToDomWhenTextIsOnlyDelimiter() throws Exception {
        String raw = DeviceSession.rawReply("]]>]]>", parse(REPLY));
        assertEquals(qualify("rpc-reply"), XmlUtils.parseRoot(raw).getTag());
    }

    // The device library parses replies without namespace awareness.
    private static Document parse(String xml) throws Exception {
        return DocumentBuilderFactory.newInstance().newDocumentBuilder()
            .parse(new InputSource(new StringReader(xml)));
    }
}
