package net.es.netapps.ncxml.operations;

import net.es.netapps.ncxml.xml.XmlException;
import net.es.netapps.ncxml.xml.XmlUtils;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import static net.es.netapps.ncxml.xml.XmlUtils.qualify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GetReplyTest {

    @Test
    void parsesOnceOnFirstAccess() throws XmlException {
        CountingReply reply = new CountingReply(Replies.DATA);
        assertFalse(reply.isParsed());
        assertEquals(0, reply.hooks);

        String first = reply.getDataXml();
        String second = reply.getDataXml();
        reply.getDataElement();
        reply.parse();

        assertTrue(reply.isParsed());
        assertEquals(1, reply.hooks);
        assertEquals(first, second);
        assertTrue(first.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?><nc:data"), first);
        assertTrue(first.contains("<nc:x/>"), first);
    }

    @Test
    void dataIsTheDataElement() throws XmlException {
        GetReply reply = new GetReply(Replies.DATA);

        Element data = reply.getDataElement();
        assertEquals(qualify("data"), XmlUtils.tagOf(data));
        assertSame(data, reply.getData());
        assertTrue(reply.isOk());
        assertNull(reply.getError());
        assertEquals(qualify("rpc-reply"), XmlUtils.tagOf(reply.getRoot()));
    }

    @Test
    void errorsSuppressData() throws XmlException {
        GetReply reply = new GetReply(Replies.ERROR);

        assertNull(reply.getDataElement());
        assertNull(reply.getDataXml());
        assertFalse(reply.isOk());
        assertEquals(1, reply.getErrors().size());

        RpcError error = reply.getError();
        assertEquals("protocol", error.getType());
        assertEquals("operation-failed", error.getTag());
        assertEquals("error", error.getSeverity());
        assertEquals("/configure/port", error.getPath());
        assertEquals("port does not exist", error.getMessage());
        assertTrue(error.getInfo().contains("bad-element"), error.getInfo());
    }

    @Test
    void replyWithoutDataHasNoData() throws XmlException {
        GetReply reply = new GetReply(Replies.NO_DATA);
        assertTrue(reply.isOk());
        assertNull(reply.getData());
    }

    @Test
    void malformedReplyFailsEveryTime() {
        GetReply reply = new GetReply("<rpc-reply xmlns=\"urn:ietf:params:xml:ns:netconf:base:1.0\"><data>");

        assertThrows(XmlException.class, reply::getDataElement);
        assertThrows(XmlException.class, reply::getDataXml);
        assertFalse(reply.isParsed());
    }

    @Test
    void replyMustBeRpcReply() {
        XmlException ex = assertThrows(XmlException.class, () -> new GetReply("<data/>").getData());
        assertEquals("data", ex.getTag());
    }

    private static class CountingReply extends GetReply {
        private int hooks = 0;

        CountingReply(String raw) {
            super(raw);
        }

        @Override
        protected void parsingHook(Element root) {
            hooks++;
            super.parsingHook(root);
        }
    }
}
