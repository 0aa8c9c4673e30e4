package net.es.netapps.ncxml.operations;

import net.es.netapps.ncxml.session.Session;
import net.es.netapps.ncxml.xml.RootElement;
import net.es.netapps.ncxml.xml.XmlException;
import net.es.netapps.ncxml.xml.XmlUtils;
import net.juniper.netconf.NetconfException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base class for operations.  Subclasses build their operation element and
 * submit it; the session takes care of the envelope and the exchange, and this
 * class checks what kind of document came back before wrapping it in the
 * operation's reply type.
 *
 * @param <R> the reply type of the operation.
 */
public abstract class Rpc<R extends RpcReply> {
    private static final Logger logger = LoggerFactory.getLogger(Rpc.class);

    private final Session session;

    protected Rpc(Session session) {
        this.session = checkNotNull(session, "session");
    }

    public Session getSession() {
        return session;
    }

    /**
     * Wrap a raw reply document in this operation's reply type.
     */
    protected abstract R createReply(String raw);

    /**
     * Assert the device announced a capability.
     *
     * @param capability full capability URI or shorthand such as {@code :url}.
     * @throws NetconfException if it did not.
     */
    protected void assertCapability(String capability) throws NetconfException {
        session.getServerCapabilities().check(capability);
    }

    /**
     * Submit an operation and wrap the reply.  Only the reply's root element is
     * read here; the body is parsed by the reply when it is first used.
     *
     * @param operation the operation element.
     * @return the reply.
     * @throws NetconfException if the exchange failed or the reply is not an
     *     rpc-reply.
     */
    protected R submit(Element operation) throws NetconfException {
        String name = XmlUtils.tagOf(operation);
        logger.debug("[Rpc] submitting {}", name);

        String raw = session.execute(operation);
        RootElement root = XmlUtils.parseRoot(raw);
        if (!RpcReply.RPC_REPLY.equals(root.getTag())) {
            logger.error("[Rpc] received {} in reply to {}", root.getTag(), name);
            throw new XmlException(String.format("Element [%s] is not an rpc-reply", root.getTag()), root.getTag());
        }

        logger.debug("[Rpc] received reply to {}, message-id = {}", name, root.getAttributes().get("message-id"));
        return createReply(raw);
    }
}
