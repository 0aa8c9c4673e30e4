package net.es.netapps.ncxml.operations;

import net.es.netapps.ncxml.xml.XmlException;
import net.es.netapps.ncxml.xml.XmlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;
import static net.es.netapps.ncxml.xml.XmlUtils.qualify;

/**
 * The reply to an operation.  The raw document is parsed lazily, once, the
 * first time any parsed view is asked for.  Operations with a richer reply
 * extend this class and pick out their payload in {@link #parsingHook(Element)}.
 */
public class RpcReply {
    private static final Logger logger = LoggerFactory.getLogger(RpcReply.class);

    public static final String RPC_REPLY = qualify("rpc-reply");
    private static final String RPC_ERROR = qualify("rpc-error");

    private final String raw;

    private boolean parsed = false;
    private Element root;
    private final List<RpcError> errors = new ArrayList<>();

    public RpcReply(String raw) {
        this.raw = checkNotNull(raw, "raw");
    }

    /**
     * Parse the raw reply.  Only the first successful call does any work.
     *
     * @throws XmlException if the reply is not a well-formed rpc-reply.
     */
    public final synchronized void parse() throws XmlException {
        if (parsed) {
            return;
        }

        Element element = XmlUtils.validatedElement(raw, RPC_REPLY);

        errors.clear();
        for (Element error : XmlUtils.findAll(element, RPC_ERROR)) {
            errors.add(RpcError.fromElement(error));
        }
        if (!errors.isEmpty()) {
            logger.debug("[RpcReply] reply carries {} rpc-error(s)", errors.size());
        }

        root = element;
        parsingHook(element);
        parsed = true;
    }

    /**
     * Called once from {@link #parse()}, after the errors have been recorded.
     *
     * @param root the rpc-reply element.
     */
    protected void parsingHook(Element root) {
    }

    /**
     * Errors recorded so far, without triggering a parse.  Meant for
     * {@link #parsingHook(Element)}.
     */
    protected List<RpcError> parsedErrors() {
        return Collections.unmodifiableList(errors);
    }

    public String getRaw() {
        return raw;
    }

    public synchronized boolean isParsed() {
        return parsed;
    }

    public Element getRoot() throws XmlException {
        parse();
        return root;
    }

    public boolean isOk() throws XmlException {
        parse();
        return errors.isEmpty();
    }

    public List<RpcError> getErrors() throws XmlException {
        parse();
        return Collections.unmodifiableList(errors);
    }

    /**
     * The first error in the reply, or null if there is none.
     */
    public RpcError getError() throws XmlException {
        parse();
        return errors.isEmpty() ? null : errors.get(0);
    }

    @Override
    public String toString() {
        return raw;
    }
}
