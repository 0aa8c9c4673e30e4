package net.es.netapps.ncxml.operations;

import net.es.netapps.ncxml.session.Session;
import net.es.netapps.ncxml.xml.XmlUtils;
import net.juniper.netconf.NetconfException;
import org.w3c.dom.Element;

import static net.es.netapps.ncxml.xml.XmlUtils.qualify;

/**
 * The {@code <get/>} operation: retrieve running configuration and state.
 */
public class Get extends Rpc<GetReply> {

    public Get(Session session) {
        super(session);
    }

    public Element buildRequest() throws NetconfException {
        return buildRequest(null);
    }

    /**
     * Build the {@code <get/>} element.
     *
     * @param filter narrows the returned data, or null for everything.
     * @return the operation element.
     * @throws NetconfException if the filter is malformed or not supported.
     */
    public Element buildRequest(Filter filter) throws NetconfException {
        Element node = XmlUtils.newElement(qualify("get"));
        if (filter != null) {
            XmlUtils.append(node, OperationUtils.buildFilter(filter, this::assertCapability));
        }
        return node;
    }

    public GetReply request() throws NetconfException {
        return request(null);
    }

    public GetReply request(Filter filter) throws NetconfException {
        return submit(buildRequest(filter));
    }

    @Override
    protected GetReply createReply(String raw) {
        return new GetReply(raw);
    }
}
