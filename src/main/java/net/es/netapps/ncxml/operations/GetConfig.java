package net.es.netapps.ncxml.operations;

import net.es.netapps.ncxml.session.Session;
import net.es.netapps.ncxml.xml.XmlUtils;
import net.juniper.netconf.NetconfException;
import org.w3c.dom.Element;

import static net.es.netapps.ncxml.xml.XmlUtils.qualify;

/**
 * The {@code <get-config/>} operation: retrieve all or part of a
 * configuration datastore.
 */
public class GetConfig extends Rpc<GetReply> {

    public GetConfig(Session session) {
        super(session);
    }

    public Element buildRequest(String source) throws NetconfException {
        return buildRequest(source, null);
    }

    /**
     * Build the {@code <get-config/>} element.
     *
     * @param source datastore name, e.g. {@code running}, or a URL.
     * @param filter narrows the returned data, or null for everything.
     * @return the operation element.
     * @throws NetconfException if the source or filter is not supported.
     */
    public Element buildRequest(String source, Filter filter) throws NetconfException {
        Element node = XmlUtils.newElement(qualify("get-config"));
        XmlUtils.append(node, OperationUtils.datastoreOrUrl("source", source, this::assertCapability));
        if (filter != null) {
            XmlUtils.append(node, OperationUtils.buildFilter(filter, this::assertCapability));
        }
        return node;
    }

    public GetReply request(String source) throws NetconfException {
        return request(source, null);
    }

    public GetReply request(String source, Filter filter) throws NetconfException {
        return submit(buildRequest(source, filter));
    }

    @Override
    protected GetReply createReply(String raw) {
        return new GetReply(raw);
    }
}
