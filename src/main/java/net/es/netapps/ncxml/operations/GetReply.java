package net.es.netapps.ncxml.operations;

import net.es.netapps.ncxml.xml.XmlException;
import net.es.netapps.ncxml.xml.XmlUtils;
import org.w3c.dom.Element;

import static net.es.netapps.ncxml.xml.XmlUtils.qualify;

/**
 * Reply to {@link Get} and {@link GetConfig}, adding the {@code <data/>}
 * element.
 */
public class GetReply extends RpcReply {
    private static final String DATA = qualify("data");

    private Element data;

    public GetReply(String raw) {
        super(raw);
    }

    @Override
    protected void parsingHook(Element root) {
        data = null;
        if (parsedErrors().isEmpty()) {
            data = XmlUtils.find(root, DATA);
        }
    }

    /**
     * The data element, or null if the reply carried errors or no data.
     */
    public Element getDataElement() throws XmlException {
        parse();
        return data;
    }

    /**
     * The data element as an XML document.
     */
    public String getDataXml() throws XmlException {
        parse();
        return data == null ? null : XmlUtils.toXml(data);
    }

    /**
     * Same as {@link #getDataElement()}.
     */
    public Element getData() throws XmlException {
        return getDataElement();
    }
}
