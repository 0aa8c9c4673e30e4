package net.es.netapps.ncxml.operations;

import com.google.common.base.Strings;
import net.es.netapps.ncxml.capabilities.CapabilityAssertion;
import net.es.netapps.ncxml.xml.XmlUtils;
import net.juniper.netconf.NetconfException;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static net.es.netapps.ncxml.xml.XmlUtils.qualify;

/**
 * Encoders for the parameters shared by several operations.
 */
public final class OperationUtils {
    private static final String FILTER = "filter";
    private static final String TYPE = "type";
    private static final String SELECT = "select";
    private static final String URL = "url";

    private static final List<String> FILTER_TAGS = List.of(FILTER, qualify(FILTER));
    private static final List<List<String>> FILTER_ATTRIBUTES = List.of(List.of(TYPE));

    private OperationUtils() {
    }

    /**
     * Build the {@code <filter/>} element for a filter.  XPath filters need the
     * {@code :xpath} capability.
     *
     * @param filter the filter.
     * @param assertion checks capabilities the filter depends on.
     * @return the filter element.
     * @throws NetconfException if the filter is malformed or not supported.
     */
    public static Element buildFilter(Filter filter, CapabilityAssertion assertion) throws NetconfException {
        if (filter.getType() == null) {
            Element raw = filter.getElement() != null
                ? XmlUtils.toElement(filter.getElement())
                : XmlUtils.toElement(filter.getText());
            Element validated = XmlUtils.validatedElement(raw, FILTER_TAGS, FILTER_ATTRIBUTES);
            if (Filter.Type.XPATH.getValue().equals(validated.getAttribute(TYPE))) {
                assertion.check(":xpath");
            }
            return validated;
        }

        Element node = XmlUtils.newElement(qualify(FILTER), Map.of(TYPE, filter.getType().getValue()));
        switch (filter.getType()) {
            case XPATH:
                assertion.check(":xpath");
                node.setAttributeNS(null, SELECT, filter.getText());
                break;
            case SUBTREE:
                Element content = filter.getElement() != null
                    ? XmlUtils.toElement(filter.getElement())
                    : XmlUtils.toElement(filter.getText());
                XmlUtils.append(node, content);
                break;
            default:
                throw new IllegalArgumentException("Invalid filter type " + filter.getType());
        }
        return node;
    }

    /**
     * Build the element naming a datastore or, when the source looks like a URL,
     * a URL.  URLs need the {@code :url} capability.
     *
     * @param tag local name of the wrapping element, e.g. {@code source}.
     * @param datastore a datastore name such as {@code running}, or a URL.
     * @param assertion checks capabilities the source depends on.
     * @return the wrapping element.
     * @throws NetconfException if a URL is given but not supported.
     */
    public static Element datastoreOrUrl(String tag, String datastore, CapabilityAssertion assertion)
        throws NetconfException {
        checkArgument(!Strings.isNullOrEmpty(datastore), "No datastore or URL given for <%s/>", tag);

        Element node = XmlUtils.newElement(qualify(tag));
        if (datastore.contains("://")) {
            assertion.check(":url");
            XmlUtils.subElement(node, qualify(URL)).setTextContent(datastore);
        } else {
            XmlUtils.subElement(node, qualify(datastore));
        }
        return node;
    }
}
