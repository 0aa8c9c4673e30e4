package net.es.netapps.ncxml.operations;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import org.w3c.dom.Element;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Narrows the data a read operation returns.  A filter is either a subtree
 * (given as XML text or as an element), an XPath expression, or a complete
 * {@code <filter/>} element supplied by the caller.
 */
@Data
@Builder(access = AccessLevel.PRIVATE)
public class Filter {
    public enum Type {
        SUBTREE("subtree"),
        XPATH("xpath");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    // Null for a complete <filter/> element.
    private final Type type;

    // XML text of the subtree or filter element, or the XPath expression.
    private final String text;

    private final Element element;

    public static Filter subtree(String xml) {
        return Filter.builder().type(Type.SUBTREE).text(checkNotNull(xml, "xml")).build();
    }

    public static Filter subtree(Element content) {
        return Filter.builder().type(Type.SUBTREE).element(checkNotNull(content, "content")).build();
    }

    public static Filter xpath(String select) {
        return Filter.builder().type(Type.XPATH).text(checkNotNull(select, "select")).build();
    }

    /**
     * Use a complete {@code <filter type="..."/>} document as is.
     */
    public static Filter of(String xml) {
        return Filter.builder().text(checkNotNull(xml, "xml")).build();
    }

    public static Filter of(Element filter) {
        return Filter.builder().element(checkNotNull(filter, "filter")).build();
    }
}
