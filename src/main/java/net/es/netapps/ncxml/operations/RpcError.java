package net.es.netapps.ncxml.operations;

import lombok.Builder;
import lombok.Data;
import net.es.netapps.ncxml.xml.XmlUtils;
import org.w3c.dom.Element;

import static net.es.netapps.ncxml.xml.XmlUtils.qualify;

/**
 * An {@code <rpc-error/>} reported in a reply.  Errors are data carried by the
 * reply, they are not thrown.
 */
@Data
@Builder
public class RpcError {
    private final String type;
    private final String tag;
    private final String severity;
    private final String path;
    private final String message;

    // The <error-info/> element as XML, if present.
    private final String info;

    public static RpcError fromElement(Element element) {
        Element info = XmlUtils.find(element, qualify("error-info"));
        return RpcError.builder()
            .type(text(element, "error-type"))
            .tag(text(element, "error-tag"))
            .severity(text(element, "error-severity"))
            .path(text(element, "error-path"))
            .message(text(element, "error-message"))
            .info(info == null ? null : XmlUtils.toFragment(info))
            .build();
    }

    private static String text(Element element, String tag) {
        String text = XmlUtils.findText(element, qualify(tag));
        return text == null ? null : text.trim();
    }
}
