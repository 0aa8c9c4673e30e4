package net.es.netapps.ncxml.xml;

import lombok.Getter;
import net.juniper.netconf.NetconfException;

/**
 * Raised when an XML document is malformed, or when its root element does not
 * have the structure a caller requires.
 */
@Getter
public class XmlException extends NetconfException {
    // Tag of the offending element, null if the document never got that far.
    private final String tag;

    public XmlException(String message, String tag) {
        super(message);
        this.tag = tag;
    }

    public XmlException(String message, String tag, Throwable cause) {
        super(message);
        this.tag = tag;
        initCause(cause);
    }
}
