package net.es.netapps.ncxml.session;

import net.es.netapps.ncxml.capabilities.Capabilities;
import net.juniper.netconf.NetconfException;
import org.w3c.dom.Element;

/**
 * A NETCONF session able to carry one operation at a time to a device.
 *
 * The session owns the protocol envelope: it wraps each operation in an
 * {@code <rpc/>} element, assigns the message identifier, transmits it and
 * hands back the device's reply as raw XML.
 */
public interface Session {
    /**
     * Send an operation to the device and wait for its reply.
     *
     * @param operation the operation element, e.g. {@code <get/>}.
     * @return the raw {@code <rpc-reply/>} document.
     * @throws NetconfException if the exchange with the device failed.
     */
    String execute(Element operation) throws NetconfException;

    /**
     * The capabilities the device announced when the session was established.
     */
    Capabilities getServerCapabilities() throws NetconfException;
}
