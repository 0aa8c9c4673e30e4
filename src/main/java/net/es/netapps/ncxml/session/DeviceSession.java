package net.es.netapps.ncxml.session;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import lombok.Getter;
import lombok.ToString;
import net.es.netapps.ncxml.capabilities.Capabilities;
import net.es.netapps.ncxml.xml.XmlUtils;
import net.juniper.netconf.Device;
import net.juniper.netconf.NetconfException;
import net.juniper.netconf.XML;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import java.io.IOException;

/**
 * A NETCONF over SSH session to a device, carried by the Juniper NETCONF
 * library.  The library wraps each operation in its {@code <rpc/>} envelope
 * and numbers the messages.
 */
@Getter
@ToString
public class DeviceSession implements Session, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(DeviceSession.class);

  // Marks the end of a NETCONF 1.0 message.
  private static final String DELIMITER = "]]>]]>";

  private final String hostname;
  private final String username;
  @ToString.Exclude
  private final String password;
  private final int timeout;

  // Device that controls netconf communications.
  @ToString.Exclude
  private Device device = null;

  private Capabilities serverCapabilities = null;

  /**
   * Initialize all parameters needed to open a session to a device.
   *
   * @param hostname DNS name or address of the device.
   * @param username user name to authenticate with.
   * @param password password associated with the user name.
   * @param timeout command timeout in milliseconds.
   */
  public DeviceSession(String hostname, String username, String password, int timeout) {
    this.hostname = hostname;
    this.username = username;
    this.password = password;
    this.timeout = timeout;
  }

  /**
   * Create a NETCONF session to the device and record the capabilities it
   * announces.
   *
   * @throws NetconfException
   */
  public void connect() throws NetconfException {
    logger.info("[DeviceSession] connecting to {} ...", hostname);

    try {
      Device device = Device.builder()
          .hostName(hostname)
          .userName(username)
          .password(password)
          .strictHostKeyChecking(false)
          .commandTimeout(timeout)
          .build();
      device.connect();
      attach(device, new Capabilities(device.getNetconfSession().getServerHello().getCapabilities()));
    } catch (NetconfException ex) {
      logger.error("[DeviceSession] {} failed to connect", hostname, ex);
      throw ex;
    }

    logger.info("[DeviceSession] connected to {}.", hostname);
    logger.debug("[DeviceSession] {} capabilities {}", hostname, serverCapabilities);
  }

  /**
   * Disconnect NETCONF session to device.
   *
   * @throws NetconfException
   */
  @Override
  public void close() throws NetconfException {
    logger.info("[DeviceSession] disconnecting ...");
    if (device == null) {
      logger.error("[DeviceSession] {} not connected", hostname);
      throw new NetconfException("Device is not connected.");
    }

    try {
      device.close();
    } finally {
      device = null;
      serverCapabilities = null;
    }
    logger.info("[DeviceSession] terminated connection to {}.", hostname);
  }

  @Override
  public Capabilities getServerCapabilities() throws NetconfException {
    if (serverCapabilities == null) {
      logger.error("[DeviceSession] {} not connected", hostname);
      throw new NetconfException("Device is not connected.");
    }
    return serverCapabilities;
  }

  @Override
  public String execute(Element operation) throws NetconfException {
    if (device == null) {
      logger.error("[DeviceSession] {} not connected", hostname);
      throw new NetconfException("Device is not connected.");
    }

    String rpc = XmlUtils.toFragment(operation);
    try {
      logger.debug("[DeviceSession] sending {} to {}", XmlUtils.tagOf(operation), hostname);
      XML reply = device.executeRPC(rpc);
      return rawReply(device.getNetconfSession().getLastRPCReply(), reply.getOwnerDocument());
    } catch (IOException | SAXException ex) {
      logger.error("[DeviceSession] {} failed to execute {}", hostname, XmlUtils.tagOf(operation), ex);
      throw new NetconfException(ex.getMessage());
    }
  }

  @VisibleForTesting
  void attach(Device device, Capabilities serverCapabilities) {
    this.device = device;
    this.serverCapabilities = serverCapabilities;
  }

  /**
   * The reply document as the device sent it.  The library keeps the text of
   * the last reply; its DOM is only serialized when that text is missing.
   *
   * @param lastReply text of the last reply, may be null.
   * @param reply the parsed reply.
   * @return the reply document.
   */
  static String rawReply(String lastReply, Document reply) {
    if (!Strings.isNullOrEmpty(lastReply)) {
      String raw = lastReply.replace(DELIMITER, "").trim();
      if (!raw.isEmpty()) {
        return raw;
      }
    }
    return XmlUtils.toXml(reply.getDocumentElement());
  }
}
