package net.es.netapps.ncxml.xml;

/**
 * Well-known namespaces used by this client and by the vendor data models
 * we talk to.
 */
public final class Namespaces {
    private Namespaces() {
    }

    // Base NETCONF namespace.
    public static final String BASE_NS_1_0 = "urn:ietf:params:xml:ns:netconf:base:1.0";

    // Tail-f core and execd data models.
    public static final String TAILF_AAA_1_1 = "http://tail-f.com/ns/aaa/1.1";
    public static final String TAILF_EXECD_1_1 = "http://tail-f.com/ns/execd/1.1";

    // Cisco data model.
    public static final String CISCO_CPI_1_0 = "http://www.cisco.com/cpi_10/schema";

    // Flowmon data model.
    public static final String FLOWMON_1_0 = "http://www.liberouter.org/ns/netopeer/flowmon/1.0";

    // Nokia SR OS <configure/> and <state/> roots.
    public static final String NOKIA_SROS_CONF = "urn:nokia.com:sros:ns:yang:sr:conf";
    public static final String NOKIA_SROS_STATE = "urn:nokia.com:sros:ns:yang:sr:state";
}
