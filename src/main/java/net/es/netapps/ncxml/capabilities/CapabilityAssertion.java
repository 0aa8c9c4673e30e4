package net.es.netapps.ncxml.capabilities;

import net.juniper.netconf.NetconfException;

/**
 * Asserts that the peer supports a capability before a request that depends on
 * it is built.
 */
@FunctionalInterface
public interface CapabilityAssertion {
    CapabilityAssertion NONE = capability -> { };

    void check(String capability) throws NetconfException;
}
