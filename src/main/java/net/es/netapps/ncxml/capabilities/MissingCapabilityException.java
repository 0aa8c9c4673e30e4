package net.es.netapps.ncxml.capabilities;

import lombok.Getter;
import net.juniper.netconf.NetconfException;

/**
 * An operation needs a capability the peer did not announce.
 */
@Getter
public class MissingCapabilityException extends NetconfException {
    private final String capability;

    public MissingCapabilityException(String capability) {
        super(String.format("Server does not support [%s]", capability));
        this.capability = capability;
    }
}
