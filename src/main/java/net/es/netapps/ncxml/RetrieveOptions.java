package net.es.netapps.ncxml;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;
import net.es.netapps.ncxml.operations.Filter;

/**
 * What to retrieve from which device, as given on the command line.
 */
@Data
@Builder
public class RetrieveOptions {
    private final String device;
    private final String username;
    @ToString.Exclude
    private final String password;
    private final String operation;
    private final String source;

    // Null when everything is wanted.
    private final Filter filter;
    private final int timeout;
}
