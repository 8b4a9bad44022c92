package com.opspos.connectivity;

/**
 * Transport used to probe an authority. Implementations must return within the configured
 * probe timeout; a timeout or any error is reported as unreachable.
 */
public interface HeartbeatProbe {

    boolean probe(Authority authority);
}
