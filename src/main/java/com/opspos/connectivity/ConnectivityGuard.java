package com.opspos.connectivity;

import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Read-side helper answering "where do writes go right now" and "can locks be shared".
 */
@Component
public class ConnectivityGuard {

    private final ConnectivityMonitor connectivityMonitor;

    public ConnectivityGuard(ConnectivityMonitor connectivityMonitor) {
        this.connectivityMonitor = connectivityMonitor;
    }

    /** Cloud in ONLINE, relay host in LAN_DEGRADED, empty otherwise. */
    public Optional<Authority> getAuthoritativeTarget() {
        switch (connectivityMonitor.getMode()) {
            case ONLINE:
                return Optional.of(Authority.CLOUD);
            case LAN_DEGRADED:
                return Optional.of(Authority.RELAY_HOST);
            default:
                return Optional.empty();
        }
    }

    public boolean isAuthoritativeReachable() {
        return connectivityMonitor.getMode().hasAuthoritativeTarget();
    }

    /**
     * In LOCAL_ONLY and ISOLATED the terminal cannot see other terminals' locks,
     * so every other holder must be treated as unreachable.
     */
    public boolean isLockSharingAvailable() {
        return connectivityMonitor.getMode().isLockSharingAvailable();
    }
}
