package com.opspos.connectivity;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of reachability. A new snapshot replaces the previous one on every
 * heartbeat; readers never see a half-updated state.
 */
@Value
@Builder(toBuilder = true)
public class ConnectivityStatus {

    ConnectivityMode mode;
    boolean cloudReachable;
    boolean relayHostReachable;
    boolean peripheralsReachable;
    Instant lastChecked;

    public static ConnectivityStatus isolated(Instant at) {
        return ConnectivityStatus.builder()
                .mode(ConnectivityMode.ISOLATED)
                .lastChecked(at)
                .build();
    }

    public static ConnectivityMode deriveMode(boolean cloud, boolean relayHost, boolean peripherals) {
        if (cloud) {
            return ConnectivityMode.ONLINE;
        }
        if (relayHost) {
            return ConnectivityMode.LAN_DEGRADED;
        }
        if (peripherals) {
            return ConnectivityMode.LOCAL_ONLY;
        }
        return ConnectivityMode.ISOLATED;
    }

    public boolean isReachable(Authority authority) {
        switch (authority) {
            case CLOUD:
                return cloudReachable;
            case RELAY_HOST:
                return relayHostReachable;
            default:
                return peripheralsReachable;
        }
    }
}
