package com.opspos.connectivity;

/**
 * Operating mode of this terminal, derived from which authority is reachable.
 *
 * <ul>
 *   <li>ONLINE -- cloud reachable; cloud is authoritative</li>
 *   <li>LAN_DEGRADED -- cloud down, store relay host reachable; relay host is authoritative</li>
 *   <li>LOCAL_ONLY -- only local peripherals (printers, KDS) reachable; writes queue locally</li>
 *   <li>ISOLATED -- nothing reachable; writes queue locally</li>
 * </ul>
 */
public enum ConnectivityMode {
    ONLINE,
    LAN_DEGRADED,
    LOCAL_ONLY,
    ISOLATED;

    /** Whether some authoritative store can take replayed writes in this mode. */
    public boolean hasAuthoritativeTarget() {
        return this == ONLINE || this == LAN_DEGRADED;
    }

    /** Lock ownership can only be coordinated while an authority is reachable. */
    public boolean isLockSharingAvailable() {
        return hasAuthoritativeTarget();
    }
}
