package com.opspos.event;

import com.opspos.connectivity.ConnectivityMode;
import com.opspos.connectivity.ConnectivityStatus;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the terminal's connectivity mode changes (e.g. ONLINE to LAN_DEGRADED).
 *
 * <p>Heartbeats that do not change the mode are not published. Key listeners:
 * <ul>
 *   <li>SyncWorker -- drains the replay queue as soon as an authority becomes reachable</li>
 *   <li>CheckLockManager -- surfaces pending conflicts when lock sharing comes back</li>
 *   <li>CustomMetricsService -- counts mode transitions</li>
 * </ul>
 */
public class ConnectivityEvent extends ApplicationEvent {

    private final ConnectivityStatus previousStatus;
    private final ConnectivityStatus currentStatus;

    public ConnectivityEvent(Object source, ConnectivityStatus previousStatus, ConnectivityStatus currentStatus) {
        super(source);
        this.previousStatus = previousStatus;
        this.currentStatus = currentStatus;
    }

    public ConnectivityStatus getPreviousStatus() {
        return previousStatus;
    }

    public ConnectivityStatus getCurrentStatus() {
        return currentStatus;
    }

    public ConnectivityMode getPreviousMode() {
        return previousStatus.getMode();
    }

    public ConnectivityMode getCurrentMode() {
        return currentStatus.getMode();
    }

    /** True when this transition made an authoritative store reachable again. */
    public boolean isAuthorityRegained() {
        return !getPreviousMode().hasAuthoritativeTarget() && getCurrentMode().hasAuthoritativeTarget();
    }
}
