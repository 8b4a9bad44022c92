package com.opspos.event;

import com.opspos.recovery.ServiceState;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the RecoveryManager for every lifecycle step of a supervised service.
 *
 * <p>RECOVERY_EXHAUSTED is emitted exactly once per exhaustion; RecoveryAlertHandler turns it
 * into a persistent operator alert.
 */
public class RecoveryEvent extends ApplicationEvent {

    private final String serviceName;
    private final RecoveryEventType eventType;
    private final ServiceState state;
    private final int attempt;
    private final String error;
    private final Instant occurredAt;

    public RecoveryEvent(
            Object source,
            String serviceName,
            RecoveryEventType eventType,
            ServiceState state,
            int attempt,
            String error,
            Instant occurredAt) {
        super(source);
        this.serviceName = serviceName;
        this.eventType = eventType;
        this.state = state;
        this.attempt = attempt;
        this.error = error;
        this.occurredAt = occurredAt;
    }

    public String getServiceName() {
        return serviceName;
    }

    public RecoveryEventType getEventType() {
        return eventType;
    }

    public ServiceState getState() {
        return state;
    }

    public int getAttempt() {
        return attempt;
    }

    public String getError() {
        return error;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
