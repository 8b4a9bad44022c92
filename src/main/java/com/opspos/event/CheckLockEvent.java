package com.opspos.event;

import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published for lock ownership changes and check conflicts.
 *
 * <p>The terminal transport layer relays HANDOFF_REQUESTED to the holding terminal so it
 * can flush and release; CONFLICT_CREATED and CONFLICT_DETECTED drive the manager's
 * reconciliation prompt. {@code conflictId} is only set for conflict events.
 */
public class CheckLockEvent extends ApplicationEvent {

    private final CheckLockEventType eventType;
    private final String checkId;
    private final String terminalId;
    private final String counterpartTerminalId;
    private final Long conflictId;
    private final Instant occurredAt;

    public CheckLockEvent(
            Object source,
            CheckLockEventType eventType,
            String checkId,
            String terminalId,
            String counterpartTerminalId,
            Long conflictId) {
        super(source);
        this.eventType = eventType;
        this.checkId = checkId;
        this.terminalId = terminalId;
        this.counterpartTerminalId = counterpartTerminalId;
        this.conflictId = conflictId;
        this.occurredAt = Instant.now();
    }

    public CheckLockEventType getEventType() {
        return eventType;
    }

    public String getCheckId() {
        return checkId;
    }

    public String getTerminalId() {
        return terminalId;
    }

    public String getCounterpartTerminalId() {
        return counterpartTerminalId;
    }

    public Long getConflictId() {
        return conflictId;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
