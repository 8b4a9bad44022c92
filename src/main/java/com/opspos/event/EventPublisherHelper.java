package com.opspos.event;

import com.opspos.connectivity.ConnectivityStatus;
import java.time.LocalDate;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the lock, conflict and fiscal events.
 *
 * <p>All methods are non-blocking from the publisher's point of view; delivery depends on
 * whether the listener is a plain {@code @EventListener} or {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Connectivity ----

    public void publishConnectivityChanged(Object source, ConnectivityStatus previous, ConnectivityStatus current) {
        applicationEventPublisher.publishEvent(new ConnectivityEvent(source, previous, current));
    }

    // ---- Locks ----

    public void publishLockAcquired(Object source, String checkId, String terminalId) {
        applicationEventPublisher.publishEvent(
                new CheckLockEvent(source, CheckLockEventType.ACQUIRED, checkId, terminalId, null, null));
    }

    public void publishLockReleased(Object source, String checkId, String terminalId) {
        applicationEventPublisher.publishEvent(
                new CheckLockEvent(source, CheckLockEventType.RELEASED, checkId, terminalId, null, null));
    }

    public void publishHandoffRequested(Object source, String checkId, String holderTerminalId, String requesterId) {
        applicationEventPublisher.publishEvent(new CheckLockEvent(
                source, CheckLockEventType.HANDOFF_REQUESTED, checkId, holderTerminalId, requesterId, null));
    }

    public void publishLockOverridden(Object source, String checkId, String newHolderId, String previousHolderId) {
        applicationEventPublisher.publishEvent(new CheckLockEvent(
                source, CheckLockEventType.OVERRIDDEN, checkId, newHolderId, previousHolderId, null));
    }

    // ---- Conflicts ----

    public void publishConflictCreated(
            Object source, Long conflictId, String checkId, String overridingTerminalId, String offlineHolderId) {
        applicationEventPublisher.publishEvent(new CheckLockEvent(
                source,
                CheckLockEventType.CONFLICT_CREATED,
                checkId,
                overridingTerminalId,
                offlineHolderId,
                conflictId));
    }

    public void publishConflictDetected(Object source, Long conflictId, String checkId, String reconnectedTerminalId) {
        applicationEventPublisher.publishEvent(new CheckLockEvent(
                source, CheckLockEventType.CONFLICT_DETECTED, checkId, reconnectedTerminalId, null, conflictId));
    }

    public void publishConflictResolved(Object source, Long conflictId, String canonicalCheckId) {
        applicationEventPublisher.publishEvent(new CheckLockEvent(
                source, CheckLockEventType.CONFLICT_RESOLVED, canonicalCheckId, null, null, conflictId));
    }

    // ---- Fiscal ----

    public void publishFiscalPeriodOpened(Object source, String propertyId, LocalDate businessDate) {
        applicationEventPublisher.publishEvent(
                new FiscalPeriodEvent(source, FiscalPeriodEventType.OPENED, propertyId, businessDate));
    }

    public void publishFiscalPeriodClosed(Object source, String propertyId, LocalDate businessDate) {
        applicationEventPublisher.publishEvent(
                new FiscalPeriodEvent(source, FiscalPeriodEventType.CLOSED, propertyId, businessDate));
    }
}
