package com.opspos.lock;

import com.opspos.event.EventPublisherHelper;
import org.springframework.stereotype.Component;

/**
 * Publishes the handoff request as a HANDOFF_REQUESTED CheckLockEvent for the terminal
 * transport to relay.
 */
@Component
public class EventLockHandoffNotifier implements LockHandoffNotifier {

    private final EventPublisherHelper eventPublisherHelper;

    public EventLockHandoffNotifier(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void requestHandoff(String checkId, String holderTerminalId, String requestingTerminalId) {
        eventPublisherHelper.publishHandoffRequested(this, checkId, holderTerminalId, requestingTerminalId);
    }
}
