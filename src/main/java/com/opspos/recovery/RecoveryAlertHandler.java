package com.opspos.recovery;

import com.opspos.event.RecoveryEvent;
import com.opspos.event.RecoveryEventType;
import com.opspos.service.AuditService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Turns RECOVERY_EXHAUSTED into an operator alert: an error log line, an audit entry and an
 * entry in the active-alert list served by the recovery API. The alert stays until it is
 * acknowledged or the service is reset.
 */
@Component
public class RecoveryAlertHandler {

    private static final Logger log = LoggerFactory.getLogger(RecoveryAlertHandler.class);

    private final AuditService auditService;
    private final Map<String, RecoveryAlert> activeAlerts = new ConcurrentHashMap<>();

    public RecoveryAlertHandler(AuditService auditService) {
        this.auditService = auditService;
    }

    @EventListener
    @Order(5)
    public void onRecoveryEvent(RecoveryEvent event) {
        if (event.getEventType() == RecoveryEventType.RECOVERED) {
            activeAlerts.remove(event.getServiceName());
            return;
        }
        if (event.getEventType() != RecoveryEventType.RECOVERY_EXHAUSTED) {
            return;
        }

        log.error(
                "ALERT: service {} could not be recovered after {} attempt(s), manual intervention required. Last error: {}",
                event.getServiceName(),
                event.getAttempt(),
                event.getError());
        activeAlerts.put(
                event.getServiceName(),
                RecoveryAlert.builder()
                        .serviceName(event.getServiceName())
                        .attempts(event.getAttempt())
                        .lastError(event.getError())
                        .raisedAt(event.getOccurredAt())
                        .build());
        try {
            auditService.log(
                    "RECOVERY",
                    "SERVICE",
                    event.getServiceName(),
                    "RECOVERY_EXHAUSTED",
                    null,
                    null,
                    Map.of("attempts", event.getAttempt(), "lastError", String.valueOf(event.getError())));
        } catch (Exception e) {
            log.warn("Could not audit exhausted recovery of {}: {}", event.getServiceName(), e.getMessage());
        }
    }

    public List<RecoveryAlert> getActiveAlerts() {
        return new ArrayList<>(activeAlerts.values());
    }

    /**
     * @return true if an alert was active for the service
     */
    public boolean acknowledge(String serviceName) {
        RecoveryAlert removed = activeAlerts.remove(serviceName);
        if (removed != null) {
            log.info("Recovery alert for {} acknowledged", serviceName);
        }
        return removed != null;
    }
}
