package com.opspos.service;

import com.opspos.entity.AuditLogEntity;
import com.opspos.mapper.JsonHelper;
import com.opspos.repository.jpa.AuditLogJpaRepository;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes the audit trail for actions a manager may be asked to explain later: lock overrides,
 * conflict clones, reconciliation choices, automatic clock-outs and exhausted recoveries.
 *
 * <p>Entries are written in the caller's transaction, so an override that rolls back leaves
 * no audit row behind.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogJpaRepository auditLogJpaRepository;
    private final Clock clock;

    public AuditService(AuditLogJpaRepository auditLogJpaRepository, Clock clock) {
        this.auditLogJpaRepository = auditLogJpaRepository;
        this.clock = clock;
    }

    public void log(String eventType, String entityType, String entityId, String action) {
        log(eventType, entityType, entityId, action, null, null, null);
    }

    public void log(
            String eventType,
            String entityType,
            String entityId,
            String action,
            String employeeId,
            String terminalId,
            Map<String, Object> details) {

        AuditLogEntity auditLogEntity = AuditLogEntity.builder()
                .eventType(eventType)
                .entityType(entityType)
                .entityId(entityId)
                .action(action)
                .employeeId(employeeId)
                .terminalId(terminalId)
                .detailsJson(buildDetailsJson(details))
                .timestamp(clock.instant())
                .build();

        auditLogJpaRepository.save(auditLogEntity);
        log.debug("Audit: {} {} {} {}", eventType, entityType, entityId, action);
    }

    private String buildDetailsJson(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return JsonHelper.toJson(details);
        } catch (Exception e) {
            log.warn("Failed to serialize audit details to JSON: {}", e.getMessage());
            return null;
        }
    }
}
