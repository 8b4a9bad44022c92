package com.opspos.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the audit_logs table.
 * Append-only trail of lock overrides, conflicts, resolutions and automatic
 * clock-outs. {@code detailsJson} carries the structured context of the action.
 */
@Entity
@Table(name = "audit_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_type", length = 50)
    private String eventType;

    @Column(name = "entity_type", length = 50)
    private String entityType;

    @Column(name = "entity_id", length = 36)
    private String entityId;

    @Column(length = 50)
    private String action;

    @Column(name = "employee_id", length = 36)
    private String employeeId;

    @Column(name = "terminal_id", length = 36)
    private String terminalId;

    @Column(name = "details_json", columnDefinition = "CLOB")
    private String detailsJson;

    private Instant timestamp;
}
