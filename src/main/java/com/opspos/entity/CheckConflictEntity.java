package com.opspos.entity;

import com.opspos.domain.enums.ConflictResolution;
import com.opspos.domain.enums.ConflictStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the check_conflicts table.
 * Created when a manager overrides a lock held by an unreachable terminal. Stays PENDING
 * until someone picks a resolution; resolved rows are kept for the audit trail.
 */
@Entity
@Table(name = "check_conflicts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckConflictEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "original_check_id", length = 36, nullable = false)
    private String originalCheckId;

    @Column(name = "clone_check_id", length = 36, nullable = false)
    private String cloneCheckId;

    @Column(name = "original_holder_terminal_id", length = 36)
    private String originalHolderTerminalId;

    @Column(name = "overriding_terminal_id", length = 36)
    private String overridingTerminalId;

    @Column(name = "approved_by_employee_id", length = 36)
    private String approvedByEmployeeId;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    private ConflictStatus status;

    @Enumerated(EnumType.STRING)
    @Column(length = 15)
    private ConflictResolution resolution;

    @Column(name = "canonical_check_id", length = 36)
    private String canonicalCheckId;

    @Column(name = "resolved_by_employee_id", length = 36)
    private String resolvedByEmployeeId;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;
}
