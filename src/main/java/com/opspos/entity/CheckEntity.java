package com.opspos.entity;

import com.opspos.domain.enums.CheckStatus;
import com.opspos.domain.enums.ConflictState;
import com.opspos.domain.enums.LockType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the checks table.
 *
 * <p>Lock acquisition and handoff (holder terminal, holder employee, lock type, acquired at,
 * pending handoff target) go through the compare-and-swap queries in CheckJpaRepository,
 * keyed on {@code version}.
 * Ordinary edits also bump {@code version} through JPA optimistic locking, so a lock
 * decision made against a stale revision never sticks.
 */
@Entity
@Table(name = "checks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CheckEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "property_id", length = 36, nullable = false)
    private String propertyId;

    @Column(name = "business_date", nullable = false)
    private LocalDate businessDate;

    @Column(name = "check_number")
    private Integer checkNumber;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    @Builder.Default
    private CheckStatus status = CheckStatus.OPEN;

    @Column(name = "guest_count")
    private Integer guestCount;

    @Column(name = "opened_by_employee_id", length = 36)
    private String openedByEmployeeId;

    @Column(precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal subtotal = BigDecimal.ZERO;

    @Column(name = "discount_total", precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal discountTotal = BigDecimal.ZERO;

    /** Fraction, e.g. 0.0875 for 8.75%. */
    @Column(name = "tax_rate", precision = 6, scale = 4)
    @Builder.Default
    private BigDecimal taxRate = BigDecimal.ZERO;

    @Column(name = "tax_total", precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal taxTotal = BigDecimal.ZERO;

    @Column(name = "tip_total", precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal tipTotal = BigDecimal.ZERO;

    @Column(precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal total = BigDecimal.ZERO;

    @Column(name = "paid_amount", precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal paidAmount = BigDecimal.ZERO;

    @Column(name = "lock_holder_terminal_id", length = 36)
    private String lockHolderTerminalId;

    @Column(name = "lock_holder_employee_id", length = 36)
    private String lockHolderEmployeeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "lock_type", length = 10)
    private LockType lockType;

    @Column(name = "lock_acquired_at")
    private Instant lockAcquiredAt;

    /** Terminal a manager-approved handoff is waiting to move the lock to, once the holder releases. */
    @Column(name = "handoff_to_terminal_id", length = 36)
    private String handoffToTerminalId;

    @Column(name = "handoff_to_employee_id", length = 36)
    private String handoffToEmployeeId;

    @Column(name = "handoff_approved_by", length = 36)
    private String handoffApprovedBy;

    @Version
    private Long version;

    @Enumerated(EnumType.STRING)
    @Column(name = "conflict_state", length = 20, nullable = false)
    @Builder.Default
    private ConflictState conflictState = ConflictState.NONE;

    @Column(name = "cloned_from_check_id", length = 36)
    private String clonedFromCheckId;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    public boolean isLocked() {
        return lockHolderTerminalId != null;
    }

    public boolean isActiveLockHeldBy(String terminalId) {
        return lockType == LockType.ACTIVE && terminalId != null && terminalId.equals(lockHolderTerminalId);
    }

    public boolean hasPendingHandoff() {
        return handoffToTerminalId != null;
    }

    /** Drops the lock together with any handoff still waiting on it. */
    public void clearLock() {
        lockHolderTerminalId = null;
        lockHolderEmployeeId = null;
        lockType = null;
        lockAcquiredAt = null;
        handoffToTerminalId = null;
        handoffToEmployeeId = null;
        handoffApprovedBy = null;
    }
}
