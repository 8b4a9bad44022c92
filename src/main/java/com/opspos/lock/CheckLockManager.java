package com.opspos.lock;

import com.opspos.config.TerminalConfig;
import com.opspos.connectivity.ConnectivityGuard;
import com.opspos.domain.enums.ConflictState;
import com.opspos.domain.enums.LockIndicator;
import com.opspos.domain.enums.LockOutcome;
import com.opspos.domain.enums.LockType;
import com.opspos.domain.enums.OverrideOutcome;
import com.opspos.domain.model.LockAcquireResult;
import com.opspos.domain.model.LockStatusView;
import com.opspos.domain.model.OverrideCommand;
import com.opspos.domain.model.OverrideResult;
import com.opspos.entity.CheckConflictEntity;
import com.opspos.entity.CheckEntity;
import com.opspos.entity.EmployeeEntity;
import com.opspos.event.ConnectivityEvent;
import com.opspos.event.EventPublisherHelper;
import com.opspos.exception.BusinessException;
import com.opspos.exception.ErrorCode;
import com.opspos.exception.LockConflictException;
import com.opspos.exception.ResourceNotFoundException;
import com.opspos.repository.jpa.CheckJpaRepository;
import com.opspos.service.AuditService;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Arbitrates which terminal may edit a check.
 *
 * <p>Every lock change is a compare-and-swap on the check's version, retried a few times when
 * another terminal wins the race. What a requester gets depends on the current holder:
 * <ul>
 *   <li>no holder (or only a VIEW lock) -- GRANTED, indicator green</li>
 *   <li>requester already holds it -- ALREADY_HELD</li>
 *   <li>holder reachable -- IN_USE, indicator yellow; a manager may request a handoff, which
 *       completes when the holder releases</li>
 *   <li>holder unreachable -- HOLDER_OFFLINE, indicator red; a manager override forks the check</li>
 * </ul>
 * A holder counts as reachable only if lock sharing is available in the current connectivity
 * mode and the presence store has seen it recently. In LOCAL_ONLY and ISOLATED every other
 * holder is therefore offline.
 *
 * <p>VIEW requests never take over an ACTIVE lock; they return VIEW_ONLY and write nothing.
 */
@Service
public class CheckLockManager {

    private static final Logger log = LoggerFactory.getLogger(CheckLockManager.class);

    static final int MAX_CAS_ATTEMPTS = 5;

    private final CheckJpaRepository checkJpaRepository;
    private final TerminalPresenceService terminalPresenceService;
    private final ConnectivityGuard connectivityGuard;
    private final ManagerApprovalService managerApprovalService;
    private final LockHandoffNotifier lockHandoffNotifier;
    private final ConflictReconciliationService conflictReconciliationService;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final TerminalConfig terminalConfig;
    private final Clock clock;

    public CheckLockManager(
            CheckJpaRepository checkJpaRepository,
            TerminalPresenceService terminalPresenceService,
            ConnectivityGuard connectivityGuard,
            ManagerApprovalService managerApprovalService,
            LockHandoffNotifier lockHandoffNotifier,
            ConflictReconciliationService conflictReconciliationService,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            TerminalConfig terminalConfig,
            Clock clock) {
        this.checkJpaRepository = checkJpaRepository;
        this.terminalPresenceService = terminalPresenceService;
        this.connectivityGuard = connectivityGuard;
        this.managerApprovalService = managerApprovalService;
        this.lockHandoffNotifier = lockHandoffNotifier;
        this.conflictReconciliationService = conflictReconciliationService;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.terminalConfig = terminalConfig;
        this.clock = clock;
    }

    // ---- Acquire / release ----

    public LockAcquireResult acquire(String checkId, String terminalId, String employeeId, LockType lockType) {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            CheckEntity check = requireCheck(checkId);
            if (check.getConflictState() == ConflictState.SUPERSEDED) {
                throw new BusinessException(
                        ErrorCode.CONFLICT, "Check " + checkId + " was superseded by conflict resolution");
            }

            LockAcquireResult decided = lockType == LockType.VIEW
                    ? decideView(check, terminalId)
                    : decideActive(check, terminalId);
            if (decided != null) {
                return decided;
            }

            Instant now = clock.instant();
            int updated = checkJpaRepository.compareAndSetLock(
                    checkId, check.getVersion(), terminalId, employeeId, lockType, now);
            if (updated == 1) {
                log.info("Terminal {} acquired {} lock on check {}", terminalId, lockType, checkId);
                eventPublisherHelper.publishLockAcquired(this, checkId, terminalId);
                return LockAcquireResult.builder()
                        .checkId(checkId)
                        .outcome(LockOutcome.GRANTED)
                        .lockType(lockType)
                        .holderTerminalId(terminalId)
                        .holderEmployeeId(employeeId)
                        .holderReachable(true)
                        .indicator(LockIndicator.GREEN)
                        .build();
            }
            log.debug("Lock CAS on check {} lost race (attempt {}/{})", checkId, attempt, MAX_CAS_ATTEMPTS);
        }
        throw new LockConflictException(
                checkId, null, "Could not acquire lock on check " + checkId + " after " + MAX_CAS_ATTEMPTS + " attempts");
    }

    /** Returns null when the requester should go ahead with a compare-and-swap. */
    private LockAcquireResult decideActive(CheckEntity check, String terminalId) {
        if (!check.isLocked() || check.getLockType() == LockType.VIEW) {
            return null;
        }
        if (check.isActiveLockHeldBy(terminalId)) {
            return heldResult(check, LockOutcome.ALREADY_HELD, true, LockIndicator.GREEN, null);
        }
        boolean reachable = isHolderReachable(check.getLockHolderTerminalId());
        return reachable
                ? heldResult(check, LockOutcome.IN_USE, true, LockIndicator.YELLOW,
                        "Check is open on terminal " + check.getLockHolderTerminalId())
                : heldResult(check, LockOutcome.HOLDER_OFFLINE, false, LockIndicator.RED,
                        "Terminal " + check.getLockHolderTerminalId() + " holding this check is unreachable");
    }

    private LockAcquireResult decideView(CheckEntity check, String terminalId) {
        if (!check.isLocked()) {
            return null;
        }
        if (terminalId.equals(check.getLockHolderTerminalId())) {
            return heldResult(check, LockOutcome.ALREADY_HELD, true, LockIndicator.GREEN, null);
        }
        boolean reachable = check.getLockType() != LockType.ACTIVE
                || isHolderReachable(check.getLockHolderTerminalId());
        return heldResult(
                check,
                LockOutcome.VIEW_ONLY,
                reachable,
                indicatorFor(check, terminalId, reachable),
                "Read-only view, check is held by terminal " + check.getLockHolderTerminalId());
    }

    private static LockAcquireResult heldResult(
            CheckEntity check, LockOutcome outcome, boolean reachable, LockIndicator indicator, String message) {
        return LockAcquireResult.builder()
                .checkId(check.getId())
                .outcome(outcome)
                .lockType(check.getLockType())
                .holderTerminalId(check.getLockHolderTerminalId())
                .holderEmployeeId(check.getLockHolderEmployeeId())
                .holderReachable(reachable)
                .indicator(indicator)
                .message(message)
                .build();
    }

    /**
     * Releases the lock if {@code terminalId} holds it. When a manager-approved handoff is
     * waiting on this check, the lock passes straight to the requesting terminal in the same
     * compare-and-swap, so nobody else can slip in between.
     *
     * @return true if a lock was released
     */
    public boolean release(String checkId, String terminalId) {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            CheckEntity check = requireCheck(checkId);
            if (!terminalId.equals(check.getLockHolderTerminalId())) {
                return false;
            }
            boolean handingOff = check.hasPendingHandoff() && check.getLockType() == LockType.ACTIVE;
            int updated = handingOff
                    ? checkJpaRepository.compareAndSetLock(
                            checkId,
                            check.getVersion(),
                            check.getHandoffToTerminalId(),
                            check.getHandoffToEmployeeId(),
                            LockType.ACTIVE,
                            clock.instant())
                    : checkJpaRepository.compareAndSetLock(checkId, check.getVersion(), null, null, null, null);
            if (updated == 1) {
                log.info("Terminal {} released lock on check {}", terminalId, checkId);
                eventPublisherHelper.publishLockReleased(this, checkId, terminalId);
                if (handingOff) {
                    completeHandoff(check, terminalId);
                }
                return true;
            }
        }
        throw new LockConflictException(checkId, terminalId, "Could not release lock on check " + checkId);
    }

    public LockStatusView getLockStatus(String checkId, String requestingTerminalId) {
        CheckEntity check = requireCheck(checkId);
        boolean reachable = !check.isLocked()
                || check.getLockHolderTerminalId().equals(requestingTerminalId)
                || isHolderReachable(check.getLockHolderTerminalId());
        return LockStatusView.builder()
                .checkId(checkId)
                .holderTerminalId(check.getLockHolderTerminalId())
                .holderEmployeeId(check.getLockHolderEmployeeId())
                .lockType(check.getLockType())
                .acquiredAt(check.getLockAcquiredAt())
                .holderReachable(reachable)
                .indicator(indicatorFor(check, requestingTerminalId, reachable))
                .conflictState(check.getConflictState())
                .handoffToTerminalId(check.getHandoffToTerminalId())
                .build();
    }

    private static LockIndicator indicatorFor(CheckEntity check, String requestingTerminalId, boolean reachable) {
        if (!check.isLocked()
                || check.getLockType() == LockType.VIEW
                || check.getLockHolderTerminalId().equals(requestingTerminalId)) {
            return LockIndicator.GREEN;
        }
        return reachable ? LockIndicator.YELLOW : LockIndicator.RED;
    }

    boolean isHolderReachable(String holderTerminalId) {
        return connectivityGuard.isLockSharingAvailable() && terminalPresenceService.isReachable(holderTerminalId);
    }

    // ---- Override ----

    private void completeHandoff(CheckEntity check, String previousHolder) {
        String checkId = check.getId();
        String requester = check.getHandoffToTerminalId();
        auditService.log(
                "CHECK_LOCK",
                "CHECK",
                checkId,
                "LOCK_HANDED_OFF",
                check.getHandoffApprovedBy(),
                requester,
                Map.of("previousHolderTerminalId", previousHolder));
        eventPublisherHelper.publishLockOverridden(this, checkId, requester, previousHolder);
        log.info("Check {} handed off from terminal {} to {} (approved by {})",
                checkId, previousHolder, requester, check.getHandoffApprovedBy());
    }

    /**
     * Manager override of another terminal's lock.
     *
     * <p>Reachable holder: the handoff is recorded on the check and the holder is asked to flush
     * its edits and release. The lock stays with the holder until it does; its release then
     * moves the lock to the requester. Unreachable holder: the requester must acknowledge the
     * risk, then the check is forked into a conflict clone the requester can keep working on.
     */
    public OverrideResult override(OverrideCommand command) {
        EmployeeEntity manager = managerApprovalService.verify(command.getManagerEmployeeId(), command.getManagerPin());
        String checkId = command.getCheckId();
        String requester = command.getRequestingTerminalId();

        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            CheckEntity check = requireCheck(checkId);
            if (check.getConflictState() == ConflictState.SUPERSEDED) {
                throw new BusinessException(
                        ErrorCode.CONFLICT, "Check " + checkId + " was superseded by conflict resolution");
            }

            String holder = check.getLockHolderTerminalId();
            if (!check.isLocked() || check.getLockType() == LockType.VIEW || requester.equals(holder)) {
                LockAcquireResult acquired =
                        acquire(checkId, requester, command.getRequestingEmployeeId(), LockType.ACTIVE);
                if (acquired.getOutcome() != LockOutcome.GRANTED
                        && acquired.getOutcome() != LockOutcome.ALREADY_HELD) {
                    // another terminal took it first; decide again against the new holder
                    continue;
                }
                return OverrideResult.builder()
                        .outcome(OverrideOutcome.GRANTED)
                        .originalCheckId(checkId)
                        .checkId(checkId)
                        .build();
            }

            if (isHolderReachable(holder)) {
                int updated = checkJpaRepository.compareAndRequestHandoff(
                        checkId, check.getVersion(), requester, command.getRequestingEmployeeId(), manager.getId());
                if (updated != 1) {
                    continue;
                }
                lockHandoffNotifier.requestHandoff(checkId, holder, requester);
                auditService.log(
                        "CHECK_LOCK",
                        "CHECK",
                        checkId,
                        "LOCK_HANDOFF_REQUESTED",
                        manager.getId(),
                        requester,
                        Map.of("lockHolderTerminalId", holder));
                log.info("Terminal {} asked to hand check {} off to {} (approved by {})",
                        holder, checkId, requester, manager.getId());
                return OverrideResult.builder()
                        .outcome(OverrideOutcome.HANDOFF_REQUESTED)
                        .originalCheckId(checkId)
                        .checkId(checkId)
                        .previousHolderTerminalId(holder)
                        .build();
            }

            if (!command.isRiskAcknowledged()) {
                throw new BusinessException(
                        ErrorCode.RISK_ACKNOWLEDGMENT_REQUIRED,
                        "Terminal " + holder + " is unreachable; overriding will create a conflicting copy of check "
                                + checkId,
                        Map.of("checkId", checkId, "lockHolderTerminalId", holder));
            }

            CheckConflictEntity conflict = conflictReconciliationService.createConflictClone(
                    check, requester, command.getRequestingEmployeeId(), manager.getId());
            return OverrideResult.builder()
                    .outcome(OverrideOutcome.CONFLICT_CLONE_CREATED)
                    .originalCheckId(checkId)
                    .checkId(conflict.getCloneCheckId())
                    .previousHolderTerminalId(holder)
                    .conflictId(conflict.getId())
                    .build();
        }
        throw new LockConflictException(checkId, null, "Could not override lock on check " + checkId);
    }

    // ---- Reconnection ----

    /**
     * Records a terminal heartbeat and, if the terminal just reappeared, surfaces the conflicts
     * it is part of.
     */
    public List<CheckConflictEntity> recordTerminalHeartbeat(String terminalId) {
        boolean reappeared = terminalPresenceService.recordHeartbeat(terminalId);
        return reappeared ? onTerminalReconnected(terminalId) : List.of();
    }

    public List<CheckConflictEntity> onTerminalReconnected(String terminalId) {
        List<CheckConflictEntity> pending = conflictReconciliationService.getPendingConflictsForTerminal(terminalId);
        for (CheckConflictEntity conflict : pending) {
            eventPublisherHelper.publishConflictDetected(this, conflict.getId(), conflict.getOriginalCheckId(), terminalId);
        }
        if (!pending.isEmpty()) {
            log.warn("Terminal {} reconnected with {} unresolved check conflict(s)", terminalId, pending.size());
        }
        return pending;
    }

    /**
     * This terminal regained an authority: surface any conflicts it took part in while away.
     */
    @Async("eventExecutor")
    @EventListener
    public void onConnectivityChanged(ConnectivityEvent event) {
        if (event.isAuthorityRegained()) {
            onTerminalReconnected(terminalConfig.getTerminalId());
        }
    }

    private CheckEntity requireCheck(String checkId) {
        return checkJpaRepository.findById(checkId).orElseThrow(() -> new ResourceNotFoundException("Check", checkId));
    }
}
