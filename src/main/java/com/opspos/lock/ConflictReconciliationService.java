package com.opspos.lock;

import com.opspos.domain.enums.ConflictResolution;
import com.opspos.domain.enums.ConflictState;
import com.opspos.domain.enums.ConflictStatus;
import com.opspos.domain.enums.LockType;
import com.opspos.domain.enums.ReplayEntityType;
import com.opspos.domain.enums.ReplayOperation;
import com.opspos.entity.CheckConflictEntity;
import com.opspos.entity.CheckEntity;
import com.opspos.entity.CheckItemEntity;
import com.opspos.entity.PaymentEntity;
import com.opspos.event.EventPublisherHelper;
import com.opspos.exception.BusinessException;
import com.opspos.exception.ErrorCode;
import com.opspos.exception.ResourceNotFoundException;
import com.opspos.mapper.CheckMapper;
import com.opspos.queue.ReplayQueueService;
import com.opspos.repository.jpa.CheckConflictJpaRepository;
import com.opspos.repository.jpa.CheckItemJpaRepository;
import com.opspos.repository.jpa.CheckJpaRepository;
import com.opspos.repository.jpa.PaymentJpaRepository;
import com.opspos.service.AuditService;
import com.opspos.service.CheckTotalsCalculator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates and resolves check conflicts.
 *
 * <p>A conflict starts when a manager overrides the lock of a terminal that cannot be reached:
 * the check is cloned (line-item identities preserved) into a new check owned by the requester,
 * and the original is flagged CONFLICT_PENDING. Both copies may then diverge.
 *
 * <p>Resolution is always a human decision:
 * <ul>
 *   <li>KEEP_ORIGINAL / KEEP_CLONE -- the chosen copy becomes canonical as-is</li>
 *   <li>MERGE -- the clone's line items are folded into the original. Items are matched by
 *       {@code lineItemId}; a line present on both sides is kept once, with the values of the
 *       side modified last</li>
 * </ul>
 * Whatever the choice, payments taken on either copy end up on the canonical check, the
 * canonical check's conflict state returns to NONE and the other copy becomes SUPERSEDED.
 * A resolved conflict cannot be resolved again.
 */
@Service
public class ConflictReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ConflictReconciliationService.class);

    private final CheckJpaRepository checkJpaRepository;
    private final CheckItemJpaRepository checkItemJpaRepository;
    private final PaymentJpaRepository paymentJpaRepository;
    private final CheckConflictJpaRepository checkConflictJpaRepository;
    private final CheckTotalsCalculator checkTotalsCalculator;
    private final ReplayQueueService replayQueueService;
    private final CheckMapper checkMapper;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public ConflictReconciliationService(
            CheckJpaRepository checkJpaRepository,
            CheckItemJpaRepository checkItemJpaRepository,
            PaymentJpaRepository paymentJpaRepository,
            CheckConflictJpaRepository checkConflictJpaRepository,
            CheckTotalsCalculator checkTotalsCalculator,
            ReplayQueueService replayQueueService,
            CheckMapper checkMapper,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.checkJpaRepository = checkJpaRepository;
        this.checkItemJpaRepository = checkItemJpaRepository;
        this.paymentJpaRepository = paymentJpaRepository;
        this.checkConflictJpaRepository = checkConflictJpaRepository;
        this.checkTotalsCalculator = checkTotalsCalculator;
        this.replayQueueService = replayQueueService;
        this.checkMapper = checkMapper;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ---- Creation ----

    /**
     * Forks {@code original} into a clone locked by the requesting terminal and records the conflict.
     */
    @Transactional
    public CheckConflictEntity createConflictClone(
            CheckEntity original, String requestingTerminalId, String requestingEmployeeId, String managerEmployeeId) {
        if (original.getConflictState() != ConflictState.NONE) {
            throw new BusinessException(
                    ErrorCode.CONFLICT,
                    "Check " + original.getId() + " is already in conflict state " + original.getConflictState());
        }

        Instant now = clock.instant();
        String offlineHolder = original.getLockHolderTerminalId();

        CheckEntity clone = original.toBuilder()
                .id(UUID.randomUUID().toString())
                .version(null)
                .lockHolderTerminalId(requestingTerminalId)
                .lockHolderEmployeeId(requestingEmployeeId)
                .lockType(LockType.ACTIVE)
                .lockAcquiredAt(now)
                .handoffToTerminalId(null)
                .handoffToEmployeeId(null)
                .handoffApprovedBy(null)
                .conflictState(ConflictState.CONFLICT_CLONE)
                .clonedFromCheckId(original.getId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        clone = checkJpaRepository.save(clone);

        List<CheckItemEntity> cloneItems = new ArrayList<>();
        for (CheckItemEntity item : checkItemJpaRepository.findByCheckIdOrderByIdAsc(original.getId())) {
            cloneItems.add(item.toBuilder().id(null).checkId(clone.getId()).build());
        }
        cloneItems = checkItemJpaRepository.saveAll(cloneItems);

        original.setConflictState(ConflictState.CONFLICT_PENDING);
        original.setUpdatedAt(now);
        CheckEntity savedOriginal = checkJpaRepository.save(original);

        CheckConflictEntity conflict = checkConflictJpaRepository.save(CheckConflictEntity.builder()
                .originalCheckId(original.getId())
                .cloneCheckId(clone.getId())
                .originalHolderTerminalId(offlineHolder)
                .overridingTerminalId(requestingTerminalId)
                .approvedByEmployeeId(managerEmployeeId)
                .status(ConflictStatus.PENDING)
                .createdAt(now)
                .build());

        replayQueueService.enqueue(
                ReplayEntityType.CHECK, clone.getId(), ReplayOperation.CREATE, checkMapper.withItems(clone, cloneItems));
        replayQueueService.enqueue(
                ReplayEntityType.CHECK,
                savedOriginal.getId(),
                ReplayOperation.UPDATE,
                checkMapper.withItems(savedOriginal, checkItemJpaRepository.findByCheckIdOrderByIdAsc(original.getId())));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("conflictId", conflict.getId());
        details.put("cloneCheckId", clone.getId());
        details.put("offlineHolderTerminalId", offlineHolder);
        auditService.log(
                "CHECK_CONFLICT",
                "CHECK",
                original.getId(),
                "CONFLICT_CLONE_CREATED",
                managerEmployeeId,
                requestingTerminalId,
                details);

        eventPublisherHelper.publishConflictCreated(
                this, conflict.getId(), original.getId(), requestingTerminalId, offlineHolder);
        log.warn(
                "Check {} forked into {} by terminal {} (holder {} unreachable), conflict {}",
                original.getId(),
                clone.getId(),
                requestingTerminalId,
                offlineHolder,
                conflict.getId());
        return conflict;
    }

    // ---- Resolution ----

    @Transactional
    public CheckConflictEntity resolve(Long conflictId, ConflictResolution resolution, String resolvedByEmployeeId) {
        CheckConflictEntity conflict = getConflict(conflictId);
        if (conflict.getStatus() == ConflictStatus.RESOLVED) {
            throw new BusinessException(
                    ErrorCode.CONFLICT,
                    "Conflict " + conflictId + " was already resolved as " + conflict.getResolution(),
                    Map.of("canonicalCheckId", conflict.getCanonicalCheckId()));
        }

        CheckEntity original = requireCheck(conflict.getOriginalCheckId());
        CheckEntity clone = requireCheck(conflict.getCloneCheckId());

        CheckEntity canonical;
        CheckEntity superseded;
        switch (resolution) {
            case KEEP_CLONE:
                canonical = clone;
                superseded = original;
                break;
            case MERGE:
                canonical = original;
                superseded = clone;
                mergeItems(original, clone);
                break;
            case KEEP_ORIGINAL:
            default:
                canonical = original;
                superseded = clone;
                break;
        }

        Instant now = clock.instant();
        consolidatePayments(canonical, superseded);

        canonical.setConflictState(ConflictState.NONE);
        canonical.setUpdatedAt(now);
        superseded.setConflictState(ConflictState.SUPERSEDED);
        superseded.clearLock();
        superseded.setUpdatedAt(now);
        canonical = checkJpaRepository.save(canonical);
        superseded = checkJpaRepository.save(superseded);

        conflict.setStatus(ConflictStatus.RESOLVED);
        conflict.setResolution(resolution);
        conflict.setCanonicalCheckId(canonical.getId());
        conflict.setResolvedByEmployeeId(resolvedByEmployeeId);
        conflict.setResolvedAt(now);
        conflict = checkConflictJpaRepository.save(conflict);

        replayQueueService.enqueue(
                ReplayEntityType.CHECK,
                canonical.getId(),
                ReplayOperation.UPDATE,
                checkMapper.withItems(canonical, checkItemJpaRepository.findByCheckIdOrderByIdAsc(canonical.getId())));
        replayQueueService.enqueue(
                ReplayEntityType.CHECK,
                superseded.getId(),
                ReplayOperation.UPDATE,
                checkMapper.withItems(superseded, checkItemJpaRepository.findByCheckIdOrderByIdAsc(superseded.getId())));

        auditService.log(
                "CHECK_CONFLICT",
                "CHECK",
                canonical.getId(),
                "CONFLICT_RESOLVED_" + resolution.name(),
                resolvedByEmployeeId,
                null,
                Map.of("conflictId", conflictId, "supersededCheckId", superseded.getId()));
        eventPublisherHelper.publishConflictResolved(this, conflictId, canonical.getId());
        log.info(
                "Conflict {} resolved as {}: canonical={}, superseded={}",
                conflictId,
                resolution,
                canonical.getId(),
                superseded.getId());
        return conflict;
    }

    /**
     * Folds the clone's line items into the original. Lines are matched by lineItemId; when both
     * sides carry the same line the more recently modified version wins, so no line is duplicated.
     */
    void mergeItems(CheckEntity original, CheckEntity clone) {
        Map<String, CheckItemEntity> merged = new LinkedHashMap<>();
        for (CheckItemEntity item : checkItemJpaRepository.findByCheckIdOrderByIdAsc(original.getId())) {
            merged.put(item.getLineItemId(), item);
        }

        for (CheckItemEntity cloneItem : checkItemJpaRepository.findByCheckIdOrderByIdAsc(clone.getId())) {
            CheckItemEntity existing = merged.get(cloneItem.getLineItemId());
            if (existing == null) {
                CheckItemEntity added = checkItemJpaRepository.save(
                        cloneItem.toBuilder().id(null).checkId(original.getId()).build());
                merged.put(added.getLineItemId(), added);
            } else if (isNewer(cloneItem, existing)) {
                existing.setQuantity(cloneItem.getQuantity());
                existing.setUnitPrice(cloneItem.getUnitPrice());
                existing.setName(cloneItem.getName());
                existing.setMenuItemId(cloneItem.getMenuItemId());
                existing.setUpdatedAt(cloneItem.getUpdatedAt());
                checkItemJpaRepository.save(existing);
            }
        }

        checkTotalsCalculator.recalculate(original, new ArrayList<>(merged.values()));
    }

    private static boolean isNewer(CheckItemEntity candidate, CheckItemEntity current) {
        if (candidate.getQuantity() == current.getQuantity()
                && candidate.getUnitPrice() != null
                && current.getUnitPrice() != null
                && candidate.getUnitPrice().compareTo(current.getUnitPrice()) == 0) {
            return false;
        }
        if (candidate.getUpdatedAt() == null) {
            return false;
        }
        return current.getUpdatedAt() == null || candidate.getUpdatedAt().isAfter(current.getUpdatedAt());
    }

    private void consolidatePayments(CheckEntity canonical, CheckEntity superseded) {
        List<PaymentEntity> moved = paymentJpaRepository.findByCheckId(superseded.getId());
        for (PaymentEntity payment : moved) {
            payment.setCheckId(canonical.getId());
        }
        if (!moved.isEmpty()) {
            paymentJpaRepository.saveAll(moved);
        }

        BigDecimal paid = BigDecimal.ZERO;
        BigDecimal tips = BigDecimal.ZERO;
        for (PaymentEntity payment : paymentJpaRepository.findByCheckId(canonical.getId())) {
            paid = paid.add(payment.getAmount() != null ? payment.getAmount() : BigDecimal.ZERO);
            tips = tips.add(payment.getTipAmount() != null ? payment.getTipAmount() : BigDecimal.ZERO);
        }
        canonical.setPaidAmount(paid);
        canonical.setTipTotal(tips);
    }

    // ---- Queries ----

    @Transactional(readOnly = true)
    public CheckConflictEntity getConflict(Long conflictId) {
        return checkConflictJpaRepository
                .findById(conflictId)
                .orElseThrow(() -> new ResourceNotFoundException("CheckConflict", conflictId));
    }

    @Transactional(readOnly = true)
    public List<CheckConflictEntity> getPendingConflicts() {
        return checkConflictJpaRepository.findByStatusOrderByCreatedAtAsc(ConflictStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public List<CheckConflictEntity> getPendingConflictsForTerminal(String terminalId) {
        return checkConflictJpaRepository.findByTerminalAndStatus(terminalId, ConflictStatus.PENDING);
    }

    private CheckEntity requireCheck(String checkId) {
        return checkJpaRepository.findById(checkId).orElseThrow(() -> new ResourceNotFoundException("Check", checkId));
    }
}
