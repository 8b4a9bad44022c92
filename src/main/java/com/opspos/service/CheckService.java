package com.opspos.service;

import com.opspos.calendar.BusinessDateService;
import com.opspos.domain.enums.CheckStatus;
import com.opspos.domain.enums.ConflictState;
import com.opspos.domain.enums.LockType;
import com.opspos.domain.enums.ReplayEntityType;
import com.opspos.domain.enums.ReplayOperation;
import com.opspos.domain.enums.TenderType;
import com.opspos.domain.model.CheckSnapshot;
import com.opspos.entity.CheckEntity;
import com.opspos.entity.CheckItemEntity;
import com.opspos.entity.PaymentEntity;
import com.opspos.entity.PropertyEntity;
import com.opspos.event.EventPublisherHelper;
import com.opspos.exception.BusinessException;
import com.opspos.exception.ErrorCode;
import com.opspos.exception.LockConflictException;
import com.opspos.exception.ResourceNotFoundException;
import com.opspos.mapper.CheckMapper;
import com.opspos.queue.ReplayQueueService;
import com.opspos.repository.jpa.CheckItemJpaRepository;
import com.opspos.repository.jpa.CheckJpaRepository;
import com.opspos.repository.jpa.PaymentJpaRepository;
import com.opspos.repository.jpa.PropertyJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Check mutations performed at a terminal.
 *
 * <p>Every mutation requires the caller to hold the ACTIVE lock on the check and writes its
 * replay item in the same transaction as the local change, so nothing committed locally is
 * ever missing from the replay queue.
 */
@Service
public class CheckService {

    private static final Logger log = LoggerFactory.getLogger(CheckService.class);

    private final CheckJpaRepository checkJpaRepository;
    private final CheckItemJpaRepository checkItemJpaRepository;
    private final PaymentJpaRepository paymentJpaRepository;
    private final PropertyJpaRepository propertyJpaRepository;
    private final BusinessDateService businessDateService;
    private final CheckTotalsCalculator checkTotalsCalculator;
    private final ReplayQueueService replayQueueService;
    private final CheckMapper checkMapper;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public CheckService(
            CheckJpaRepository checkJpaRepository,
            CheckItemJpaRepository checkItemJpaRepository,
            PaymentJpaRepository paymentJpaRepository,
            PropertyJpaRepository propertyJpaRepository,
            BusinessDateService businessDateService,
            CheckTotalsCalculator checkTotalsCalculator,
            ReplayQueueService replayQueueService,
            CheckMapper checkMapper,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.checkJpaRepository = checkJpaRepository;
        this.checkItemJpaRepository = checkItemJpaRepository;
        this.paymentJpaRepository = paymentJpaRepository;
        this.propertyJpaRepository = propertyJpaRepository;
        this.businessDateService = businessDateService;
        this.checkTotalsCalculator = checkTotalsCalculator;
        this.replayQueueService = replayQueueService;
        this.checkMapper = checkMapper;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Opens a check on the property's current business date. The opening terminal holds the
     * ACTIVE lock from the start.
     */
    @Transactional
    public CheckSnapshot openCheck(
            String propertyId, String terminalId, String employeeId, Integer guestCount, BigDecimal taxRate) {
        PropertyEntity property = propertyJpaRepository
                .findById(propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Property", propertyId));
        Instant now = clock.instant();
        LocalDate businessDate = businessDateService.getCurrentBusinessDate(property);

        CheckEntity check = CheckEntity.builder()
                .id(UUID.randomUUID().toString())
                .propertyId(propertyId)
                .businessDate(businessDate)
                .checkNumber(checkJpaRepository.findMaxCheckNumber(propertyId, businessDate) + 1)
                .guestCount(guestCount)
                .openedByEmployeeId(employeeId)
                .taxRate(taxRate != null ? taxRate : BigDecimal.ZERO)
                .lockHolderTerminalId(terminalId)
                .lockHolderEmployeeId(employeeId)
                .lockType(LockType.ACTIVE)
                .lockAcquiredAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        check = checkJpaRepository.save(check);

        replayQueueService.enqueue(ReplayEntityType.CHECK, check.getId(), ReplayOperation.CREATE,
                checkMapper.withItems(check, List.of()));
        eventPublisherHelper.publishLockAcquired(this, check.getId(), terminalId);
        log.info("Check #{} ({}) opened on {} for business date {}",
                check.getCheckNumber(), check.getId(), terminalId, businessDate);
        return checkMapper.withItems(check, List.of());
    }

    @Transactional
    public CheckSnapshot addItem(
            String checkId, String terminalId, String menuItemId, String name, int quantity, BigDecimal unitPrice) {
        CheckEntity check = requireWritable(checkId, terminalId);
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Quantity must be positive");
        }
        checkItemJpaRepository.save(CheckItemEntity.builder()
                .lineItemId(UUID.randomUUID().toString())
                .checkId(checkId)
                .menuItemId(menuItemId)
                .name(name)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .updatedAt(clock.instant())
                .build());
        return saveAndQueue(check);
    }

    /** Quantity 0 removes the line. */
    @Transactional
    public CheckSnapshot updateItemQuantity(String checkId, String terminalId, String lineItemId, int quantity) {
        CheckEntity check = requireWritable(checkId, terminalId);
        if (quantity < 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Quantity must not be negative");
        }
        CheckItemEntity item = checkItemJpaRepository
                .findByCheckIdAndLineItemId(checkId, lineItemId)
                .orElseThrow(() -> new ResourceNotFoundException("CheckItem", lineItemId));
        if (quantity == 0) {
            checkItemJpaRepository.delete(item);
        } else {
            item.setQuantity(quantity);
            item.setUpdatedAt(clock.instant());
            checkItemJpaRepository.save(item);
        }
        return saveAndQueue(check);
    }

    @Transactional
    public CheckSnapshot applyPayment(
            String checkId, String terminalId, TenderType tenderType, BigDecimal amount, BigDecimal tipAmount) {
        CheckEntity check = requireWritable(checkId, terminalId);
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Payment amount must be positive");
        }
        BigDecimal tip = tipAmount != null ? tipAmount : BigDecimal.ZERO;

        PaymentEntity payment = paymentJpaRepository.save(PaymentEntity.builder()
                .id(UUID.randomUUID().toString())
                .checkId(checkId)
                .tenderType(tenderType)
                .amount(amount)
                .tipAmount(tip)
                .terminalId(terminalId)
                .createdAt(clock.instant())
                .build());
        check.setPaidAmount(check.getPaidAmount().add(amount));
        check.setTipTotal(check.getTipTotal().add(tip));
        check.setStatus(CheckStatus.PARTIAL);

        replayQueueService.enqueue(ReplayEntityType.PAYMENT, payment.getId(), ReplayOperation.CREATE,
                checkMapper.toPaymentSnapshot(payment));
        return saveAndQueue(check);
    }

    /**
     * Closes a fully paid check and releases its lock.
     */
    @Transactional
    public CheckSnapshot closeCheck(String checkId, String terminalId) {
        CheckEntity check = requireWritable(checkId, terminalId);
        List<CheckItemEntity> items = checkItemJpaRepository.findByCheckIdOrderByIdAsc(checkId);
        checkTotalsCalculator.recalculate(check, items);
        if (check.getPaidAmount().compareTo(check.getTotal()) < 0) {
            throw new BusinessException(
                    "Check " + checkId + " is not fully paid (" + check.getPaidAmount() + " of " + check.getTotal() + ")");
        }
        Instant now = clock.instant();
        check.setStatus(CheckStatus.CLOSED);
        check.setClosedAt(now);
        check.clearLock();
        CheckSnapshot snapshot = saveAndQueue(check);
        eventPublisherHelper.publishLockReleased(this, checkId, terminalId);
        log.info("Check {} closed by terminal {}", checkId, terminalId);
        return snapshot;
    }

    @Transactional(readOnly = true)
    public CheckSnapshot getCheck(String checkId) {
        CheckEntity check = requireCheck(checkId);
        return checkMapper.withItems(check, checkItemJpaRepository.findByCheckIdOrderByIdAsc(checkId));
    }

    private CheckSnapshot saveAndQueue(CheckEntity check) {
        List<CheckItemEntity> items = checkItemJpaRepository.findByCheckIdOrderByIdAsc(check.getId());
        checkTotalsCalculator.recalculate(check, items);
        check.setUpdatedAt(clock.instant());
        CheckEntity saved = checkJpaRepository.save(check);
        CheckSnapshot snapshot = checkMapper.withItems(saved, items);
        replayQueueService.enqueue(ReplayEntityType.CHECK, saved.getId(), ReplayOperation.UPDATE, snapshot);
        return snapshot;
    }

    private CheckEntity requireWritable(String checkId, String terminalId) {
        CheckEntity check = requireCheck(checkId);
        if (check.getConflictState() == ConflictState.SUPERSEDED) {
            throw new BusinessException(ErrorCode.CONFLICT, "Check " + checkId + " was superseded by conflict resolution");
        }
        if (check.getStatus() == CheckStatus.CLOSED) {
            throw new BusinessException("Check " + checkId + " is closed");
        }
        if (!check.isActiveLockHeldBy(terminalId)) {
            throw new LockConflictException(
                    checkId,
                    check.getLockHolderTerminalId(),
                    "Terminal " + terminalId + " does not hold the active lock on check " + checkId);
        }
        return check;
    }

    private CheckEntity requireCheck(String checkId) {
        return checkJpaRepository.findById(checkId).orElseThrow(() -> new ResourceNotFoundException("Check", checkId));
    }
}
