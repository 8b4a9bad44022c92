package com.opspos.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.opspos.calendar.BusinessDateConfig;
import com.opspos.calendar.BusinessDateService;
import com.opspos.config.TerminalConfig;
import com.opspos.connectivity.ConnectivityGuard;
import com.opspos.connectivity.ConnectivityMode;
import com.opspos.connectivity.ConnectivityMonitor;
import com.opspos.domain.enums.CheckStatus;
import com.opspos.domain.enums.ConflictResolution;
import com.opspos.domain.enums.ConflictState;
import com.opspos.domain.enums.ConflictStatus;
import com.opspos.domain.enums.LockOutcome;
import com.opspos.domain.enums.LockType;
import com.opspos.domain.enums.OverrideOutcome;
import com.opspos.domain.enums.TenderType;
import com.opspos.domain.model.CheckSnapshot;
import com.opspos.domain.model.LockAcquireResult;
import com.opspos.domain.model.OverrideCommand;
import com.opspos.domain.model.OverrideResult;
import com.opspos.entity.CheckConflictEntity;
import com.opspos.entity.CheckEntity;
import com.opspos.entity.CheckItemEntity;
import com.opspos.entity.EmployeeEntity;
import com.opspos.entity.PaymentEntity;
import com.opspos.entity.PropertyEntity;
import com.opspos.event.CheckLockEvent;
import com.opspos.event.CheckLockEventType;
import com.opspos.event.EventPublisherHelper;
import com.opspos.exception.BaseException;
import com.opspos.exception.BusinessException;
import com.opspos.exception.ErrorCode;
import com.opspos.lock.CheckLockManager;
import com.opspos.lock.ConflictReconciliationService;
import com.opspos.lock.LockHandoffNotifier;
import com.opspos.lock.ManagerApprovalService;
import com.opspos.lock.TerminalPresenceService;
import com.opspos.mapper.CheckMapper;
import com.opspos.queue.ReplayQueueService;
import com.opspos.repository.jpa.CheckConflictJpaRepository;
import com.opspos.repository.jpa.CheckItemJpaRepository;
import com.opspos.repository.jpa.CheckJpaRepository;
import com.opspos.repository.jpa.EmployeeJpaRepository;
import com.opspos.repository.jpa.PaymentJpaRepository;
import com.opspos.repository.jpa.PropertyJpaRepository;
import com.opspos.service.AuditService;
import com.opspos.service.CheckService;
import com.opspos.service.CheckTotalsCalculator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Cross-service test of an offline lock override.
 * Wires real CheckService + CheckLockManager + ConflictReconciliationService over in-memory
 * tables to verify the sequence: holder drops off -> manager override forks the check -> both
 * copies keep taking orders -> holder reconnects and sees the conflict -> merge -> the losing
 * copy turns read-only while the canonical check closes normally.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OfflineOverrideFlowIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-03-15T23:15:00Z");

    @Mock
    private CheckJpaRepository checkJpaRepository;

    @Mock
    private CheckItemJpaRepository checkItemJpaRepository;

    @Mock
    private PaymentJpaRepository paymentJpaRepository;

    @Mock
    private CheckConflictJpaRepository checkConflictJpaRepository;

    @Mock
    private PropertyJpaRepository propertyJpaRepository;

    @Mock
    private EmployeeJpaRepository employeeJpaRepository;

    @Mock
    private TerminalPresenceService terminalPresenceService;

    @Mock
    private ConnectivityMonitor connectivityMonitor;

    @Mock
    private LockHandoffNotifier lockHandoffNotifier;

    @Mock
    private ReplayQueueService replayQueueService;

    @Mock
    private AuditService auditService;

    private CheckService checkService;
    private CheckLockManager checkLockManager;
    private ConflictReconciliationService conflictReconciliationService;

    private final Map<String, CheckEntity> checks = new HashMap<>();
    private final List<CheckItemEntity> items = new ArrayList<>();
    private final List<PaymentEntity> payments = new ArrayList<>();
    private final Map<Long, CheckConflictEntity> conflicts = new HashMap<>();
    private final List<Object> events = new ArrayList<>();
    private final AtomicLong itemIds = new AtomicLong();
    private final AtomicLong conflictIds = new AtomicLong();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        BusinessDateConfig businessDateConfig = new BusinessDateConfig();
        businessDateConfig.setDefaultTimezone("America/New_York");
        businessDateConfig.setDefaultRolloverTime("04:00");
        TerminalConfig terminalConfig = new TerminalConfig();
        terminalConfig.setTerminalId("T2");

        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(events::add);
        CheckMapper checkMapper = Mappers.getMapper(CheckMapper.class);
        CheckTotalsCalculator checkTotalsCalculator = new CheckTotalsCalculator();

        conflictReconciliationService = new ConflictReconciliationService(
                checkJpaRepository,
                checkItemJpaRepository,
                paymentJpaRepository,
                checkConflictJpaRepository,
                checkTotalsCalculator,
                replayQueueService,
                checkMapper,
                auditService,
                eventPublisherHelper,
                clock);
        checkLockManager = new CheckLockManager(
                checkJpaRepository,
                terminalPresenceService,
                new ConnectivityGuard(connectivityMonitor),
                new ManagerApprovalService(employeeJpaRepository),
                lockHandoffNotifier,
                conflictReconciliationService,
                auditService,
                eventPublisherHelper,
                terminalConfig,
                clock);
        checkService = new CheckService(
                checkJpaRepository,
                checkItemJpaRepository,
                paymentJpaRepository,
                propertyJpaRepository,
                new BusinessDateService(businessDateConfig, clock),
                checkTotalsCalculator,
                replayQueueService,
                checkMapper,
                eventPublisherHelper,
                clock);

        when(connectivityMonitor.getMode()).thenReturn(ConnectivityMode.ONLINE);
        when(terminalPresenceService.isReachable(anyString())).thenReturn(true);
        when(propertyJpaRepository.findById("P1")).thenReturn(Optional.of(PropertyEntity.builder()
                .id("P1")
                .timezone("America/New_York")
                .rolloverTime("04:00")
                .build()));
        when(employeeJpaRepository.findById("MGR")).thenReturn(Optional.of(EmployeeEntity.builder()
                .id("MGR")
                .propertyId("P1")
                .name("Shift Manager")
                .pinHash(ManagerApprovalService.hashPin("2468"))
                .canOverrideLocks(true)
                .active(true)
                .build()));

        stubCheckTable();
        stubItemTable();
        stubPaymentTable();
        stubConflictTable();
    }

    private void stubCheckTable() {
        when(checkJpaRepository.findMaxCheckNumber(eq("P1"), any())).thenReturn(0);
        when(checkJpaRepository.save(any(CheckEntity.class))).thenAnswer(inv -> {
            CheckEntity check = inv.getArgument(0);
            if (check.getVersion() == null) {
                check.setVersion(0L);
            }
            checks.put(check.getId(), check);
            return check;
        });
        when(checkJpaRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(checks.get(inv.<String>getArgument(0))));
        when(checkJpaRepository.compareAndSetLock(anyString(), any(), any(), any(), any(), any()))
                .thenAnswer(inv -> {
                    CheckEntity check = checks.get(inv.<String>getArgument(0));
                    if (check == null || !check.getVersion().equals(inv.getArgument(1))) {
                        return 0;
                    }
                    check.setLockHolderTerminalId(inv.getArgument(2));
                    check.setLockHolderEmployeeId(inv.getArgument(3));
                    check.setLockType(inv.getArgument(4));
                    check.setLockAcquiredAt(inv.getArgument(5));
                    check.setHandoffToTerminalId(null);
                    check.setHandoffToEmployeeId(null);
                    check.setHandoffApprovedBy(null);
                    check.setVersion(check.getVersion() + 1);
                    return 1;
                });
        when(checkJpaRepository.compareAndRequestHandoff(anyString(), any(), any(), any(), any()))
                .thenAnswer(inv -> {
                    CheckEntity check = checks.get(inv.<String>getArgument(0));
                    if (check == null || !check.getVersion().equals(inv.getArgument(1))) {
                        return 0;
                    }
                    check.setHandoffToTerminalId(inv.getArgument(2));
                    check.setHandoffToEmployeeId(inv.getArgument(3));
                    check.setHandoffApprovedBy(inv.getArgument(4));
                    check.setVersion(check.getVersion() + 1);
                    return 1;
                });
    }

    private void stubItemTable() {
        when(checkItemJpaRepository.save(any(CheckItemEntity.class))).thenAnswer(inv -> storeItem(inv.getArgument(0)));
        when(checkItemJpaRepository.saveAll(anyList())).thenAnswer(inv -> {
            List<CheckItemEntity> saved = new ArrayList<>();
            for (Object item : inv.<List<?>>getArgument(0)) {
                saved.add(storeItem((CheckItemEntity) item));
            }
            return saved;
        });
        when(checkItemJpaRepository.findByCheckIdOrderByIdAsc(anyString())).thenAnswer(inv -> items.stream()
                .filter(item -> item.getCheckId().equals(inv.getArgument(0)))
                .sorted(Comparator.comparing(CheckItemEntity::getId))
                .collect(Collectors.toList()));
    }

    private void stubPaymentTable() {
        when(paymentJpaRepository.save(any(PaymentEntity.class))).thenAnswer(inv -> {
            PaymentEntity payment = inv.getArgument(0);
            payments.add(payment);
            return payment;
        });
        when(paymentJpaRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
        when(paymentJpaRepository.findByCheckId(anyString())).thenAnswer(inv -> payments.stream()
                .filter(payment -> payment.getCheckId().equals(inv.getArgument(0)))
                .collect(Collectors.toList()));
    }

    private void stubConflictTable() {
        when(checkConflictJpaRepository.save(any(CheckConflictEntity.class))).thenAnswer(inv -> {
            CheckConflictEntity conflict = inv.getArgument(0);
            if (conflict.getId() == null) {
                conflict.setId(conflictIds.incrementAndGet());
            }
            conflicts.put(conflict.getId(), conflict);
            return conflict;
        });
        when(checkConflictJpaRepository.findById(any()))
                .thenAnswer(inv -> Optional.ofNullable(conflicts.get(inv.<Long>getArgument(0))));
        when(checkConflictJpaRepository.findByTerminalAndStatus(anyString(), any())).thenAnswer(inv -> {
            String terminalId = inv.getArgument(0);
            ConflictStatus status = inv.getArgument(1);
            return conflicts.values().stream()
                    .filter(c -> c.getStatus() == status)
                    .filter(c -> terminalId.equals(c.getOriginalHolderTerminalId())
                            || terminalId.equals(c.getOverridingTerminalId()))
                    .collect(Collectors.toList());
        });
    }

    private CheckItemEntity storeItem(CheckItemEntity item) {
        if (item.getId() == null) {
            item.setId(itemIds.incrementAndGet());
            items.add(item);
        }
        return item;
    }

    private OverrideCommand override(String checkId, boolean riskAcknowledged) {
        return OverrideCommand.builder()
                .checkId(checkId)
                .requestingTerminalId("T2")
                .requestingEmployeeId("E2")
                .managerEmployeeId("MGR")
                .managerPin("2468")
                .riskAcknowledged(riskAcknowledged)
                .build();
    }

    private List<CheckLockEventType> lockEventTypes() {
        return events.stream()
                .filter(CheckLockEvent.class::isInstance)
                .map(event -> ((CheckLockEvent) event).getEventType())
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("offline holder: override forks, both sides ring items, merge keeps one canonical check")
    void offlineOverrideForkAndMerge() {
        // T1 opens the check and rings a burger, then drops off the network
        CheckSnapshot opened = checkService.openCheck("P1", "T1", "E1", 2, null);
        String originalId = opened.getId();
        checkService.addItem(originalId, "T1", "M-BURGER", "Burger", 2, new BigDecimal("12.50"));
        when(terminalPresenceService.isReachable("T1")).thenReturn(false);

        LockAcquireResult attempt = checkLockManager.acquire(originalId, "T2", "E2", LockType.ACTIVE);
        assertThat(attempt.getOutcome()).isEqualTo(LockOutcome.HOLDER_OFFLINE);

        assertThatThrownBy(() -> checkLockManager.override(override(originalId, false)))
                .isInstanceOf(BusinessException.class)
                .satisfies(ex -> assertThat(((BaseException) ex).getErrorCode())
                        .isEqualTo(ErrorCode.RISK_ACKNOWLEDGMENT_REQUIRED));
        assertThat(conflicts).isEmpty();

        OverrideResult forked = checkLockManager.override(override(originalId, true));
        assertThat(forked.getOutcome()).isEqualTo(OverrideOutcome.CONFLICT_CLONE_CREATED);
        String cloneId = forked.getCheckId();
        assertThat(cloneId).isNotEqualTo(originalId);
        assertThat(checks.get(originalId).getConflictState()).isEqualTo(ConflictState.CONFLICT_PENDING);
        assertThat(checks.get(cloneId).getConflictState()).isEqualTo(ConflictState.CONFLICT_CLONE);

        // both copies keep taking orders while the network is split
        CheckSnapshot cloneSide = checkService.addItem(cloneId, "T2", "M-SODA", "Soda", 1, new BigDecimal("3.00"));
        CheckSnapshot originalSide =
                checkService.addItem(originalId, "T1", "M-FRIES", "Fries", 1, new BigDecimal("5.00"));
        assertThat(cloneSide.getItems()).hasSize(2);
        assertThat(originalSide.getItems()).hasSize(2);

        // T1 reappears and is told about the fork
        when(terminalPresenceService.recordHeartbeat("T1")).thenReturn(true);
        when(terminalPresenceService.isReachable("T1")).thenReturn(true);
        List<CheckConflictEntity> pending = checkLockManager.recordTerminalHeartbeat("T1");
        assertThat(pending).hasSize(1);
        assertThat(pending.get(0).getCloneCheckId()).isEqualTo(cloneId);

        CheckConflictEntity resolved =
                conflictReconciliationService.resolve(pending.get(0).getId(), ConflictResolution.MERGE, "MGR");
        assertThat(resolved.getCanonicalCheckId()).isEqualTo(originalId);

        CheckSnapshot canonical = checkService.getCheck(originalId);
        assertThat(canonical.getConflictState()).isEqualTo(ConflictState.NONE);
        assertThat(canonical.getItems())
                .extracting("name")
                .containsExactlyInAnyOrder("Burger", "Fries", "Soda");
        assertThat(canonical.getSubtotal()).isEqualByComparingTo("33.00");

        // the clone is read-only from now on
        assertThatThrownBy(() -> checkService.addItem(cloneId, "T2", "M-SODA", "Soda", 1, BigDecimal.ONE))
                .isInstanceOf(BusinessException.class)
                .satisfies(ex -> assertThat(((BaseException) ex).getErrorCode()).isEqualTo(ErrorCode.CONFLICT));
        assertThat(checks.get(cloneId).isLocked()).isFalse();

        // the canonical check settles and closes normally
        checkService.applyPayment(originalId, "T1", TenderType.CARD, new BigDecimal("33.00"), new BigDecimal("5.00"));
        CheckSnapshot closed = checkService.closeCheck(originalId, "T1");
        assertThat(closed.getStatus()).isEqualTo(CheckStatus.CLOSED);

        assertThat(lockEventTypes())
                .containsSubsequence(
                        CheckLockEventType.ACQUIRED,
                        CheckLockEventType.CONFLICT_CREATED,
                        CheckLockEventType.CONFLICT_DETECTED,
                        CheckLockEventType.CONFLICT_RESOLVED,
                        CheckLockEventType.RELEASED);
        verify(auditService).log(
                eq("CHECK_CONFLICT"), eq("CHECK"), eq(originalId), eq("CONFLICT_CLONE_CREATED"),
                eq("MGR"), eq("T2"), any());
    }

    @Test
    @DisplayName("reachable holder: the lock moves only after the holder flushes and releases")
    void reachableHolderHandsOff() {
        CheckSnapshot opened = checkService.openCheck("P1", "T1", "E1", 4, null);
        String checkId = opened.getId();

        LockAcquireResult attempt = checkLockManager.acquire(checkId, "T2", "E2", LockType.ACTIVE);
        assertThat(attempt.getOutcome()).isEqualTo(LockOutcome.IN_USE);

        OverrideResult result = checkLockManager.override(override(checkId, false));

        assertThat(result.getOutcome()).isEqualTo(OverrideOutcome.HANDOFF_REQUESTED);
        assertThat(result.getCheckId()).isEqualTo(checkId);
        assertThat(conflicts).isEmpty();
        verify(lockHandoffNotifier).requestHandoff(checkId, "T1", "T2");
        assertThat(checkLockManager.getLockStatus(checkId, "T2").getHandoffToTerminalId()).isEqualTo("T2");

        // the holder still owns the check and flushes what it had pending
        assertThat(checks.get(checkId).isActiveLockHeldBy("T1")).isTrue();
        assertThatThrownBy(() -> checkService.addItem(checkId, "T2", "M-SODA", "Soda", 1, BigDecimal.ONE))
                .isInstanceOf(BaseException.class);
        checkService.addItem(checkId, "T1", "M-FRIES", "Fries", 1, BigDecimal.ONE);

        assertThat(checkLockManager.release(checkId, "T1")).isTrue();

        assertThat(checks.get(checkId).isActiveLockHeldBy("T2")).isTrue();
        assertThat(checks.get(checkId).hasPendingHandoff()).isFalse();
        assertThat(lockEventTypes()).containsSubsequence(CheckLockEventType.RELEASED, CheckLockEventType.OVERRIDDEN);
        assertThatThrownBy(() -> checkService.addItem(checkId, "T1", "M-BURGER", "Burger", 1, BigDecimal.TEN))
                .isInstanceOf(BaseException.class);
        CheckSnapshot afterHandoff = checkService.addItem(checkId, "T2", "M-BURGER", "Burger", 1, BigDecimal.TEN);
        assertThat(afterHandoff.getItems()).extracting("name").containsExactlyInAnyOrder("Fries", "Burger");
    }
}
