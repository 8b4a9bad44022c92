package com.opspos.unit.fiscal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.opspos.calendar.BusinessDateConfig;
import com.opspos.calendar.BusinessDateService;
import com.opspos.domain.enums.FiscalPeriodStatus;
import com.opspos.domain.model.FiscalTotals;
import com.opspos.entity.FiscalPeriodEntity;
import com.opspos.entity.PropertyEntity;
import com.opspos.event.EventPublisherHelper;
import com.opspos.exception.BaseException;
import com.opspos.exception.BusinessException;
import com.opspos.exception.ErrorCode;
import com.opspos.fiscal.AutoClockOutService;
import com.opspos.fiscal.FiscalPeriodOpener;
import com.opspos.fiscal.FiscalPeriodService;
import com.opspos.fiscal.FiscalTotalsCalculator;
import com.opspos.repository.jpa.FiscalPeriodJpaRepository;
import com.opspos.repository.jpa.PropertyJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FiscalPeriodServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-16T08:00:00Z");
    private static final LocalDate MARCH_15 = LocalDate.of(2024, 3, 15);
    private static final LocalDate MARCH_16 = LocalDate.of(2024, 3, 16);

    @Mock
    private FiscalPeriodJpaRepository fiscalPeriodJpaRepository;

    @Mock
    private PropertyJpaRepository propertyJpaRepository;

    @Mock
    private FiscalTotalsCalculator fiscalTotalsCalculator;

    @Mock
    private AutoClockOutService autoClockOutService;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private FiscalPeriodService fiscalPeriodService;
    private PropertyEntity property;

    @BeforeEach
    void setUp() {
        BusinessDateConfig config = new BusinessDateConfig();
        config.setDefaultTimezone("America/New_York");
        config.setDefaultRolloverTime("04:00");
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        fiscalPeriodService = new FiscalPeriodService(
                fiscalPeriodJpaRepository,
                propertyJpaRepository,
                new BusinessDateService(config, clock),
                fiscalTotalsCalculator,
                new FiscalPeriodOpener(fiscalPeriodJpaRepository),
                autoClockOutService,
                eventPublisherHelper,
                clock);

        property = PropertyEntity.builder()
                .id("P1")
                .timezone("America/New_York")
                .rolloverTime("04:00")
                .build();
        when(propertyJpaRepository.findById("P1")).thenReturn(Optional.of(property));
        when(fiscalPeriodJpaRepository.save(any(FiscalPeriodEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        when(fiscalTotalsCalculator.calculate(any(), any())).thenReturn(FiscalTotals.builder()
                .grossSales(new BigDecimal("120.00"))
                .netSales(new BigDecimal("110.00"))
                .checkCount(4)
                .guestCount(9)
                .build());
    }

    private FiscalPeriodEntity period(Long id, LocalDate date, FiscalPeriodStatus status) {
        FiscalPeriodEntity period = FiscalPeriodEntity.builder()
                .id(id)
                .propertyId("P1")
                .businessDate(date)
                .status(status)
                .build();
        when(fiscalPeriodJpaRepository.findById(id)).thenReturn(Optional.of(period));
        when(fiscalPeriodJpaRepository.findByPropertyIdAndBusinessDate("P1", date)).thenReturn(Optional.of(period));
        return period;
    }

    @Nested
    @DisplayName("closePeriod")
    class ClosePeriod {

        @Test
        @DisplayName("freezes totals, advances the business date and opens the next period")
        void closesAndAdvances() {
            FiscalPeriodEntity open = period(1L, MARCH_15, FiscalPeriodStatus.OPEN);

            boolean closed = fiscalPeriodService.closePeriod(1L, NOW, "Closed automatically at rollover");

            assertThat(closed).isTrue();
            assertThat(open.getStatus()).isEqualTo(FiscalPeriodStatus.CLOSED);
            assertThat(open.getClosedAt()).isEqualTo(NOW);
            assertThat(open.getGrossSales()).isEqualByComparingTo("120.00");
            assertThat(open.getCheckCount()).isEqualTo(4);
            assertThat(property.getCurrentBusinessDate()).isEqualTo(MARCH_16);

            ArgumentCaptor<FiscalPeriodEntity> saved = ArgumentCaptor.forClass(FiscalPeriodEntity.class);
            verify(fiscalPeriodJpaRepository, times(2)).save(saved.capture());
            FiscalPeriodEntity next = saved.getAllValues().get(1);
            assertThat(next.getBusinessDate()).isEqualTo(MARCH_16);
            assertThat(next.getStatus()).isEqualTo(FiscalPeriodStatus.OPEN);

            verify(eventPublisherHelper).publishFiscalPeriodOpened(any(), eq("P1"), eq(MARCH_16));
            verify(eventPublisherHelper).publishFiscalPeriodClosed(any(), eq("P1"), eq(MARCH_15));
        }

        @Test
        @DisplayName("a next period opened concurrently elsewhere does not undo the close")
        void concurrentOpenOfNextPeriodTolerated() {
            FiscalPeriodEntity open = period(1L, MARCH_15, FiscalPeriodStatus.OPEN);
            when(fiscalPeriodJpaRepository.save(any(FiscalPeriodEntity.class))).thenAnswer(inv -> {
                FiscalPeriodEntity entity = inv.getArgument(0);
                if (MARCH_16.equals(entity.getBusinessDate())) {
                    throw new DataIntegrityViolationException("duplicate key uk_fiscal_period_property_date");
                }
                return entity;
            });

            boolean closed = fiscalPeriodService.closePeriod(1L, NOW, "close");

            assertThat(closed).isTrue();
            assertThat(open.getStatus()).isEqualTo(FiscalPeriodStatus.CLOSED);
            assertThat(property.getCurrentBusinessDate()).isEqualTo(MARCH_16);
            verify(eventPublisherHelper, never()).publishFiscalPeriodOpened(any(), any(), any());
            verify(eventPublisherHelper).publishFiscalPeriodClosed(any(), eq("P1"), eq(MARCH_15));
        }

        @Test
        @DisplayName("the next period is inserted in a transaction of its own")
        void nextPeriodInsertIsolated() throws Exception {
            Transactional transactional = FiscalPeriodOpener.class
                    .getMethod("open", String.class, LocalDate.class, Instant.class)
                    .getAnnotation(Transactional.class);

            assertThat(transactional).isNotNull();
            assertThat(transactional.propagation()).isEqualTo(Propagation.REQUIRES_NEW);
        }

        @Test
        @DisplayName("an already closed period is left untouched")
        void alreadyClosed() {
            period(1L, MARCH_15, FiscalPeriodStatus.CLOSED);

            assertThat(fiscalPeriodService.closePeriod(1L, NOW, "again")).isFalse();
            verify(fiscalTotalsCalculator, never()).calculate(any(), any());
        }

        @Test
        @DisplayName("auto clock-out runs only when the property enables it")
        void autoClockOut() {
            period(1L, MARCH_15, FiscalPeriodStatus.OPEN);
            property.setAutoClockOutEnabled(true);

            fiscalPeriodService.closePeriod(1L, NOW, "close");

            verify(autoClockOutService).clockOutOpenPunches("P1", MARCH_15, NOW);
        }

        @Test
        @DisplayName("a business date already pinned beyond the next day is not moved back")
        void neverMovesBusinessDateBack() {
            period(1L, MARCH_15, FiscalPeriodStatus.REOPENED);
            property.setCurrentBusinessDate(LocalDate.of(2024, 3, 18));
            when(fiscalPeriodJpaRepository.existsByPropertyIdAndBusinessDate("P1", MARCH_16)).thenReturn(true);

            fiscalPeriodService.closePeriod(1L, NOW, "close");

            assertThat(property.getCurrentBusinessDate()).isEqualTo(LocalDate.of(2024, 3, 18));
            verify(eventPublisherHelper, never()).publishFiscalPeriodOpened(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("ensureOpenPeriod")
    class EnsureOpenPeriod {

        @Test
        @DisplayName("creates a period for the resolved business date when none exists")
        void createsFirstPeriod() {
            Optional<FiscalPeriodEntity> created =
                    fiscalPeriodService.ensureOpenPeriod(property, Instant.parse("2024-03-15T16:00:00Z"));

            assertThat(created).isPresent();
            assertThat(created.get().getBusinessDate()).isEqualTo(MARCH_15);
            assertThat(created.get().getStatus()).isEqualTo(FiscalPeriodStatus.OPEN);
        }

        @Test
        @DisplayName("does nothing when the property already has periods")
        void existingPeriods() {
            when(fiscalPeriodJpaRepository.existsByPropertyId("P1")).thenReturn(true);

            assertThat(fiscalPeriodService.ensureOpenPeriod(property, NOW)).isEmpty();
            verify(fiscalPeriodJpaRepository, never()).save(any());
        }

        @Test
        @DisplayName("startup pass counts created periods and survives a failing property")
        void ensureOpenPeriodsIsolatesFailures() {
            PropertyEntity broken = PropertyEntity.builder().id("BAD").timezone("Nowhere/Void").build();
            when(propertyJpaRepository.findAll()).thenReturn(List.of(broken, property));

            int created = fiscalPeriodService.ensureOpenPeriods(NOW);

            assertThat(created).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Manual close and reopen")
    class ManualOperations {

        @Test
        @DisplayName("manual close refuses to skip an older open period")
        void manualCloseOutOfOrder() {
            FiscalPeriodEntity older = period(1L, MARCH_15, FiscalPeriodStatus.OPEN);
            FiscalPeriodEntity newer = period(2L, MARCH_16, FiscalPeriodStatus.OPEN);
            when(fiscalPeriodJpaRepository.findByPropertyIdAndStatusInOrderByBusinessDateAsc(eq("P1"), anyCollection()))
                    .thenReturn(List.of(older, newer));

            assertThatThrownBy(() -> fiscalPeriodService.closePeriodManually("P1", MARCH_16))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BaseException) e).getErrorCode())
                    .isEqualTo(ErrorCode.BUSINESS_RULE_VIOLATION);
        }

        @Test
        @DisplayName("manual close of the oldest open period succeeds")
        void manualCloseOldest() {
            FiscalPeriodEntity older = period(1L, MARCH_15, FiscalPeriodStatus.OPEN);
            when(fiscalPeriodJpaRepository.findByPropertyIdAndStatusInOrderByBusinessDateAsc(eq("P1"), anyCollection()))
                    .thenReturn(List.of(older));

            FiscalPeriodEntity result = fiscalPeriodService.closePeriodManually("P1", MARCH_15);

            assertThat(result.getStatus()).isEqualTo(FiscalPeriodStatus.CLOSED);
            assertThat(result.getNotes()).isEqualTo("Closed manually");
        }

        @Test
        @DisplayName("closing a closed period is a conflict")
        void manualCloseAlreadyClosed() {
            period(1L, MARCH_15, FiscalPeriodStatus.CLOSED);

            assertThatThrownBy(() -> fiscalPeriodService.closePeriodManually("P1", MARCH_15))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BaseException) e).getErrorCode())
                    .isEqualTo(ErrorCode.CONFLICT);
        }

        @Test
        @DisplayName("only the most recently closed period can be reopened")
        void reopenOnlyLatest() {
            FiscalPeriodEntity first = period(1L, MARCH_15, FiscalPeriodStatus.CLOSED);
            FiscalPeriodEntity second = period(2L, MARCH_16, FiscalPeriodStatus.CLOSED);
            when(fiscalPeriodJpaRepository.findByPropertyIdOrderByBusinessDateDesc("P1"))
                    .thenReturn(List.of(second, first));

            assertThatThrownBy(() -> fiscalPeriodService.reopenPeriod("P1", MARCH_15))
                    .isInstanceOf(BusinessException.class);

            FiscalPeriodEntity reopened = fiscalPeriodService.reopenPeriod("P1", MARCH_16);
            assertThat(reopened.getStatus()).isEqualTo(FiscalPeriodStatus.REOPENED);
            assertThat(reopened.getClosedAt()).isNull();
        }
    }
}
