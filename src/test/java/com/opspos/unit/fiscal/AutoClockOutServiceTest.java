package com.opspos.unit.fiscal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.opspos.domain.enums.ReplayEntityType;
import com.opspos.domain.enums.ReplayOperation;
import com.opspos.entity.TimePunchEntity;
import com.opspos.fiscal.AutoClockOutService;
import com.opspos.mapper.CheckMapper;
import com.opspos.queue.ReplayQueueService;
import com.opspos.repository.jpa.TimePunchJpaRepository;
import com.opspos.service.AuditService;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AutoClockOutServiceTest {

    @Mock
    private TimePunchJpaRepository timePunchJpaRepository;

    @Mock
    private ReplayQueueService replayQueueService;

    @Mock
    private AuditService auditService;

    private AutoClockOutService autoClockOutService;

    @BeforeEach
    void setUp() {
        autoClockOutService = new AutoClockOutService(
                timePunchJpaRepository, replayQueueService, Mappers.getMapper(CheckMapper.class), auditService);
    }

    @Test
    void clocksOutEveryOpenPunchAndQueuesIt() {
        LocalDate date = LocalDate.of(2024, 3, 15);
        Instant closeAt = Instant.parse("2024-03-16T08:00:00Z");
        TimePunchEntity punch = TimePunchEntity.builder()
                .id("T1")
                .propertyId("P1")
                .employeeId("E1")
                .businessDate(date)
                .clockInAt(Instant.parse("2024-03-15T21:00:00Z"))
                .build();
        when(timePunchJpaRepository.findByPropertyIdAndClockOutAtIsNullAndBusinessDateLessThanEqual("P1", date))
                .thenReturn(List.of(punch));

        int count = autoClockOutService.clockOutOpenPunches("P1", date, closeAt);

        assertThat(count).isEqualTo(1);
        assertThat(punch.getClockOutAt()).isEqualTo(closeAt);
        assertThat(punch.isAutoClockedOut()).isTrue();
        verify(timePunchJpaRepository).save(punch);
        verify(replayQueueService).enqueue(eq(ReplayEntityType.TIME_ENTRY), eq("T1"), eq(ReplayOperation.UPDATE), any());
        verify(auditService).log(eq("TIME_PUNCH"), eq("TIME_PUNCH"), eq("T1"), eq("AUTO_CLOCK_OUT"), eq("E1"),
                isNull(), anyMap());
    }

    @Test
    void nothingOpenNothingQueued() {
        LocalDate date = LocalDate.of(2024, 3, 15);
        when(timePunchJpaRepository.findByPropertyIdAndClockOutAtIsNullAndBusinessDateLessThanEqual("P1", date))
                .thenReturn(List.of());

        assertThat(autoClockOutService.clockOutOpenPunches("P1", date, Instant.now())).isZero();
        verify(replayQueueService, never()).enqueue(any(), any(), any(), any());
    }
}
