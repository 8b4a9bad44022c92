package com.opspos.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.opspos.connectivity.ConnectivityMode;
import com.opspos.connectivity.ConnectivityMonitor;
import com.opspos.connectivity.ConnectivityStatus;
import com.opspos.event.CheckLockEvent;
import com.opspos.event.CheckLockEventType;
import com.opspos.event.ConnectivityEvent;
import com.opspos.event.FiscalPeriodEvent;
import com.opspos.event.FiscalPeriodEventType;
import com.opspos.event.RecoveryEvent;
import com.opspos.event.RecoveryEventType;
import com.opspos.observability.CustomMetricsService;
import com.opspos.queue.ReplayQueueService;
import com.opspos.recovery.ServiceState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Lenient strictness because gauge registration in the constructor reads the mocks, so
 * counter-only tests leave those stubs unused.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CustomMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private CustomMetricsService customMetricsService;

    @Mock
    private ReplayQueueService replayQueueService;

    @Mock
    private ConnectivityMonitor connectivityMonitor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        when(replayQueueService.getBacklogSize()).thenReturn(0L);
        when(replayQueueService.getFailedCount()).thenReturn(0L);
        when(connectivityMonitor.getMode()).thenReturn(ConnectivityMode.ONLINE);
        customMetricsService = new CustomMetricsService(meterRegistry, replayQueueService, connectivityMonitor);
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Nested
    @DisplayName("Counter metrics")
    class CounterMetrics {

        @Test
        @DisplayName("lock.overrides counts handoffs and forks, lock.conflicts only forks")
        void lockCounters() {
            customMetricsService.onCheckLockEvent(
                    new CheckLockEvent(this, CheckLockEventType.OVERRIDDEN, "C1", "T2", "T1", null));
            customMetricsService.onCheckLockEvent(
                    new CheckLockEvent(this, CheckLockEventType.CONFLICT_CREATED, "C1-clone", "T2", "T1", 5L));
            customMetricsService.onCheckLockEvent(
                    new CheckLockEvent(this, CheckLockEventType.ACQUIRED, "C2", "T1", null, null));

            assertThat(counter("lock.overrides")).isEqualTo(2.0);
            assertThat(counter("lock.conflicts")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("recovery.exhausted ignores other recovery events")
        void recoveryExhausted() {
            customMetricsService.onRecoveryEvent(new RecoveryEvent(
                    this, "sync-worker", RecoveryEventType.RECOVERING, ServiceState.DEGRADED, 1, "boom", Instant.now()));
            customMetricsService.onRecoveryEvent(new RecoveryEvent(
                    this, "sync-worker", RecoveryEventType.RECOVERY_EXHAUSTED, ServiceState.FAILED, 3, "boom",
                    Instant.now()));

            assertThat(counter("recovery.exhausted")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("fiscal.periods.closed counts closes only")
        void fiscalClosed() {
            LocalDate date = LocalDate.of(2024, 3, 15);
            customMetricsService.onFiscalPeriodEvent(
                    new FiscalPeriodEvent(this, FiscalPeriodEventType.OPENED, "P1", date));
            customMetricsService.onFiscalPeriodEvent(
                    new FiscalPeriodEvent(this, FiscalPeriodEventType.CLOSED, "P1", date));

            assertThat(counter("fiscal.periods.closed")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("connectivity.transitions is tagged with the new mode")
        void connectivityTransitions() {
            ConnectivityStatus online = ConnectivityStatus.builder().mode(ConnectivityMode.ONLINE).build();
            ConnectivityStatus degraded = ConnectivityStatus.builder().mode(ConnectivityMode.LAN_DEGRADED).build();

            customMetricsService.onConnectivityEvent(new ConnectivityEvent(this, online, degraded));
            customMetricsService.onConnectivityEvent(new ConnectivityEvent(this, degraded, online));
            customMetricsService.onConnectivityEvent(new ConnectivityEvent(this, online, degraded));

            assertThat(meterRegistry.get("connectivity.transitions").tag("mode", "LAN_DEGRADED").counter().count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.get("connectivity.transitions").tag("mode", "ONLINE").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Gauge metrics")
    class GaugeMetrics {

        @Test
        @DisplayName("replay gauges read the queue on scrape")
        void replayGauges() {
            when(replayQueueService.getBacklogSize()).thenReturn(12L);
            when(replayQueueService.getFailedCount()).thenReturn(3L);

            assertThat(meterRegistry.get("replay.backlog").gauge().value()).isEqualTo(12.0);
            assertThat(meterRegistry.get("replay.failed").gauge().value()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("connectivity.mode reports the mode ordinal")
        void connectivityModeGauge() {
            when(connectivityMonitor.getMode()).thenReturn(ConnectivityMode.LOCAL_ONLY);

            assertThat(meterRegistry.get("connectivity.mode").gauge().value()).isEqualTo(2.0);
        }
    }
}
