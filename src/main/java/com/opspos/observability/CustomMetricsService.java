package com.opspos.observability;

import com.opspos.connectivity.ConnectivityMonitor;
import com.opspos.event.CheckLockEvent;
import com.opspos.event.ConnectivityEvent;
import com.opspos.event.CheckLockEventType;
import com.opspos.event.FiscalPeriodEvent;
import com.opspos.event.FiscalPeriodEventType;
import com.opspos.event.RecoveryEvent;
import com.opspos.event.RecoveryEventType;
import com.opspos.queue.ReplayQueueService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers the terminal's custom Micrometer metrics:
 * <ul>
 *   <li><b>replay.backlog</b> (gauge): items waiting in the replay queue</li>
 *   <li><b>replay.failed</b> (gauge): items whose last delivery attempt failed</li>
 *   <li><b>connectivity.mode</b> (gauge): 0 ONLINE, 1 LAN_DEGRADED, 2 LOCAL_ONLY, 3 ISOLATED</li>
 *   <li><b>connectivity.transitions</b> (counter, tagged with the new mode)</li>
 *   <li><b>lock.overrides</b> (counter): manager overrides handed off or forked</li>
 *   <li><b>lock.conflicts</b> (counter): conflict clones created</li>
 *   <li><b>recovery.exhausted</b> (counter): services that gave up recovering</li>
 *   <li><b>fiscal.periods.closed</b> (counter)</li>
 * </ul>
 *
 * <p>Gauges are evaluated by Micrometer on scrape; counters follow application events.
 */
@Service
public class CustomMetricsService {

    private final Counter lockOverrideCounter;
    private final Counter lockConflictCounter;
    private final Counter recoveryExhaustedCounter;
    private final Counter fiscalPeriodsClosedCounter;
    private final MeterRegistry meterRegistry;

    public CustomMetricsService(
            MeterRegistry meterRegistry,
            ReplayQueueService replayQueueService,
            ConnectivityMonitor connectivityMonitor) {
        this.meterRegistry = meterRegistry;
        this.lockOverrideCounter = Counter.builder("lock.overrides")
                .description("Manager overrides of check locks")
                .register(meterRegistry);

        this.lockConflictCounter = Counter.builder("lock.conflicts")
                .description("Conflict clones created by offline overrides")
                .register(meterRegistry);

        this.recoveryExhaustedCounter = Counter.builder("recovery.exhausted")
                .description("Services that exhausted their recovery attempts")
                .register(meterRegistry);

        this.fiscalPeriodsClosedCounter = Counter.builder("fiscal.periods.closed")
                .description("Fiscal periods closed")
                .register(meterRegistry);

        meterRegistry.gauge("replay.backlog", replayQueueService, service -> service.getBacklogSize());
        meterRegistry.gauge("replay.failed", replayQueueService, service -> service.getFailedCount());
        meterRegistry.gauge("connectivity.mode", connectivityMonitor, monitor -> monitor.getMode().ordinal());
    }

    @EventListener
    @Order(20)
    public void onCheckLockEvent(CheckLockEvent event) {
        if (event.getEventType() == CheckLockEventType.OVERRIDDEN) {
            lockOverrideCounter.increment();
        } else if (event.getEventType() == CheckLockEventType.CONFLICT_CREATED) {
            lockOverrideCounter.increment();
            lockConflictCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onConnectivityEvent(ConnectivityEvent event) {
        Counter.builder("connectivity.transitions")
                .description("Connectivity mode changes")
                .tag("mode", event.getCurrentMode().name())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onRecoveryEvent(RecoveryEvent event) {
        if (event.getEventType() == RecoveryEventType.RECOVERY_EXHAUSTED) {
            recoveryExhaustedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onFiscalPeriodEvent(FiscalPeriodEvent event) {
        if (event.getEventType() == FiscalPeriodEventType.CLOSED) {
            fiscalPeriodsClosedCounter.increment();
        }
    }
}
