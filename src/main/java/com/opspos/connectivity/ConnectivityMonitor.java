package com.opspos.connectivity;

import com.opspos.event.EventPublisherHelper;
import com.opspos.recovery.RecoverableService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Probes cloud, relay host and local peripherals on independent heartbeats and derives the
 * terminal's {@link ConnectivityMode}.
 *
 * <p>Mode precedence is cloud, then relay host, then peripherals. An authority is marked
 * unreachable only after {@code failureThreshold} consecutive misses, so a single dropped
 * heartbeat does not flap the mode; it is marked reachable again on the first success.
 *
 * <p>This service is the single writer of the {@link ConnectivityStatus}. Every heartbeat
 * result is folded into a new immutable snapshot under one lock; mode changes are published
 * as {@link com.opspos.event.ConnectivityEvent}s. Until the first heartbeat lands every
 * authority is assumed unreachable (ISOLATED).
 *
 * <p>The heartbeat loops are explicit scheduled tasks, so the RecoveryManager can stop and
 * restart the monitor; its health check verifies that heartbeats are still being recorded.
 */
@Service
public class ConnectivityMonitor implements RecoverableService {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityMonitor.class);

    public static final String SERVICE_NAME = "connectivity-monitor";

    private final HeartbeatProbe heartbeatProbe;
    private final TaskScheduler taskScheduler;
    private final ConnectivityConfig connectivityConfig;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final AtomicReference<ConnectivityStatus> currentStatus;
    private final Map<Authority, Integer> consecutiveMisses = new EnumMap<>(Authority.class);
    private final Map<Authority, Boolean> reachable = new EnumMap<>(Authority.class);
    private final List<ScheduledFuture<?>> heartbeatTasks = new ArrayList<>();

    private volatile Instant lastHeartbeatAt;
    private volatile boolean running;

    public ConnectivityMonitor(
            HeartbeatProbe heartbeatProbe,
            TaskScheduler taskScheduler,
            ConnectivityConfig connectivityConfig,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.heartbeatProbe = heartbeatProbe;
        this.taskScheduler = taskScheduler;
        this.connectivityConfig = connectivityConfig;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.currentStatus = new AtomicReference<>(ConnectivityStatus.isolated(clock.instant()));
        for (Authority authority : Authority.values()) {
            consecutiveMisses.put(authority, 0);
            reachable.put(authority, false);
        }
    }

    // ---- RecoverableService ----

    @Override
    public String getName() {
        return SERVICE_NAME;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        for (Authority authority : Authority.values()) {
            Duration interval = Duration.ofMillis(connectivityConfig.intervalFor(authority));
            heartbeatTasks.add(taskScheduler.scheduleAtFixedRate(() -> heartbeat(authority), interval));
        }
        lastHeartbeatAt = clock.instant();
        running = true;
        log.info("Connectivity monitor started (mode={})", getMode());
    }

    @Override
    public synchronized void stop() {
        heartbeatTasks.forEach(task -> task.cancel(false));
        heartbeatTasks.clear();
        running = false;
        log.info("Connectivity monitor stopped");
    }

    /**
     * Healthy while running and a heartbeat was recorded within three intervals of the
     * slowest loop.
     */
    @Override
    public boolean healthCheck() {
        if (!running) {
            return false;
        }
        long slowest = 0;
        for (Authority authority : Authority.values()) {
            slowest = Math.max(slowest, connectivityConfig.intervalFor(authority));
        }
        Instant last = lastHeartbeatAt;
        return last != null && Duration.between(last, clock.instant()).toMillis() <= slowest * 3;
    }

    // ---- Heartbeats ----

    /**
     * Probes one authority and records the result. Probe errors count as a miss.
     */
    public void heartbeat(Authority authority) {
        boolean success;
        try {
            success = heartbeatProbe.probe(authority);
        } catch (Exception e) {
            log.debug("Heartbeat probe for {} threw: {}", authority, e.getMessage());
            success = false;
        }
        recordHeartbeat(authority, success);
    }

    /**
     * Testable version: folds one heartbeat result into the connectivity state.
     */
    public synchronized void recordHeartbeat(Authority authority, boolean success) {
        Instant now = clock.instant();
        lastHeartbeatAt = now;

        if (success) {
            consecutiveMisses.put(authority, 0);
            if (!reachable.get(authority)) {
                reachable.put(authority, true);
                log.info("{} reachable", authority);
            }
        } else {
            int misses = consecutiveMisses.get(authority) + 1;
            consecutiveMisses.put(authority, misses);
            if (reachable.get(authority)) {
                if (misses >= connectivityConfig.getFailureThreshold()) {
                    reachable.put(authority, false);
                    log.warn("{} unreachable after {} consecutive missed heartbeats", authority, misses);
                } else {
                    log.debug(
                            "{} missed heartbeat ({}/{})", authority, misses, connectivityConfig.getFailureThreshold());
                }
            }
        }

        publishSnapshot(now);
    }

    private void publishSnapshot(Instant now) {
        boolean cloud = reachable.get(Authority.CLOUD);
        boolean relayHost = reachable.get(Authority.RELAY_HOST);
        boolean peripherals = reachable.get(Authority.PERIPHERALS);

        ConnectivityStatus next = ConnectivityStatus.builder()
                .mode(ConnectivityStatus.deriveMode(cloud, relayHost, peripherals))
                .cloudReachable(cloud)
                .relayHostReachable(relayHost)
                .peripheralsReachable(peripherals)
                .lastChecked(now)
                .build();
        ConnectivityStatus previous = currentStatus.getAndSet(next);

        if (previous.getMode() != next.getMode()) {
            log.info("Connectivity mode transition: {} -> {}", previous.getMode(), next.getMode());
            eventPublisherHelper.publishConnectivityChanged(this, previous, next);
        }
    }

    // ---- Reads ----

    public ConnectivityStatus getStatus() {
        return currentStatus.get();
    }

    public ConnectivityMode getMode() {
        return currentStatus.get().getMode();
    }

    public synchronized int getConsecutiveMisses(Authority authority) {
        return consecutiveMisses.get(authority);
    }

    public boolean isRunning() {
        return running;
    }
}
