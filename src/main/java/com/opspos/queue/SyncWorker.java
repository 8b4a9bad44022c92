package com.opspos.queue;

import com.opspos.connectivity.Authority;
import com.opspos.connectivity.ConnectivityGuard;
import com.opspos.entity.ReplayQueueItemEntity;
import com.opspos.event.ConnectivityEvent;
import com.opspos.recovery.RecoverableService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Drains the replay queue against whichever authoritative store the current mode allows.
 *
 * <p>Every drain interval (and immediately when an authority becomes reachable again) the worker
 * takes the oldest batch, marks each item SYNCING and dispatches it:
 * <ul>
 *   <li>acknowledged -- the item is deleted</li>
 *   <li>rejected or timed out -- attempts+1, errorMessage and FAILED; retried on a later tick</li>
 * </ul>
 *
 * <p>Per-entity FIFO: once an item for an entity fails, later items for the same entity are
 * left untouched for the rest of the pass, so a later UPDATE never overtakes an earlier one.
 * Those held items do not count against the batch size.
 * Only one drain runs at a time.
 *
 * <p>Without a reachable authority (LOCAL_ONLY, ISOLATED) the worker does nothing and the queue
 * simply grows.
 */
@Service
public class SyncWorker implements RecoverableService {

    private static final Logger log = LoggerFactory.getLogger(SyncWorker.class);

    public static final String SERVICE_NAME = "sync-worker";

    private final ReplayQueueService replayQueueService;
    private final AuthoritativeStoreClient authoritativeStoreClient;
    private final ConnectivityGuard connectivityGuard;
    private final TaskScheduler taskScheduler;
    private final ReplayQueueConfig replayQueueConfig;
    private final Clock clock;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> drainTask;
    private volatile Instant lastTickAt;

    public SyncWorker(
            ReplayQueueService replayQueueService,
            AuthoritativeStoreClient authoritativeStoreClient,
            ConnectivityGuard connectivityGuard,
            TaskScheduler taskScheduler,
            ReplayQueueConfig replayQueueConfig,
            Clock clock) {
        this.replayQueueService = replayQueueService;
        this.authoritativeStoreClient = authoritativeStoreClient;
        this.connectivityGuard = connectivityGuard;
        this.taskScheduler = taskScheduler;
        this.replayQueueConfig = replayQueueConfig;
        this.clock = clock;
    }

    // ---- RecoverableService ----

    @Override
    public String getName() {
        return SERVICE_NAME;
    }

    @Override
    public synchronized void start() {
        if (drainTask != null) {
            return;
        }
        drainTask = taskScheduler.scheduleAtFixedRate(
                this::drainSafely, Duration.ofMillis(replayQueueConfig.getDrainIntervalMs()));
        lastTickAt = clock.instant();
        log.info("Sync worker started (interval={}ms, batch={})",
                replayQueueConfig.getDrainIntervalMs(), replayQueueConfig.getBatchSize());
    }

    @Override
    public synchronized void stop() {
        if (drainTask != null) {
            drainTask.cancel(false);
            drainTask = null;
        }
        log.info("Sync worker stopped");
    }

    /** Healthy while scheduled and a tick ran within three drain intervals. */
    @Override
    public boolean healthCheck() {
        Instant last = lastTickAt;
        return drainTask != null
                && !drainTask.isCancelled()
                && last != null
                && Duration.between(last, clock.instant()).toMillis() <= replayQueueConfig.getDrainIntervalMs() * 3;
    }

    // ---- Draining ----

    /**
     * Immediate drain when connectivity is regained, without waiting for the next tick.
     */
    @Async("eventExecutor")
    @EventListener
    public void onConnectivityChanged(ConnectivityEvent event) {
        if (event.getCurrentMode().hasAuthoritativeTarget()
                && event.getPreviousMode() != event.getCurrentMode()) {
            log.info("Connectivity now {}, draining replay queue", event.getCurrentMode());
            drainSafely();
        }
    }

    private void drainSafely() {
        try {
            drain();
        } catch (Exception e) {
            log.error("Replay drain failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one drain pass.
     *
     * @return number of items acknowledged and removed
     */
    public int drain() {
        if (!draining.compareAndSet(false, true)) {
            log.debug("Drain already in progress, skipping");
            return 0;
        }
        try {
            lastTickAt = clock.instant();
            Optional<Authority> target = connectivityGuard.getAuthoritativeTarget();
            if (target.isEmpty()) {
                log.debug("No authoritative store reachable, replay deferred");
                return 0;
            }
            return drainBatch(target.get());
        } finally {
            draining.set(false);
        }
    }

    /**
     * Dispatches up to one batch of items. Items of an entity blocked earlier in the pass are
     * skipped without using up the batch, and further pages are read until the batch is spent
     * or the queue runs out, so a stuck entity with a long backlog cannot starve the others.
     */
    private int drainBatch(Authority target) {
        int batchSize = replayQueueConfig.getBatchSize();
        List<ReplayQueueItemEntity> page = replayQueueService.findDrainBatch(batchSize);
        if (page.isEmpty()) {
            return 0;
        }

        Set<String> blockedEntities = new HashSet<>();
        int synced = 0;
        int failed = 0;
        int skipped = 0;

        while (!page.isEmpty()) {
            for (ReplayQueueItemEntity item : page) {
                if (synced + failed == batchSize) {
                    break;
                }
                if (blockedEntities.contains(item.entityKey())) {
                    skipped++;
                    continue;
                }
                if (dispatch(target, item)) {
                    synced++;
                } else {
                    blockedEntities.add(item.entityKey());
                    failed++;
                }
            }
            if (synced + failed == batchSize || page.size() < batchSize) {
                break;
            }
            page = replayQueueService.findDrainBatchAfter(page.get(page.size() - 1), batchSize);
        }

        log.info("Replay drain to {}: {} synced, {} failed, {} held behind a failed item",
                target, synced, failed, skipped);
        return synced;
    }

    private boolean dispatch(Authority target, ReplayQueueItemEntity item) {
        replayQueueService.markSyncing(item);
        try {
            authoritativeStoreClient.apply(target, item);
            replayQueueService.markSynced(item);
            return true;
        } catch (Exception e) {
            replayQueueService.markFailed(item, e.getMessage());
            log.warn(
                    "Replay of {} {} {} failed (attempt {}): {}",
                    item.getOperation(),
                    item.getEntityType(),
                    item.getEntityId(),
                    item.getAttempts(),
                    e.getMessage());
            return false;
        }
    }

    public boolean isDraining() {
        return draining.get();
    }
}
