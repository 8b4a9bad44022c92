package com.opspos.recovery;

import com.opspos.domain.model.ReplayQueueStats;
import com.opspos.queue.ReplayQueueService;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Stops the supervised services in reverse start order before the rest of the context
 * shuts down, and logs what is still waiting in the replay queue. Queued items are durable
 * and are picked up by the next start.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final RecoveryManager recoveryManager;
    private final ReplayQueueService replayQueueService;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(RecoveryManager recoveryManager, ReplayQueueService replayQueueService) {
        this.recoveryManager = recoveryManager;
        this.replayQueueService = replayQueueService;
    }

    @Override
    public void start() {
        running.set(true);
    }

    @Override
    public void stop() {
        log.info("Stopping supervised services");
        try {
            recoveryManager.stopAll();
            logReplayBacklog();
        } catch (RuntimeException e) {
            log.error("Supervised services did not stop cleanly", e);
        } finally {
            running.set(false);
        }
    }

    private void logReplayBacklog() {
        try {
            ReplayQueueStats stats = replayQueueService.getStats();
            if (stats.getTotal() > 0) {
                log.warn("{} replay item(s) still queued at shutdown ({} failed); they will sync after restart",
                        stats.getTotal(), stats.getFailed());
            }
        } catch (Exception e) {
            log.warn("Could not read replay backlog during shutdown", e);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
