package com.opspos.api.controller;

import com.opspos.domain.enums.ReplayEntityType;
import com.opspos.domain.model.ReplayQueueStats;
import com.opspos.entity.ReplayQueueItemEntity;
import com.opspos.queue.ReplayQueueService;
import com.opspos.queue.SyncWorker;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the replay queue.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/replay-queue/stats -- pending / syncing / failed counts</li>
 *   <li>GET /api/replay-queue/{entityType}/{entityId} -- queued items of one entity, in order</li>
 *   <li>POST /api/replay-queue/drain -- run a drain pass now</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/replay-queue")
public class ReplayQueueController {

    private final ReplayQueueService replayQueueService;
    private final SyncWorker syncWorker;

    public ReplayQueueController(ReplayQueueService replayQueueService, SyncWorker syncWorker) {
        this.replayQueueService = replayQueueService;
        this.syncWorker = syncWorker;
    }

    @GetMapping("/stats")
    public ResponseEntity<ReplayQueueStats> getStats() {
        return ResponseEntity.ok(replayQueueService.getStats());
    }

    @GetMapping("/{entityType}/{entityId}")
    public ResponseEntity<List<ReplayQueueItemEntity>> getEntityItems(
            @PathVariable ReplayEntityType entityType, @PathVariable String entityId) {
        return ResponseEntity.ok(replayQueueService.findByEntity(entityType, entityId));
    }

    @PostMapping("/drain")
    public ResponseEntity<Map<String, Object>> drain() {
        int synced = syncWorker.drain();
        return ResponseEntity.ok(Map.of("synced", synced, "remaining", replayQueueService.getBacklogSize()));
    }
}
