package com.opspos.queue;

import com.opspos.domain.enums.ReplayEntityType;
import com.opspos.domain.enums.ReplayItemStatus;
import com.opspos.domain.enums.ReplayOperation;
import com.opspos.domain.model.ReplayQueueStats;
import com.opspos.entity.ReplayQueueItemEntity;
import com.opspos.mapper.JsonHelper;
import com.opspos.repository.jpa.ReplayQueueItemJpaRepository;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable write-ahead queue of local mutations owed to the authoritative store.
 *
 * <p>{@link #enqueue} joins the caller's transaction, so the queue row and the local write
 * commit or roll back together. Items leave the queue only through {@link #markSynced}; a
 * failing item stays visible with its error until it goes through.
 */
@Service
public class ReplayQueueService {

    private static final Logger log = LoggerFactory.getLogger(ReplayQueueService.class);

    private static final int MAX_ERROR_LENGTH = 1000;

    private static final Set<ReplayItemStatus> DELIVERABLE =
            Collections.unmodifiableSet(EnumSet.of(ReplayItemStatus.PENDING, ReplayItemStatus.FAILED));

    private final ReplayQueueItemJpaRepository replayQueueItemJpaRepository;
    private final Clock clock;

    public ReplayQueueService(ReplayQueueItemJpaRepository replayQueueItemJpaRepository, Clock clock) {
        this.replayQueueItemJpaRepository = replayQueueItemJpaRepository;
        this.clock = clock;
    }

    @Transactional
    public ReplayQueueItemEntity enqueue(
            ReplayEntityType entityType, String entityId, ReplayOperation operation, Object payload) {
        ReplayQueueItemEntity item = ReplayQueueItemEntity.builder()
                .entityType(entityType)
                .entityId(entityId)
                .operation(operation)
                .payload(payload instanceof String ? (String) payload : JsonHelper.toJson(payload))
                .createdAt(clock.instant())
                .status(ReplayItemStatus.PENDING)
                .build();
        ReplayQueueItemEntity saved = replayQueueItemJpaRepository.save(item);
        log.debug("Queued {} {} {}", operation, entityType, entityId);
        return saved;
    }

    /**
     * Oldest-first batch of items that still need delivery (pending, or failed and due a retry).
     */
    @Transactional(readOnly = true)
    public List<ReplayQueueItemEntity> findDrainBatch(int batchSize) {
        return replayQueueItemJpaRepository.findByStatusInOrderByCreatedAtAscIdAsc(
                DELIVERABLE, PageRequest.of(0, batchSize));
    }

    /** The page of deliverable items that follows {@code last} in drain order. */
    @Transactional(readOnly = true)
    public List<ReplayQueueItemEntity> findDrainBatchAfter(ReplayQueueItemEntity last, int batchSize) {
        return replayQueueItemJpaRepository.findDrainPageAfter(
                DELIVERABLE, last.getCreatedAt(), last.getId(), PageRequest.of(0, batchSize));
    }

    @Transactional
    public void markSyncing(ReplayQueueItemEntity item) {
        item.setStatus(ReplayItemStatus.SYNCING);
        item.setLastAttemptAt(clock.instant());
        replayQueueItemJpaRepository.save(item);
    }

    /** Acknowledged by the authoritative store: the item is removed. */
    @Transactional
    public void markSynced(ReplayQueueItemEntity item) {
        replayQueueItemJpaRepository.deleteById(item.getId());
    }

    /** Rejected or undeliverable: kept with its error for the next tick. There is no retry cap. */
    @Transactional
    public void markFailed(ReplayQueueItemEntity item, String errorMessage) {
        item.setStatus(ReplayItemStatus.FAILED);
        item.setAttempts(item.getAttempts() + 1);
        item.setLastAttemptAt(clock.instant());
        item.setErrorMessage(truncate(errorMessage));
        replayQueueItemJpaRepository.save(item);
    }

    /**
     * Items left SYNCING by a crash mid-dispatch go back to PENDING. Safe because the
     * store applies them idempotently.
     */
    @Transactional
    public int resetStuckSyncing() {
        int reset = replayQueueItemJpaRepository.updateStatus(ReplayItemStatus.SYNCING, ReplayItemStatus.PENDING);
        if (reset > 0) {
            log.warn("Reset {} replay item(s) stuck in SYNCING back to PENDING", reset);
        }
        return reset;
    }

    @Transactional(readOnly = true)
    public List<ReplayQueueItemEntity> findByEntity(ReplayEntityType entityType, String entityId) {
        return replayQueueItemJpaRepository.findByEntityTypeAndEntityIdOrderByCreatedAtAscIdAsc(entityType, entityId);
    }

    @Transactional(readOnly = true)
    public long getBacklogSize() {
        return replayQueueItemJpaRepository.count();
    }

    @Transactional(readOnly = true)
    public long getFailedCount() {
        return replayQueueItemJpaRepository.countByStatus(ReplayItemStatus.FAILED);
    }

    @Transactional(readOnly = true)
    public ReplayQueueStats getStats() {
        return ReplayQueueStats.builder()
                .pending(replayQueueItemJpaRepository.countByStatus(ReplayItemStatus.PENDING))
                .syncing(replayQueueItemJpaRepository.countByStatus(ReplayItemStatus.SYNCING))
                .failed(replayQueueItemJpaRepository.countByStatus(ReplayItemStatus.FAILED))
                .build();
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
