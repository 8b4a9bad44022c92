package com.opspos.repository.jpa;

import com.opspos.domain.enums.ReplayEntityType;
import com.opspos.domain.enums.ReplayItemStatus;
import com.opspos.entity.ReplayQueueItemEntity;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the replay_queue table.
 * Batches are read in global creation order (created_at, then id) so replay preserves
 * the order mutations were made in.
 */
@Repository
public interface ReplayQueueItemJpaRepository extends JpaRepository<ReplayQueueItemEntity, Long> {

    List<ReplayQueueItemEntity> findByStatusInOrderByCreatedAtAscIdAsc(
            Collection<ReplayItemStatus> statuses, Pageable pageable);

    @Query("SELECT r FROM ReplayQueueItemEntity r WHERE r.status IN :statuses"
            + " AND (r.createdAt > :createdAt OR (r.createdAt = :createdAt AND r.id > :id))"
            + " ORDER BY r.createdAt ASC, r.id ASC")
    List<ReplayQueueItemEntity> findDrainPageAfter(
            @Param("statuses") Collection<ReplayItemStatus> statuses,
            @Param("createdAt") Instant createdAt,
            @Param("id") Long id,
            Pageable pageable);

    List<ReplayQueueItemEntity> findByEntityTypeAndEntityIdOrderByCreatedAtAscIdAsc(
            ReplayEntityType entityType, String entityId);

    long countByStatus(ReplayItemStatus status);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ReplayQueueItemEntity r SET r.status = :to WHERE r.status = :from")
    int updateStatus(@Param("from") ReplayItemStatus from, @Param("to") ReplayItemStatus to);
}
