package com.opspos.entity;

import com.opspos.domain.enums.ReplayEntityType;
import com.opspos.domain.enums.ReplayItemStatus;
import com.opspos.domain.enums.ReplayOperation;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the replay_queue table.
 *
 * <p>Write-ahead record of a local mutation that the authoritative store has not yet
 * acknowledged. Drained in (created_at, id) order; the identity column breaks ties between
 * items written in the same instant. A row is deleted once acknowledged, so everything in
 * this table is still owed upstream.
 */
@Entity
@Table(
        name = "replay_queue",
        indexes = {
            @Index(name = "idx_replay_status_created", columnList = "status, created_at, id"),
            @Index(name = "idx_replay_entity", columnList = "entity_type, entity_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReplayQueueItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", length = 20, nullable = false)
    private ReplayEntityType entityType;

    @Column(name = "entity_id", length = 36, nullable = false)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    private ReplayOperation operation;

    @Column(columnDefinition = "CLOB")
    private String payload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Builder.Default
    private int attempts = 0;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    @Builder.Default
    private ReplayItemStatus status = ReplayItemStatus.PENDING;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    /** Ordering key for per-entity FIFO. */
    public String entityKey() {
        return entityType + ":" + entityId;
    }
}
