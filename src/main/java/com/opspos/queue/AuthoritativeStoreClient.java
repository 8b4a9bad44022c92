package com.opspos.queue;

import com.opspos.connectivity.Authority;
import com.opspos.entity.ReplayQueueItemEntity;

/**
 * Applies one replayed mutation to an authoritative store (cloud or store relay host).
 *
 * <p>Implementations must be idempotent per {@code (entityType, entityId)}: the queue is
 * at-least-once, so the same item can arrive again after a lost acknowledgement. Returning
 * normally means the store has durably accepted the item; any exception means it has not.
 */
public interface AuthoritativeStoreClient {

    void apply(Authority target, ReplayQueueItemEntity item);
}
