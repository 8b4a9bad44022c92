package com.opspos.unit.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.opspos.connectivity.Authority;
import com.opspos.connectivity.ConnectivityGuard;
import com.opspos.connectivity.ConnectivityMode;
import com.opspos.connectivity.ConnectivityStatus;
import com.opspos.domain.enums.ReplayEntityType;
import com.opspos.domain.enums.ReplayOperation;
import com.opspos.entity.ReplayQueueItemEntity;
import com.opspos.event.ConnectivityEvent;
import com.opspos.exception.SyncDispatchException;
import com.opspos.queue.AuthoritativeStoreClient;
import com.opspos.queue.ReplayQueueConfig;
import com.opspos.queue.ReplayQueueService;
import com.opspos.queue.SyncWorker;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

/**
 * Unit tests for SyncWorker against an in-memory authoritative store that applies
 * mutations idempotently per entity.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncWorkerTest {

    @Mock
    private ReplayQueueService replayQueueService;

    @Mock
    private ConnectivityGuard connectivityGuard;

    @Mock
    private TaskScheduler taskScheduler;

    private FakeStore store;
    private SyncWorker syncWorker;

    private final List<ReplayQueueItemEntity> queue = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    @BeforeEach
    void setUp() {
        store = new FakeStore();
        ReplayQueueConfig config = new ReplayQueueConfig();
        config.setBatchSize(10);
        syncWorker = new SyncWorker(
                replayQueueService,
                store,
                connectivityGuard,
                taskScheduler,
                config,
                Clock.fixed(Instant.parse("2024-03-15T16:00:00Z"), ZoneOffset.UTC));

        when(connectivityGuard.getAuthoritativeTarget()).thenReturn(Optional.of(Authority.CLOUD));
        when(replayQueueService.findDrainBatch(anyInt()))
                .thenAnswer(inv -> page(0L, inv.getArgument(0)));
        when(replayQueueService.findDrainBatchAfter(any(), anyInt()))
                .thenAnswer(inv -> page(inv.<ReplayQueueItemEntity>getArgument(0).getId(), inv.getArgument(1)));
        doAnswer(inv -> queue.remove(inv.<ReplayQueueItemEntity>getArgument(0)))
                .when(replayQueueService)
                .markSynced(any());
    }

    private List<ReplayQueueItemEntity> page(long afterId, int size) {
        return queue.stream().filter(item -> item.getId() > afterId).limit(size).collect(Collectors.toList());
    }

    private ReplayQueueItemEntity enqueue(ReplayEntityType type, String entityId, ReplayOperation operation) {
        ReplayQueueItemEntity item = ReplayQueueItemEntity.builder()
                .id(ids.incrementAndGet())
                .entityType(type)
                .entityId(entityId)
                .operation(operation)
                .payload("{\"seq\":" + ids.get() + "}")
                .build();
        queue.add(item);
        return item;
    }

    @Test
    @DisplayName("items are applied in the order they were queued")
    void fifoOrder() {
        enqueue(ReplayEntityType.CHECK, "C1", ReplayOperation.CREATE);
        enqueue(ReplayEntityType.PAYMENT, "PAY1", ReplayOperation.CREATE);
        enqueue(ReplayEntityType.CHECK, "C1", ReplayOperation.UPDATE);

        int synced = syncWorker.drain();

        assertThat(synced).isEqualTo(3);
        assertThat(store.applied).containsExactly("CHECK:C1:CREATE", "PAYMENT:PAY1:CREATE", "CHECK:C1:UPDATE");
        assertThat(queue).isEmpty();
    }

    @Test
    @DisplayName("a failure blocks later items of the same entity but not other entities")
    void perEntityBlocking() {
        ReplayQueueItemEntity create = enqueue(ReplayEntityType.CHECK, "C1", ReplayOperation.CREATE);
        ReplayQueueItemEntity update = enqueue(ReplayEntityType.CHECK, "C1", ReplayOperation.UPDATE);
        enqueue(ReplayEntityType.CHECK, "C2", ReplayOperation.CREATE);
        store.rejecting.add("CHECK:C1");

        int synced = syncWorker.drain();

        assertThat(synced).isEqualTo(1);
        assertThat(store.applied).containsExactly("CHECK:C2:CREATE");
        verify(replayQueueService).markFailed(eq(create), anyString());
        verify(replayQueueService, never()).markSyncing(update);
        assertThat(queue).containsExactly(create, update);
    }

    @Test
    @DisplayName("an entity stuck behind a full batch of its own items does not starve the rest of the queue")
    void stuckEntityDoesNotStarveOthers() {
        ReplayQueueItemEntity head = enqueue(ReplayEntityType.CHECK, "C-STUCK", ReplayOperation.CREATE);
        for (int i = 0; i < 10; i++) {
            enqueue(ReplayEntityType.CHECK, "C-STUCK", ReplayOperation.UPDATE);
        }
        enqueue(ReplayEntityType.CHECK, "C2", ReplayOperation.CREATE);
        store.rejecting.add("CHECK:C-STUCK");

        int synced = syncWorker.drain();

        assertThat(synced).isEqualTo(1);
        assertThat(store.applied).containsExactly("CHECK:C2:CREATE");
        verify(replayQueueService).markFailed(eq(head), anyString());
        verify(replayQueueService).markSyncing(head);
        assertThat(queue).hasSize(11);
    }

    @Test
    @DisplayName("one pass dispatches at most one batch")
    void passStopsAtBatchSize() {
        for (int i = 1; i <= 12; i++) {
            enqueue(ReplayEntityType.CHECK, "C" + i, ReplayOperation.CREATE);
        }

        assertThat(syncWorker.drain()).isEqualTo(10);
        assertThat(queue).hasSize(2);

        assertThat(syncWorker.drain()).isEqualTo(2);
        assertThat(queue).isEmpty();
    }

    @Test
    @DisplayName("a failed item goes through on a later pass once the store accepts it")
    void failedItemRetried() {
        enqueue(ReplayEntityType.TIME_ENTRY, "T1", ReplayOperation.CREATE);
        store.rejecting.add("TIME_ENTRY:T1");
        assertThat(syncWorker.drain()).isZero();

        store.rejecting.clear();

        assertThat(syncWorker.drain()).isEqualTo(1);
        assertThat(queue).isEmpty();
    }

    @Test
    @DisplayName("nothing is dispatched without a reachable authority")
    void noDrainWhenOffline() {
        when(connectivityGuard.getAuthoritativeTarget()).thenReturn(Optional.empty());
        enqueue(ReplayEntityType.CHECK, "C1", ReplayOperation.CREATE);

        assertThat(syncWorker.drain()).isZero();

        verify(replayQueueService, never()).findDrainBatch(anyInt());
        assertThat(store.applied).isEmpty();
        assertThat(queue).hasSize(1);
    }

    @Test
    @DisplayName("in LAN_DEGRADED the relay host receives the replay")
    void relayHostTarget() {
        when(connectivityGuard.getAuthoritativeTarget()).thenReturn(Optional.of(Authority.RELAY_HOST));
        enqueue(ReplayEntityType.CHECK, "C1", ReplayOperation.CREATE);

        syncWorker.drain();

        assertThat(store.targets).containsExactly(Authority.RELAY_HOST);
    }

    @Test
    @DisplayName("a lost acknowledgement re-delivers the item without duplicating it upstream")
    void redeliveryIsIdempotent() {
        ReplayQueueItemEntity item = enqueue(ReplayEntityType.PAYMENT, "PAY1", ReplayOperation.CREATE);
        doThrow(new IllegalStateException("ack lost")).when(replayQueueService).markSynced(item);

        syncWorker.drain();
        doAnswer(inv -> queue.remove(inv.<ReplayQueueItemEntity>getArgument(0)))
                .when(replayQueueService)
                .markSynced(any());
        syncWorker.drain();

        assertThat(store.applied).containsExactly("PAYMENT:PAY1:CREATE", "PAYMENT:PAY1:CREATE");
        assertThat(store.state).hasSize(1);
        assertThat(queue).isEmpty();
    }

    @Test
    @DisplayName("regaining an authority triggers an immediate drain")
    void drainsOnReconnect() {
        enqueue(ReplayEntityType.CHECK, "C1", ReplayOperation.CREATE);
        ConnectivityEvent event = new ConnectivityEvent(
                this,
                ConnectivityStatus.builder().mode(ConnectivityMode.ISOLATED).build(),
                ConnectivityStatus.builder().mode(ConnectivityMode.ONLINE).cloudReachable(true).build());

        syncWorker.onConnectivityChanged(event);

        assertThat(store.applied).containsExactly("CHECK:C1:CREATE");
    }

    /** Upstream store keyed by entity: re-applying the same mutation leaves one row. */
    private static class FakeStore implements AuthoritativeStoreClient {

        final List<String> applied = new ArrayList<>();
        final List<Authority> targets = new ArrayList<>();
        final Map<String, String> state = new LinkedHashMap<>();
        final Set<String> rejecting = new HashSet<>();

        @Override
        public void apply(Authority target, ReplayQueueItemEntity item) {
            if (rejecting.contains(item.entityKey())) {
                throw new SyncDispatchException(item.entityKey() + " rejected by " + target);
            }
            targets.add(target);
            applied.add(item.entityKey() + ":" + item.getOperation());
            state.put(item.entityKey(), item.getPayload());
        }
    }
}
