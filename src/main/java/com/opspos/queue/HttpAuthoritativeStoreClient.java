package com.opspos.queue;

import com.opspos.connectivity.Authority;
import com.opspos.domain.enums.ReplayOperation;
import com.opspos.entity.ReplayQueueItemEntity;
import com.opspos.exception.SyncDispatchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Replays queue items over HTTP as idempotent upserts.
 *
 * <p>CREATE and UPDATE become {@code PUT /api/sync/{entityType}/{entityId}} carrying the full
 * entity snapshot, DELETE becomes {@code DELETE} on the same path. Because the request carries
 * the whole state keyed by entity id, applying it twice leaves the store as applying it once.
 * Each request also carries an {@code Idempotency-Key} built from the entity's identity and the
 * content of the mutation, so the store can short-circuit exact duplicates.
 *
 * <p>Calls go through the {@code authoritativeStore} circuit breaker; while it is open the
 * worker's dispatches fail fast and the items stay queued.
 */
@Component
public class HttpAuthoritativeStoreClient implements AuthoritativeStoreClient {

    private static final String SYNC_PATH = "/api/sync/{entityType}/{entityId}";

    private final ReplayQueueConfig replayQueueConfig;
    private final RestClient restClient;

    public HttpAuthoritativeStoreClient(ReplayQueueConfig replayQueueConfig) {
        this.replayQueueConfig = replayQueueConfig;
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(replayQueueConfig.getDispatchTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(replayQueueConfig.getDispatchTimeoutMs()));
        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
    }

    @Override
    @CircuitBreaker(name = "authoritativeStore")
    public void apply(Authority target, ReplayQueueItemEntity item) {
        String baseUrl = baseUrlFor(target);
        String entityType = item.getEntityType().getPathSegment();
        try {
            if (item.getOperation() == ReplayOperation.DELETE) {
                restClient
                        .delete()
                        .uri(baseUrl + SYNC_PATH, entityType, item.getEntityId())
                        .header("Idempotency-Key", idempotencyKey(item))
                        .retrieve()
                        .toBodilessEntity();
            } else {
                restClient
                        .put()
                        .uri(baseUrl + SYNC_PATH, entityType, item.getEntityId())
                        .header("Idempotency-Key", idempotencyKey(item))
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(item.getPayload() != null ? item.getPayload() : "{}")
                        .retrieve()
                        .toBodilessEntity();
            }
        } catch (RestClientException e) {
            throw new SyncDispatchException(
                    String.format("%s %s/%s rejected by %s: %s",
                            item.getOperation(), entityType, item.getEntityId(), target, e.getMessage()),
                    e);
        }
    }

    private String baseUrlFor(Authority target) {
        switch (target) {
            case CLOUD:
                return replayQueueConfig.getCloudBaseUrl();
            case RELAY_HOST:
                return replayQueueConfig.getRelayHostBaseUrl();
            default:
                throw new SyncDispatchException("No authoritative store behind " + target);
        }
    }

    /**
     * {@code entityType:entityId:} followed by a SHA-256 over operation and payload. The same
     * mutation of an entity gets the same key however many times it is queued or retried; a
     * later mutation with different content gets a new one.
     */
    public static String idempotencyKey(ReplayQueueItemEntity item) {
        String content = item.getOperation() + "\n" + (item.getPayload() != null ? item.getPayload() : "");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return item.entityKey() + ":" + HexFormat.of().formatHex(hash).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
