package com.opspos.unit.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.opspos.repository.redis.TerminalPresenceRedisRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

/**
 * Unit tests for TerminalPresenceRedisRepository.
 * Redis GETSET is modelled by a concurrent map, which has the same atomic swap semantics.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TerminalPresenceRedisRepositoryTest {

    private static final Instant SEEN_AT = Instant.parse("2024-03-15T16:00:00Z");
    private static final Duration TTL = Duration.ofSeconds(15);

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOperations;

    private final Map<String, Object> redis = new ConcurrentHashMap<>();
    private TerminalPresenceRedisRepository repository;

    @BeforeEach
    void setUp() {
        repository = new TerminalPresenceRedisRepository(redisTemplate);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.getAndSet(anyString(), any()))
                .thenAnswer(inv -> redis.put(inv.getArgument(0), inv.getArgument(1)));
    }

    @Test
    @DisplayName("the first touch reports first contact, the next one does not")
    void firstContactOnce() {
        assertThat(repository.touch("T1", SEEN_AT, TTL)).isTrue();
        assertThat(repository.touch("T1", SEEN_AT.plusSeconds(5), TTL)).isFalse();

        assertThat(redis).containsEntry("pos:terminal:presence:T1", SEEN_AT.plusSeconds(5).toString());
        verify(redisTemplate, never()).hasKey(anyString());
    }

    @Test
    @DisplayName("every touch refreshes the expiry")
    void refreshesTtl() {
        repository.touch("T1", SEEN_AT, TTL);

        verify(redisTemplate).expire("pos:terminal:presence:T1", TTL);
    }

    @Test
    @DisplayName("concurrent touches after an absence report first contact exactly once")
    void concurrentTouchesOneFirstContact() throws Exception {
        int relays = 8;
        ExecutorService pool = Executors.newFixedThreadPool(relays);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < relays; i++) {
            Instant seenAt = SEEN_AT.plusMillis(i);
            futures.add(pool.submit(() -> {
                start.await();
                return repository.touch("T1", seenAt, TTL);
            }));
        }
        start.countDown();

        int firstContacts = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(10, TimeUnit.SECONDS)) {
                firstContacts++;
            }
        }
        pool.shutdown();

        assertThat(firstContacts).isEqualTo(1);
    }
}
