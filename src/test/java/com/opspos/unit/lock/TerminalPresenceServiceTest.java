package com.opspos.unit.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.opspos.connectivity.ConnectivityConfig;
import com.opspos.lock.TerminalPresenceService;
import com.opspos.repository.redis.TerminalPresenceRedisRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

@ExtendWith(MockitoExtension.class)
class TerminalPresenceServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-15T16:00:00Z");

    @Mock
    private TerminalPresenceRedisRepository repository;

    private TerminalPresenceService service;

    @BeforeEach
    void setUp() {
        ConnectivityConfig config = new ConnectivityConfig();
        config.setRelayHostIntervalMs(10_000);
        config.setFailureThreshold(3);
        service = new TerminalPresenceService(repository, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void heartbeatRefreshesKeyForThresholdTimesInterval() {
        when(repository.touch("T1", NOW, Duration.ofSeconds(30))).thenReturn(true);

        assertThat(service.recordHeartbeat("T1")).isTrue();
        verify(repository).touch(eq("T1"), eq(NOW), eq(Duration.ofSeconds(30)));
    }

    @Test
    void presenceStoreFailureMeansUnreachable() {
        when(repository.isPresent("T1")).thenThrow(new RedisConnectionFailureException("relay host down"));

        assertThat(service.isReachable("T1")).isFalse();
    }

    @Test
    void heartbeatFailureIsNotFatal() {
        when(repository.touch(eq("T1"), any(), any())).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(service.recordHeartbeat("T1")).isFalse();
    }

    @Test
    void presentTerminalIsReachable() {
        when(repository.isPresent("T1")).thenReturn(true);

        assertThat(service.isReachable("T1")).isTrue();
    }
}
