package com.opspos.lock;

import com.opspos.connectivity.ConnectivityConfig;
import com.opspos.repository.redis.TerminalPresenceRedisRepository;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tracks which terminals are alive, as seen by the store authority.
 *
 * <p>Each terminal heartbeat refreshes a presence key with a TTL of
 * {@code failureThreshold x relayHostIntervalMs}, the same window after which the
 * connectivity monitor gives up on an authority. If the presence store itself cannot be
 * read, every holder is treated as unreachable: an unnecessary conflict clone can be
 * reconciled, a wrong "in use" answer would block service.
 */
@Service
public class TerminalPresenceService {

    private static final Logger log = LoggerFactory.getLogger(TerminalPresenceService.class);

    private final TerminalPresenceRedisRepository terminalPresenceRedisRepository;
    private final ConnectivityConfig connectivityConfig;
    private final Clock clock;

    public TerminalPresenceService(
            TerminalPresenceRedisRepository terminalPresenceRedisRepository,
            ConnectivityConfig connectivityConfig,
            Clock clock) {
        this.terminalPresenceRedisRepository = terminalPresenceRedisRepository;
        this.connectivityConfig = connectivityConfig;
        this.clock = clock;
    }

    /**
     * Records a heartbeat from a terminal.
     *
     * @return true if the terminal was not present before this heartbeat
     */
    public boolean recordHeartbeat(String terminalId) {
        try {
            boolean reappeared = terminalPresenceRedisRepository.touch(terminalId, clock.instant(), presenceTtl());
            if (reappeared) {
                log.info("Terminal {} is present", terminalId);
            }
            return reappeared;
        } catch (Exception e) {
            log.warn("Could not record heartbeat for terminal {}: {}", terminalId, e.getMessage());
            return false;
        }
    }

    public boolean isReachable(String terminalId) {
        try {
            return terminalPresenceRedisRepository.isPresent(terminalId);
        } catch (Exception e) {
            log.warn("Presence lookup for terminal {} failed, treating as unreachable: {}", terminalId, e.getMessage());
            return false;
        }
    }

    Duration presenceTtl() {
        return Duration.ofMillis(connectivityConfig.getRelayHostIntervalMs() * connectivityConfig.getFailureThreshold());
    }
}
