package com.opspos.recovery;

import com.opspos.event.RecoveryEvent;
import com.opspos.event.RecoveryEventType;
import com.opspos.exception.BusinessException;
import com.opspos.exception.ErrorCode;
import com.opspos.exception.ResourceNotFoundException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Supervises named {@link RecoverableService}s: health checks, exponential-backoff restarts,
 * and a circuit breaker per service.
 *
 * <p>Lifecycle of a supervised service:
 * <ol>
 *   <li>Every health interval, RUNNING and DEGRADED services are probed. A false result marks
 *       the service DEGRADED, an exception marks it FAILED; both trigger recovery.</li>
 *   <li>Recovery attempt n waits {@code recoveryBackoffMs * 2^(n-1)}, then stops and restarts the
 *       service through its circuit breaker.</li>
 *   <li>The attempt counter only resets after a later healthy check, so a service that starts but
 *       immediately degrades keeps climbing towards the limit.</li>
 *   <li>When {@code maxRecoveryAttempts} is reached the service is left FAILED, RECOVERY_EXHAUSTED
 *       is published once, and nothing retries it until an operator resets it.</li>
 * </ol>
 *
 * <p>One service failing never stops or restarts any other service.
 */
@Service
public class RecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(RecoveryManager.class);

    private final RecoveryConfig recoveryConfig;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;
    private final Sleeper sleeper;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    private final Map<String, ServiceRecord> services = Collections.synchronizedMap(new LinkedHashMap<>());

    @Autowired
    public RecoveryManager(RecoveryConfig recoveryConfig, ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        this(recoveryConfig, applicationEventPublisher, clock, Thread::sleep);
    }

    public RecoveryManager(
            RecoveryConfig recoveryConfig,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock,
            Sleeper sleeper) {
        this.recoveryConfig = recoveryConfig;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
        this.sleeper = sleeper;
        this.circuitBreakerRegistry = CircuitBreakerRegistry.of(buildCircuitBreakerConfig(recoveryConfig));
    }

    // ---- Registration ----

    public void register(RecoverableService service) {
        synchronized (services) {
            if (services.containsKey(service.getName())) {
                throw new BusinessException(
                        ErrorCode.CONFLICT, "Service already registered: " + service.getName());
            }
            CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(service.getName());
            services.put(service.getName(), new ServiceRecord(service, circuitBreaker));
        }
        log.info("Registered recoverable service '{}'", service.getName());
    }

    public void unregister(String name) {
        ServiceRecord record = services.remove(name);
        if (record != null) {
            circuitBreakerRegistry.remove(name);
            log.info("Unregistered recoverable service '{}'", name);
        }
    }

    public boolean isRegistered(String name) {
        return services.containsKey(name);
    }

    // ---- Start / stop ----

    /**
     * Starts a service through its circuit breaker.
     *
     * @return true if the service is RUNNING afterwards
     */
    public boolean startService(String name) {
        ServiceRecord record = requireRecord(name);
        synchronized (record) {
            return doStart(record);
        }
    }

    public void stopService(String name) {
        ServiceRecord record = requireRecord(name);
        synchronized (record) {
            doStop(record);
        }
    }

    /** Starts every registered service in registration order. A failed start does not stop the others. */
    public void startAll() {
        for (ServiceRecord record : snapshot()) {
            synchronized (record) {
                if (record.getState() != ServiceState.RUNNING) {
                    doStart(record);
                }
            }
        }
    }

    /** Stops every registered service in reverse registration order. */
    public void stopAll() {
        List<ServiceRecord> records = snapshot();
        Collections.reverse(records);
        for (ServiceRecord record : records) {
            synchronized (record) {
                if (record.getState() != ServiceState.STOPPED) {
                    doStop(record);
                }
            }
        }
    }

    // ---- Recovery ----

    /**
     * Runs one recovery attempt: backoff, stop, start.
     *
     * @return true if the service is RUNNING after the attempt
     */
    public boolean recoverService(String name) {
        ServiceRecord record = requireRecord(name);
        synchronized (record) {
            return doRecover(record);
        }
    }

    /**
     * Clears exhaustion, attempt counter and circuit breaker so the service can be retried.
     * Operator action; never called automatically.
     */
    public void resetService(String name) {
        ServiceRecord record = requireRecord(name);
        synchronized (record) {
            record.setRecoveryAttempts(0);
            record.setExhausted(false);
            record.getCircuitBreaker().reset();
        }
        log.info("Recovery state reset for service '{}'", name);
    }

    @Scheduled(
            fixedDelayString = "${ops-pos.recovery.health-check-interval-ms:30000}",
            initialDelayString = "${ops-pos.recovery.health-check-interval-ms:30000}")
    public void runHealthChecks() {
        for (ServiceRecord record : snapshot()) {
            try {
                checkService(record.getName());
            } catch (Exception e) {
                log.error("Health loop error for service '{}': {}", record.getName(), e.getMessage(), e);
            }
        }
    }

    /**
     * Testable version: runs one health check (and, if needed, one recovery attempt) for a service.
     */
    public void checkService(String name) {
        ServiceRecord record = requireRecord(name);
        synchronized (record) {
            ServiceState state = record.getState();

            if (state == ServiceState.FAILED) {
                if (!record.isExhausted() && recoveryConfig.isAutoRecoveryEnabled()) {
                    doRecover(record);
                }
                return;
            }
            if (state != ServiceState.RUNNING && state != ServiceState.DEGRADED) {
                return;
            }

            boolean healthy;
            try {
                healthy = record.getService().healthCheck();
            } catch (Exception e) {
                record.setLastError(e.getMessage());
                transition(record, ServiceState.FAILED, RecoveryEventType.FAILED);
                log.warn("Health check of '{}' threw: {}", name, e.getMessage());
                if (recoveryConfig.isAutoRecoveryEnabled()) {
                    doRecover(record);
                }
                return;
            }

            if (healthy) {
                if (state == ServiceState.DEGRADED) {
                    record.setState(ServiceState.RUNNING);
                }
                if (record.getRecoveryAttempts() > 0) {
                    log.info("Service '{}' healthy again, recovery attempts reset", name);
                    record.setRecoveryAttempts(0);
                }
                return;
            }

            record.setLastError("Health check reported unhealthy");
            transition(record, ServiceState.DEGRADED, RecoveryEventType.DEGRADED);
            log.warn("Service '{}' is degraded", name);
            if (recoveryConfig.isAutoRecoveryEnabled()) {
                doRecover(record);
            }
        }
    }

    // ---- Queries ----

    public Optional<ServiceState> getServiceState(String name) {
        ServiceRecord record = services.get(name);
        return Optional.ofNullable(record).map(ServiceRecord::getState);
    }

    public Map<String, ServiceState> getAllStates() {
        Map<String, ServiceState> states = new LinkedHashMap<>();
        for (ServiceRecord record : snapshot()) {
            states.put(record.getName(), record.getState());
        }
        return states;
    }

    public ServiceStats getServiceStats(String name) {
        return toStats(requireRecord(name));
    }

    public List<ServiceStats> getAllServiceStats() {
        List<ServiceStats> stats = new ArrayList<>();
        for (ServiceRecord record : snapshot()) {
            stats.add(toStats(record));
        }
        return stats;
    }

    // ---- Internals (callers hold the record monitor) ----

    private boolean doStart(ServiceRecord record) {
        transition(record, ServiceState.STARTING, RecoveryEventType.STARTING);
        try {
            record.getCircuitBreaker().executeRunnable(record.getService()::start);
            record.setLastError(null);
            transition(record, ServiceState.RUNNING, RecoveryEventType.STARTED);
            log.info("Service '{}' started", record.getName());
            return true;
        } catch (CallNotPermittedException e) {
            record.setLastError("Circuit breaker open");
            transition(record, ServiceState.FAILED, RecoveryEventType.FAILED);
            log.warn("Start of '{}' rejected: circuit breaker open", record.getName());
            return false;
        } catch (Exception e) {
            record.setLastError(e.getMessage());
            transition(record, ServiceState.FAILED, RecoveryEventType.FAILED);
            log.warn("Service '{}' failed to start: {}", record.getName(), e.getMessage());
            return false;
        }
    }

    private void doStop(ServiceRecord record) {
        try {
            record.getService().stop();
        } catch (Exception e) {
            log.warn("Error stopping service '{}': {}", record.getName(), e.getMessage());
        }
        transition(record, ServiceState.STOPPED, RecoveryEventType.STOPPED);
    }

    private boolean doRecover(ServiceRecord record) {
        if (record.isExhausted()) {
            return false;
        }
        if (record.getRecoveryAttempts() >= recoveryConfig.getMaxRecoveryAttempts()) {
            exhaust(record);
            return false;
        }

        int attempt = record.getRecoveryAttempts() + 1;
        record.setRecoveryAttempts(attempt);
        record.setLastRecoveryAttempt(clock.instant());
        long backoffMs = backoffFor(attempt);

        log.info(
                "Recovering service '{}' (attempt {}/{}) after {}ms backoff",
                record.getName(),
                attempt,
                recoveryConfig.getMaxRecoveryAttempts(),
                backoffMs);
        publish(record, RecoveryEventType.RECOVERING, attempt);

        try {
            sleeper.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Recovery of '{}' interrupted during backoff", record.getName());
            return false;
        }

        try {
            record.getService().stop();
        } catch (Exception e) {
            log.debug("Stop before restart of '{}' failed: {}", record.getName(), e.getMessage());
        }

        boolean started = doStart(record);
        if (started) {
            publish(record, RecoveryEventType.RECOVERED, attempt);
            log.info("Service '{}' recovered on attempt {}", record.getName(), attempt);
        } else if (attempt >= recoveryConfig.getMaxRecoveryAttempts()) {
            exhaust(record);
        }
        return started;
    }

    private void exhaust(ServiceRecord record) {
        if (record.isExhausted()) {
            return;
        }
        record.setExhausted(true);
        record.setState(ServiceState.FAILED);
        publish(record, RecoveryEventType.RECOVERY_EXHAUSTED, record.getRecoveryAttempts());
        log.error(
                "Recovery exhausted for service '{}' after {} attempts: {}",
                record.getName(),
                record.getRecoveryAttempts(),
                record.getLastError());
    }

    long backoffFor(int attempt) {
        return recoveryConfig.getRecoveryBackoffMs() * (1L << (attempt - 1));
    }

    private void transition(ServiceRecord record, ServiceState newState, RecoveryEventType eventType) {
        record.setState(newState);
        publish(record, eventType, record.getRecoveryAttempts());
    }

    private void publish(ServiceRecord record, RecoveryEventType eventType, int attempt) {
        applicationEventPublisher.publishEvent(new RecoveryEvent(
                this,
                record.getName(),
                eventType,
                record.getState(),
                attempt,
                record.getLastError(),
                clock.instant()));
    }

    private ServiceStats toStats(ServiceRecord record) {
        CircuitBreaker circuitBreaker = record.getCircuitBreaker();
        return ServiceStats.builder()
                .name(record.getName())
                .state(record.getState())
                .lastError(record.getLastError())
                .recoveryAttempts(record.getRecoveryAttempts())
                .lastRecoveryAttempt(record.getLastRecoveryAttempt())
                .recoveryExhausted(record.isExhausted())
                .circuitBreakerState(circuitBreaker.getState().name())
                .circuitBreakerFailedCalls(circuitBreaker.getMetrics().getNumberOfFailedCalls())
                .build();
    }

    private ServiceRecord requireRecord(String name) {
        ServiceRecord record = services.get(name);
        if (record == null) {
            throw new ResourceNotFoundException("RecoverableService", name);
        }
        return record;
    }

    private List<ServiceRecord> snapshot() {
        synchronized (services) {
            return new ArrayList<>(services.values());
        }
    }

    private static CircuitBreakerConfig buildCircuitBreakerConfig(RecoveryConfig recoveryConfig) {
        RecoveryConfig.CircuitBreaker settings = recoveryConfig.getCircuitBreaker();
        // Count-based window equal to the threshold at 100% failure rate: N consecutive failures open it
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getFailureThreshold())
                .minimumNumberOfCalls(settings.getFailureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(Duration.ofMillis(settings.getOpenDurationMs()))
                .permittedNumberOfCallsInHalfOpenState(settings.getHalfOpenMaxAttempts())
                .build();
    }
}
