package com.opspos.recovery;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

/**
 * Supervisor-side bookkeeping for one registered service. Mutated only by the
 * RecoveryManager while holding the record's monitor.
 */
@Getter
@Setter
class ServiceRecord {

    private final RecoverableService service;
    private final CircuitBreaker circuitBreaker;
    private volatile ServiceState state = ServiceState.STOPPED;
    private volatile String lastError;
    private volatile int recoveryAttempts;
    private volatile Instant lastRecoveryAttempt;
    private volatile boolean exhausted;

    ServiceRecord(RecoverableService service, CircuitBreaker circuitBreaker) {
        this.service = service;
        this.circuitBreaker = circuitBreaker;
    }

    String getName() {
        return service.getName();
    }
}
