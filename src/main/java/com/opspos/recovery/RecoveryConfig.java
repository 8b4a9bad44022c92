package com.opspos.recovery;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Supervision settings loaded via the {@code ops-pos.recovery} prefix.
 *
 * <p>Backoff before attempt n is {@code recoveryBackoffMs * 2^(n-1)}. The per-service circuit
 * breaker opens after {@code circuitBreaker.failureThreshold} consecutive failed starts and
 * lets {@code halfOpenMaxAttempts} probe starts through after {@code openDurationMs}.
 */
@Component
@ConfigurationProperties(prefix = "ops-pos.recovery")
public class RecoveryConfig {

    private int maxRecoveryAttempts = 3;
    private long recoveryBackoffMs = 5000;
    private long healthCheckIntervalMs = 30000;
    private boolean autoRecoveryEnabled = true;
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    public int getMaxRecoveryAttempts() {
        return maxRecoveryAttempts;
    }

    public void setMaxRecoveryAttempts(int maxRecoveryAttempts) {
        this.maxRecoveryAttempts = maxRecoveryAttempts;
    }

    public long getRecoveryBackoffMs() {
        return recoveryBackoffMs;
    }

    public void setRecoveryBackoffMs(long recoveryBackoffMs) {
        this.recoveryBackoffMs = recoveryBackoffMs;
    }

    public long getHealthCheckIntervalMs() {
        return healthCheckIntervalMs;
    }

    public void setHealthCheckIntervalMs(long healthCheckIntervalMs) {
        this.healthCheckIntervalMs = healthCheckIntervalMs;
    }

    public boolean isAutoRecoveryEnabled() {
        return autoRecoveryEnabled;
    }

    public void setAutoRecoveryEnabled(boolean autoRecoveryEnabled) {
        this.autoRecoveryEnabled = autoRecoveryEnabled;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    public static class CircuitBreaker {

        private int failureThreshold = 3;
        private long openDurationMs = 30000;
        private int halfOpenMaxAttempts = 2;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getOpenDurationMs() {
            return openDurationMs;
        }

        public void setOpenDurationMs(long openDurationMs) {
            this.openDurationMs = openDurationMs;
        }

        public int getHalfOpenMaxAttempts() {
            return halfOpenMaxAttempts;
        }

        public void setHalfOpenMaxAttempts(int halfOpenMaxAttempts) {
            this.halfOpenMaxAttempts = halfOpenMaxAttempts;
        }
    }
}
