package com.opspos.recovery;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator-facing view of a supervised service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceStats {

    private String name;
    private ServiceState state;
    private String lastError;
    private int recoveryAttempts;
    private Instant lastRecoveryAttempt;
    private boolean recoveryExhausted;
    private String circuitBreakerState;
    private int circuitBreakerFailedCalls;
}
