package com.opspos.recovery;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A service that gave up recovering and needs an operator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryAlert {

    private String serviceName;
    private int attempts;
    private String lastError;
    private Instant raisedAt;
}
