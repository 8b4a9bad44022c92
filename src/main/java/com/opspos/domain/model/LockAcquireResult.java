package com.opspos.domain.model;

import com.opspos.domain.enums.LockIndicator;
import com.opspos.domain.enums.LockOutcome;
import com.opspos.domain.enums.LockType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a lock request as shown to the requesting terminal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LockAcquireResult {

    private String checkId;
    private LockOutcome outcome;
    private LockType lockType;
    private String holderTerminalId;
    private String holderEmployeeId;
    private boolean holderReachable;
    private LockIndicator indicator;
    private String message;

    public boolean isWritable() {
        return (outcome == LockOutcome.GRANTED || outcome == LockOutcome.ALREADY_HELD) && lockType == LockType.ACTIVE;
    }
}
