package com.opspos.domain.model;

import com.opspos.domain.enums.ConflictState;
import com.opspos.domain.enums.LockIndicator;
import com.opspos.domain.enums.LockType;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LockStatusView {

    private String checkId;
    private String holderTerminalId;
    private String holderEmployeeId;
    private LockType lockType;
    private Instant acquiredAt;
    private boolean holderReachable;
    private LockIndicator indicator;
    private ConflictState conflictState;

    /** Set while a manager-approved handoff waits for the holder to release. */
    private String handoffToTerminalId;
}
