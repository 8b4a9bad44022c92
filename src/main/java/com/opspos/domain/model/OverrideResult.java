package com.opspos.domain.model;

import com.opspos.domain.enums.OverrideOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a manager override. {@code checkId} is the check the requester now holds: the
 * original after a handoff, the new clone after an offline override.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverrideResult {

    private OverrideOutcome outcome;
    private String originalCheckId;
    private String checkId;
    private String previousHolderTerminalId;
    private Long conflictId;
}
