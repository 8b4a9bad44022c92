package com.opspos.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manager override of a check lock. {@code riskAcknowledged} must be true when the holder is
 * unreachable, since the override then forks the check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverrideCommand {

    private String checkId;
    private String requestingTerminalId;
    private String requestingEmployeeId;
    private String managerEmployeeId;
    private String managerPin;
    private boolean riskAcknowledged;
}
