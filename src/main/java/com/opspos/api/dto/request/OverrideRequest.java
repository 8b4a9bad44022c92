package com.opspos.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manager override of a check lock. {@code riskAcknowledged} must be true when the current
 * holder is unreachable: the override then forks the check into a conflict clone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverrideRequest {

    @NotBlank
    private String requestingTerminalId;

    @NotBlank
    private String requestingEmployeeId;

    @NotBlank
    private String managerEmployeeId;

    @NotBlank
    private String managerPin;

    private boolean riskAcknowledged;
}
