package com.opspos.api.dto.request;

import com.opspos.domain.enums.LockType;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lock request for a check. Defaults to an ACTIVE (edit) lock.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LockRequest {

    @NotBlank
    private String terminalId;

    @NotBlank
    private String employeeId;

    @Builder.Default
    private LockType lockType = LockType.ACTIVE;
}
