package com.opspos.api.dto.request;

import com.opspos.domain.enums.ConflictResolution;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveConflictRequest {

    @NotNull
    private ConflictResolution resolution;

    @NotBlank
    private String employeeId;
}
