package com.opspos.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Quantity 0 removes the line. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateItemQuantityRequest {

    @NotBlank
    private String terminalId;

    @Min(0)
    private int quantity;
}
