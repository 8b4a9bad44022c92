package com.opspos.api.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenCheckRequest {

    @NotBlank
    private String propertyId;

    @NotBlank
    private String terminalId;

    @NotBlank
    private String employeeId;

    @PositiveOrZero
    private Integer guestCount;

    /** Fraction, e.g. 0.0875. */
    @DecimalMin("0")
    private BigDecimal taxRate;
}
