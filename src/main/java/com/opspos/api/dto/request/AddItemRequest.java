package com.opspos.api.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddItemRequest {

    @NotBlank
    private String terminalId;

    private String menuItemId;

    @NotBlank
    private String name;

    @Min(1)
    private int quantity;

    @NotNull
    @DecimalMin("0")
    private BigDecimal unitPrice;
}
