package com.opspos.api.dto.request;

import com.opspos.domain.enums.TenderType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tender already accepted at the terminal. Authorisation with the payment processor
 * happens before this request is made.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRequest {

    @NotBlank
    private String terminalId;

    @NotNull
    private TenderType tenderType;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal amount;

    @DecimalMin("0")
    private BigDecimal tipAmount;
}
