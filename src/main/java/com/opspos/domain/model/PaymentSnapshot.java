package com.opspos.domain.model;

import com.opspos.domain.enums.TenderType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentSnapshot {

    private String id;
    private String checkId;
    private TenderType tenderType;
    private BigDecimal amount;
    private BigDecimal tipAmount;
    private String terminalId;
    private Instant createdAt;
}
