package com.opspos.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sales totals of one business date, frozen onto the fiscal period when it closes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FiscalTotals {

    @Builder.Default
    private BigDecimal grossSales = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal netSales = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal taxCollected = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal discountsTotal = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal tipsTotal = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal cashTotal = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal cardTotal = BigDecimal.ZERO;

    private int checkCount;
    private int guestCount;
}
