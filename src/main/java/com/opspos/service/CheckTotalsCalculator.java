package com.opspos.service;

import com.opspos.entity.CheckEntity;
import com.opspos.entity.CheckItemEntity;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Recomputes a check's money columns from its line items.
 * total = subtotal - discounts + tax. Tips are tracked separately and never taxed.
 */
@Component
public class CheckTotalsCalculator {

    public void recalculate(CheckEntity check, List<CheckItemEntity> items) {
        BigDecimal subtotal = BigDecimal.ZERO;
        for (CheckItemEntity item : items) {
            BigDecimal unitPrice = item.getUnitPrice() != null ? item.getUnitPrice() : BigDecimal.ZERO;
            subtotal = subtotal.add(unitPrice.multiply(BigDecimal.valueOf(item.getQuantity())));
        }
        subtotal = subtotal.setScale(2, RoundingMode.HALF_UP);

        BigDecimal discount = orZero(check.getDiscountTotal());
        BigDecimal taxable = subtotal.subtract(discount).max(BigDecimal.ZERO);
        BigDecimal tax = taxable.multiply(orZero(check.getTaxRate())).setScale(2, RoundingMode.HALF_UP);

        check.setSubtotal(subtotal);
        check.setTaxTotal(tax);
        check.setTotal(taxable.add(tax));
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
