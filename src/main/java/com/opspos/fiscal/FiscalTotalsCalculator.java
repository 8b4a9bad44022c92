package com.opspos.fiscal;

import com.opspos.domain.enums.CheckStatus;
import com.opspos.domain.enums.ConflictState;
import com.opspos.domain.enums.TenderType;
import com.opspos.domain.model.FiscalTotals;
import com.opspos.entity.CheckEntity;
import com.opspos.entity.PaymentEntity;
import com.opspos.repository.jpa.CheckJpaRepository;
import com.opspos.repository.jpa.PaymentJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Aggregates the closed checks of one business date. Unresolved conflict clones and
 * superseded copies are left out so a forked check is never counted twice.
 */
@Component
public class FiscalTotalsCalculator {

    private final CheckJpaRepository checkJpaRepository;
    private final PaymentJpaRepository paymentJpaRepository;

    public FiscalTotalsCalculator(CheckJpaRepository checkJpaRepository, PaymentJpaRepository paymentJpaRepository) {
        this.checkJpaRepository = checkJpaRepository;
        this.paymentJpaRepository = paymentJpaRepository;
    }

    public FiscalTotals calculate(String propertyId, LocalDate businessDate) {
        List<CheckEntity> checks =
                checkJpaRepository.findByPropertyIdAndBusinessDateAndStatus(propertyId, businessDate, CheckStatus.CLOSED)
                        .stream()
                        .filter(check -> check.getConflictState() != ConflictState.CONFLICT_CLONE
                                && check.getConflictState() != ConflictState.SUPERSEDED)
                        .collect(Collectors.toList());

        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal discounts = BigDecimal.ZERO;
        BigDecimal tax = BigDecimal.ZERO;
        BigDecimal tips = BigDecimal.ZERO;
        int guests = 0;
        for (CheckEntity check : checks) {
            gross = gross.add(orZero(check.getSubtotal()));
            discounts = discounts.add(orZero(check.getDiscountTotal()));
            tax = tax.add(orZero(check.getTaxTotal()));
            tips = tips.add(orZero(check.getTipTotal()));
            guests += check.getGuestCount() != null ? check.getGuestCount() : 0;
        }

        BigDecimal cash = BigDecimal.ZERO;
        BigDecimal card = BigDecimal.ZERO;
        if (!checks.isEmpty()) {
            List<String> checkIds = checks.stream().map(CheckEntity::getId).collect(Collectors.toList());
            for (PaymentEntity payment : paymentJpaRepository.findByCheckIdIn(checkIds)) {
                if (payment.getTenderType() == TenderType.CASH) {
                    cash = cash.add(orZero(payment.getAmount()));
                } else if (payment.getTenderType() == TenderType.CARD) {
                    card = card.add(orZero(payment.getAmount()));
                }
            }
        }

        return FiscalTotals.builder()
                .grossSales(gross)
                .netSales(gross.subtract(discounts))
                .taxCollected(tax)
                .discountsTotal(discounts)
                .tipsTotal(tips)
                .cashTotal(cash)
                .cardTotal(card)
                .checkCount(checks.size())
                .guestCount(guests)
                .build();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
