package com.opspos.fiscal;

import com.opspos.domain.enums.FiscalPeriodStatus;
import com.opspos.entity.FiscalPeriodEntity;
import com.opspos.repository.jpa.FiscalPeriodJpaRepository;
import java.time.Instant;
import java.time.LocalDate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts a new OPEN fiscal period in its own transaction.
 *
 * <p>A duplicate-key failure (another node opened the same business date first) rolls back only
 * this insert. The caller's close of the previous period is unaffected.
 */
@Component
public class FiscalPeriodOpener {

    private final FiscalPeriodJpaRepository fiscalPeriodJpaRepository;

    public FiscalPeriodOpener(FiscalPeriodJpaRepository fiscalPeriodJpaRepository) {
        this.fiscalPeriodJpaRepository = fiscalPeriodJpaRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FiscalPeriodEntity open(String propertyId, LocalDate businessDate, Instant now) {
        return fiscalPeriodJpaRepository.save(FiscalPeriodEntity.builder()
                .propertyId(propertyId)
                .businessDate(businessDate)
                .status(FiscalPeriodStatus.OPEN)
                .openedAt(now)
                .build());
    }
}
