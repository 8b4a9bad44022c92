package com.opspos.repository.jpa;

import com.opspos.domain.enums.FiscalPeriodStatus;
import com.opspos.entity.FiscalPeriodEntity;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the fiscal_periods table.
 * Open periods are always read oldest business date first; the scheduler relies on
 * that ordering to close a backlog in sequence.
 */
@Repository
public interface FiscalPeriodJpaRepository extends JpaRepository<FiscalPeriodEntity, Long> {

    List<FiscalPeriodEntity> findByPropertyIdAndStatusInOrderByBusinessDateAsc(
            String propertyId, Collection<FiscalPeriodStatus> statuses);

    Optional<FiscalPeriodEntity> findByPropertyIdAndBusinessDate(String propertyId, LocalDate businessDate);

    boolean existsByPropertyIdAndBusinessDate(String propertyId, LocalDate businessDate);

    boolean existsByPropertyId(String propertyId);

    List<FiscalPeriodEntity> findByPropertyIdOrderByBusinessDateDesc(String propertyId);
}
