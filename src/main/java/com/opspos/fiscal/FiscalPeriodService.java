package com.opspos.fiscal;

import com.opspos.calendar.BusinessDateService;
import com.opspos.domain.enums.FiscalPeriodStatus;
import com.opspos.domain.model.FiscalTotals;
import com.opspos.entity.FiscalPeriodEntity;
import com.opspos.entity.PropertyEntity;
import com.opspos.event.EventPublisherHelper;
import com.opspos.exception.BusinessException;
import com.opspos.exception.ErrorCode;
import com.opspos.exception.ResourceNotFoundException;
import com.opspos.repository.jpa.FiscalPeriodJpaRepository;
import com.opspos.repository.jpa.PropertyJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Opens and closes fiscal periods.
 *
 * <p>Closing a period freezes its totals, clocks out open shifts (when the property enables
 * it), moves the property's current business date to the next day and opens the next period
 * if it does not exist yet. Periods close strictly in business-date order: a period is never
 * closed while an older one is still open.
 */
@Service
public class FiscalPeriodService {

    private static final Logger log = LoggerFactory.getLogger(FiscalPeriodService.class);

    static final EnumSet<FiscalPeriodStatus> OPEN_STATUSES =
            EnumSet.of(FiscalPeriodStatus.OPEN, FiscalPeriodStatus.REOPENED);

    private final FiscalPeriodJpaRepository fiscalPeriodJpaRepository;
    private final PropertyJpaRepository propertyJpaRepository;
    private final BusinessDateService businessDateService;
    private final FiscalTotalsCalculator fiscalTotalsCalculator;
    private final FiscalPeriodOpener fiscalPeriodOpener;
    private final AutoClockOutService autoClockOutService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public FiscalPeriodService(
            FiscalPeriodJpaRepository fiscalPeriodJpaRepository,
            PropertyJpaRepository propertyJpaRepository,
            BusinessDateService businessDateService,
            FiscalTotalsCalculator fiscalTotalsCalculator,
            FiscalPeriodOpener fiscalPeriodOpener,
            AutoClockOutService autoClockOutService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.fiscalPeriodJpaRepository = fiscalPeriodJpaRepository;
        this.propertyJpaRepository = propertyJpaRepository;
        this.businessDateService = businessDateService;
        this.fiscalTotalsCalculator = fiscalTotalsCalculator;
        this.fiscalPeriodOpener = fiscalPeriodOpener;
        this.autoClockOutService = autoClockOutService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ---- Queries ----

    @Transactional(readOnly = true)
    public List<FiscalPeriodEntity> getOpenPeriods(String propertyId) {
        return fiscalPeriodJpaRepository.findByPropertyIdAndStatusInOrderByBusinessDateAsc(propertyId, OPEN_STATUSES);
    }

    @Transactional(readOnly = true)
    public List<FiscalPeriodEntity> getPeriods(String propertyId) {
        return fiscalPeriodJpaRepository.findByPropertyIdOrderByBusinessDateDesc(propertyId);
    }

    @Transactional(readOnly = true)
    public FiscalPeriodEntity getPeriod(String propertyId, LocalDate businessDate) {
        return fiscalPeriodJpaRepository
                .findByPropertyIdAndBusinessDate(propertyId, businessDate)
                .orElseThrow(() -> new ResourceNotFoundException("FiscalPeriod", propertyId + "/" + businessDate));
    }

    // ---- Opening ----

    /**
     * Creates an OPEN period for the property's current business date if the property has no
     * period at all yet.
     */
    @Transactional
    public Optional<FiscalPeriodEntity> ensureOpenPeriod(PropertyEntity property, Instant now) {
        if (fiscalPeriodJpaRepository.existsByPropertyId(property.getId())) {
            return Optional.empty();
        }
        LocalDate businessDate = businessDateService.resolveBusinessDate(now, property);
        return Optional.ofNullable(openPeriodIfAbsent(property.getId(), businessDate, now));
    }

    /**
     * Startup pass: every property gets a period for its current business date if it has none.
     *
     * @return number of periods created
     */
    public int ensureOpenPeriods(Instant now) {
        int created = 0;
        for (PropertyEntity property : propertyJpaRepository.findAll()) {
            try {
                if (ensureOpenPeriod(property, now).isPresent()) {
                    created++;
                }
            } catch (Exception e) {
                log.error("Could not open initial fiscal period for property {}: {}",
                        property.getId(), e.getMessage(), e);
            }
        }
        return created;
    }

    private FiscalPeriodEntity openPeriodIfAbsent(String propertyId, LocalDate businessDate, Instant now) {
        if (fiscalPeriodJpaRepository.existsByPropertyIdAndBusinessDate(propertyId, businessDate)) {
            return null;
        }
        try {
            FiscalPeriodEntity period = fiscalPeriodOpener.open(propertyId, businessDate, now);
            eventPublisherHelper.publishFiscalPeriodOpened(this, propertyId, businessDate);
            log.info("Fiscal period {} opened for property {}", businessDate, propertyId);
            return period;
        } catch (DataIntegrityViolationException e) {
            log.info("Fiscal period {} for property {} was opened concurrently", businessDate, propertyId);
            return null;
        }
    }

    // ---- Closing ----

    /**
     * Closes one period. The period is re-read first and left alone if someone else closed it.
     *
     * @return true if this call closed the period
     */
    @Transactional
    public boolean closePeriod(Long periodId, Instant now, String notes) {
        FiscalPeriodEntity period = fiscalPeriodJpaRepository
                .findById(periodId)
                .orElseThrow(() -> new ResourceNotFoundException("FiscalPeriod", periodId));
        if (!period.getStatus().isOpen()) {
            log.debug("Fiscal period {} already closed, skipping", period.getBusinessDate());
            return false;
        }
        String propertyId = period.getPropertyId();
        PropertyEntity property = propertyJpaRepository
                .findById(propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Property", propertyId));
        LocalDate businessDate = period.getBusinessDate();

        if (property.isAutoClockOutEnabled()) {
            autoClockOutService.clockOutOpenPunches(propertyId, businessDate, now);
        }

        FiscalTotals totals = fiscalTotalsCalculator.calculate(propertyId, businessDate);
        period.setGrossSales(totals.getGrossSales());
        period.setNetSales(totals.getNetSales());
        period.setTaxCollected(totals.getTaxCollected());
        period.setDiscountsTotal(totals.getDiscountsTotal());
        period.setTipsTotal(totals.getTipsTotal());
        period.setCashTotal(totals.getCashTotal());
        period.setCardTotal(totals.getCardTotal());
        period.setCheckCount(totals.getCheckCount());
        period.setGuestCount(totals.getGuestCount());
        period.setStatus(FiscalPeriodStatus.CLOSED);
        period.setClosedAt(now);
        period.setNotes(notes);
        fiscalPeriodJpaRepository.save(period);

        LocalDate next = businessDateService.incrementDate(businessDate);
        if (property.getCurrentBusinessDate() == null || property.getCurrentBusinessDate().isBefore(next)) {
            property.setCurrentBusinessDate(next);
            property.setUpdatedAt(now);
            propertyJpaRepository.save(property);
        }
        openPeriodIfAbsent(propertyId, next, now);

        eventPublisherHelper.publishFiscalPeriodClosed(this, propertyId, businessDate);
        log.info("Fiscal period {} closed for property {} ({} checks, gross {})",
                businessDate, propertyId, totals.getCheckCount(), totals.getGrossSales());
        return true;
    }

    /**
     * Manager-initiated close, used for MANUAL properties. Only the oldest open period may be
     * closed.
     */
    @Transactional
    public FiscalPeriodEntity closePeriodManually(String propertyId, LocalDate businessDate) {
        FiscalPeriodEntity period = getPeriod(propertyId, businessDate);
        if (!period.getStatus().isOpen()) {
            throw new BusinessException(ErrorCode.CONFLICT, "Fiscal period " + businessDate + " is already closed");
        }
        FiscalPeriodEntity oldest = getOpenPeriods(propertyId).get(0);
        if (oldest.getBusinessDate().isBefore(businessDate)) {
            throw new BusinessException(
                    "Fiscal period " + oldest.getBusinessDate() + " must be closed before " + businessDate);
        }
        closePeriod(period.getId(), clock.instant(), "Closed manually");
        return getPeriod(propertyId, businessDate);
    }

    /**
     * Reopens the most recently closed period. Reopening an older period would leave a closed
     * period after an open one.
     */
    @Transactional
    public FiscalPeriodEntity reopenPeriod(String propertyId, LocalDate businessDate) {
        FiscalPeriodEntity period = getPeriod(propertyId, businessDate);
        if (period.getStatus().isOpen()) {
            throw new BusinessException(ErrorCode.CONFLICT, "Fiscal period " + businessDate + " is not closed");
        }
        boolean laterClosed = fiscalPeriodJpaRepository.findByPropertyIdOrderByBusinessDateDesc(propertyId).stream()
                .anyMatch(p -> p.getBusinessDate().isAfter(businessDate) && p.getStatus() == FiscalPeriodStatus.CLOSED);
        if (laterClosed) {
            throw new BusinessException("Only the most recently closed fiscal period can be reopened");
        }
        period.setStatus(FiscalPeriodStatus.REOPENED);
        period.setClosedAt(null);
        log.warn("Fiscal period {} reopened for property {}", businessDate, propertyId);
        return fiscalPeriodJpaRepository.save(period);
    }
}
