package com.opspos.fiscal;

import com.opspos.calendar.BusinessDateService;
import com.opspos.domain.enums.RolloverMode;
import com.opspos.entity.FiscalPeriodEntity;
import com.opspos.entity.PropertyEntity;
import com.opspos.repository.jpa.PropertyJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Advances fiscal periods for every AUTO property.
 *
 * <p>Each tick walks a property's open periods oldest-first and closes each one whose closing
 * instant has passed, so a terminal that was off for several days catches up in order. The
 * walk stops at the first period still in progress and never runs more than
 * {@code maxIterations} closes per property per tick. The decision uses the time-derived
 * business date only: the property's pinned current business date is what a close advances,
 * not what it waits on.
 *
 * <p>Closes for one property are serialized by a per-property lock; a tick that finds the lock
 * taken skips the property. A failure on one property is logged and the others still run.
 */
@Component
public class FiscalPeriodScheduler {

    private static final Logger log = LoggerFactory.getLogger(FiscalPeriodScheduler.class);

    private final PropertyJpaRepository propertyJpaRepository;
    private final FiscalPeriodService fiscalPeriodService;
    private final BusinessDateService businessDateService;
    private final FiscalConfig fiscalConfig;
    private final Clock clock;

    private final Map<String, ReentrantLock> propertyLocks = new ConcurrentHashMap<>();

    public FiscalPeriodScheduler(
            PropertyJpaRepository propertyJpaRepository,
            FiscalPeriodService fiscalPeriodService,
            BusinessDateService businessDateService,
            FiscalConfig fiscalConfig,
            Clock clock) {
        this.propertyJpaRepository = propertyJpaRepository;
        this.fiscalPeriodService = fiscalPeriodService;
        this.businessDateService = businessDateService;
        this.fiscalConfig = fiscalConfig;
        this.clock = clock;
    }

    @Scheduled(
            fixedRateString = "${ops-pos.fiscal.tick-interval-ms:60000}",
            initialDelayString = "${ops-pos.fiscal.tick-interval-ms:60000}")
    public void tick() {
        tick(clock.instant());
    }

    /**
     * Testable version with an explicit instant.
     *
     * @return number of periods closed across all properties
     */
    public int tick(Instant now) {
        List<PropertyEntity> properties = propertyJpaRepository.findByRolloverMode(RolloverMode.AUTO);
        int closed = 0;
        for (PropertyEntity property : properties) {
            try {
                closed += processProperty(property.getId(), now);
            } catch (Exception e) {
                log.error("Fiscal rollover failed for property {}: {}", property.getId(), e.getMessage(), e);
            }
        }
        if (closed > 0) {
            log.info("Fiscal tick closed {} period(s) across {} properties", closed, properties.size());
        }
        return closed;
    }

    /**
     * Closes every due period of one property, oldest first.
     *
     * @return number of periods closed
     */
    public int processProperty(String propertyId, Instant now) {
        ReentrantLock lock = propertyLocks.computeIfAbsent(propertyId, id -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.debug("Fiscal rollover for property {} already in progress, skipping", propertyId);
            return 0;
        }
        try {
            PropertyEntity property = propertyJpaRepository.findById(propertyId).orElse(null);
            if (property == null || property.getRolloverMode() != RolloverMode.AUTO) {
                return 0;
            }
            if (fiscalPeriodService.getOpenPeriods(propertyId).isEmpty()) {
                fiscalPeriodService.ensureOpenPeriod(property, now);
            }

            int closed = 0;
            for (int i = 0; i < fiscalConfig.getMaxIterations(); i++) {
                List<FiscalPeriodEntity> open = fiscalPeriodService.getOpenPeriods(propertyId);
                if (open.isEmpty()) {
                    break;
                }
                FiscalPeriodEntity oldest = open.get(0);
                if (!businessDateService.hasReachedClosingTime(oldest.getBusinessDate(), property, now)) {
                    break;
                }
                if (fiscalPeriodService.closePeriod(oldest.getId(), now, "Closed automatically at rollover")) {
                    closed++;
                }
                property = propertyJpaRepository.findById(propertyId).orElse(property);
            }
            if (closed == fiscalConfig.getMaxIterations()) {
                log.warn("Property {} hit the fiscal close limit of {} periods in one tick; continuing next tick",
                        propertyId, closed);
            }
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
