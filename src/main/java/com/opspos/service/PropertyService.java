package com.opspos.service;

import com.opspos.calendar.BusinessDateService;
import com.opspos.domain.enums.RolloverMode;
import com.opspos.entity.PropertyEntity;
import com.opspos.exception.ResourceNotFoundException;
import com.opspos.repository.jpa.PropertyJpaRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Property-level business-date configuration. Every change is validated before it is stored,
 * so the scheduler never meets a timezone or rollover time it cannot parse.
 */
@Service
public class PropertyService {

    private static final Logger log = LoggerFactory.getLogger(PropertyService.class);

    private final PropertyJpaRepository propertyJpaRepository;
    private final BusinessDateService businessDateService;
    private final Clock clock;

    public PropertyService(
            PropertyJpaRepository propertyJpaRepository, BusinessDateService businessDateService, Clock clock) {
        this.propertyJpaRepository = propertyJpaRepository;
        this.businessDateService = businessDateService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public PropertyEntity getProperty(String propertyId) {
        return propertyJpaRepository
                .findById(propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Property", propertyId));
    }

    @Transactional(readOnly = true)
    public List<PropertyEntity> getAllProperties() {
        return propertyJpaRepository.findAll();
    }

    @Transactional
    public PropertyEntity createProperty(PropertyEntity property) {
        businessDateService.validateRolloverConfiguration(property.getTimezone(), property.getRolloverTime());
        if (property.getRolloverMode() == null) {
            property.setRolloverMode(RolloverMode.AUTO);
        }
        property.setUpdatedAt(clock.instant());
        PropertyEntity saved = propertyJpaRepository.save(property);
        log.info("Property {} created (timezone={}, rollover={}, mode={})",
                saved.getId(), saved.getTimezone(), saved.getRolloverTime(), saved.getRolloverMode());
        return saved;
    }

    /**
     * Updates the business-date settings. Null arguments leave the current value in place.
     */
    @Transactional
    public PropertyEntity updateBusinessDateSettings(
            String propertyId,
            String timezone,
            String rolloverTime,
            RolloverMode rolloverMode,
            Boolean autoClockOutEnabled) {
        PropertyEntity property = getProperty(propertyId);
        String newTimezone = timezone != null ? timezone : property.getTimezone();
        String newRollover = rolloverTime != null ? rolloverTime : property.getRolloverTime();
        businessDateService.validateRolloverConfiguration(newTimezone, newRollover);

        property.setTimezone(newTimezone);
        property.setRolloverTime(newRollover);
        if (rolloverMode != null) {
            property.setRolloverMode(rolloverMode);
        }
        if (autoClockOutEnabled != null) {
            property.setAutoClockOutEnabled(autoClockOutEnabled);
        }
        property.setUpdatedAt(clock.instant());
        log.info("Property {} business-date settings updated (timezone={}, rollover={}, mode={})",
                propertyId, newTimezone, newRollover, property.getRolloverMode());
        return propertyJpaRepository.save(property);
    }

    /**
     * Pins the operating day. Passing null clears the pin and returns to the time-derived date.
     */
    @Transactional
    public PropertyEntity setCurrentBusinessDate(String propertyId, String businessDate) {
        PropertyEntity property = getProperty(propertyId);
        LocalDate parsed = businessDate != null ? businessDateService.parseBusinessDate(businessDate) : null;
        property.setCurrentBusinessDate(parsed);
        property.setUpdatedAt(clock.instant());
        log.info("Property {} current business date set to {}", propertyId, parsed);
        return propertyJpaRepository.save(property);
    }

    @Transactional(readOnly = true)
    public LocalDate getCurrentBusinessDate(String propertyId) {
        return businessDateService.getCurrentBusinessDate(getProperty(propertyId));
    }
}
