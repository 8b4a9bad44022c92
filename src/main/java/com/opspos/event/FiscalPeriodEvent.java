package com.opspos.event;

import java.time.LocalDate;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the scheduler opens or closes a fiscal period.
 */
public class FiscalPeriodEvent extends ApplicationEvent {

    private final FiscalPeriodEventType eventType;
    private final String propertyId;
    private final LocalDate businessDate;

    public FiscalPeriodEvent(
            Object source, FiscalPeriodEventType eventType, String propertyId, LocalDate businessDate) {
        super(source);
        this.eventType = eventType;
        this.propertyId = propertyId;
        this.businessDate = businessDate;
    }

    public FiscalPeriodEventType getEventType() {
        return eventType;
    }

    public String getPropertyId() {
        return propertyId;
    }

    public LocalDate getBusinessDate() {
        return businessDate;
    }
}
