package com.opspos.domain.vo;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import lombok.Builder;
import lombok.Value;

/**
 * Resolved business-date configuration of one property: defaults already applied,
 * timezone and rollover parsed. {@code currentBusinessDate} is null when the property
 * has no explicit override.
 */
@Value
@Builder
public class BusinessDateSettings {

    ZoneId zoneId;
    LocalTime rolloverTime;
    LocalDate currentBusinessDate;

    /** Rollover at or after noon moves late-evening sales forward to the next calendar day. */
    public boolean isPmRollover() {
        return rolloverTime.getHour() >= 12;
    }
}
