package com.opspos.calendar;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults for business-date resolution, loaded via the {@code ops-pos.business-date} prefix.
 *
 * <p>A property that leaves its timezone or rollover time unset falls back to these.
 * PM rollovers (12:00-23:59) are only accepted when {@code allowPmRollover} is enabled.
 */
@Component
@ConfigurationProperties(prefix = "ops-pos.business-date")
public class BusinessDateConfig {

    private String defaultTimezone = "America/New_York";
    private String defaultRolloverTime = "04:00";
    private boolean allowPmRollover = false;

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    public String getDefaultRolloverTime() {
        return defaultRolloverTime;
    }

    public void setDefaultRolloverTime(String defaultRolloverTime) {
        this.defaultRolloverTime = defaultRolloverTime;
    }

    public boolean isAllowPmRollover() {
        return allowPmRollover;
    }

    public void setAllowPmRollover(boolean allowPmRollover) {
        this.allowPmRollover = allowPmRollover;
    }
}
