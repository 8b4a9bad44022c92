package com.opspos.recovery;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of the startup recovery sequence, one field group per step.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    // Step 1: replay items interrupted mid-dispatch
    private int stuckReplayItemsReset;

    // Step 2: property configuration
    private int propertiesChecked;
    private int invalidProperties;

    // Step 3: fiscal periods
    private int fiscalPeriodsOpened;

    // Step 4: supervised services
    private int servicesRegistered;
    private int servicesRunning;
}
