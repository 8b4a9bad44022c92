package com.opspos.fiscal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Fiscal period scheduler settings, loaded via the {@code ops-pos.fiscal} prefix.
 */
@Component
@ConfigurationProperties(prefix = "ops-pos.fiscal")
public class FiscalConfig {

    private long tickIntervalMs = 60_000;

    /** Upper bound on periods closed for one property in a single tick. */
    private int maxIterations = 30;

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public void setTickIntervalMs(long tickIntervalMs) {
        this.tickIntervalMs = tickIntervalMs;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }
}
