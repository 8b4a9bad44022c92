package com.opspos.queue;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Replay drain settings loaded via the {@code ops-pos.replay} prefix.
 */
@Component
@ConfigurationProperties(prefix = "ops-pos.replay")
public class ReplayQueueConfig {

    private long drainIntervalMs = 5000;
    private int batchSize = 10;
    private long dispatchTimeoutMs = 10000;
    private String cloudBaseUrl;
    private String relayHostBaseUrl;

    public long getDrainIntervalMs() {
        return drainIntervalMs;
    }

    public void setDrainIntervalMs(long drainIntervalMs) {
        this.drainIntervalMs = drainIntervalMs;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getDispatchTimeoutMs() {
        return dispatchTimeoutMs;
    }

    public void setDispatchTimeoutMs(long dispatchTimeoutMs) {
        this.dispatchTimeoutMs = dispatchTimeoutMs;
    }

    public String getCloudBaseUrl() {
        return cloudBaseUrl;
    }

    public void setCloudBaseUrl(String cloudBaseUrl) {
        this.cloudBaseUrl = cloudBaseUrl;
    }

    public String getRelayHostBaseUrl() {
        return relayHostBaseUrl;
    }

    public void setRelayHostBaseUrl(String relayHostBaseUrl) {
        this.relayHostBaseUrl = relayHostBaseUrl;
    }
}
