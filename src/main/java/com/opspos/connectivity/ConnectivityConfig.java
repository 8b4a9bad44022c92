package com.opspos.connectivity;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Heartbeat targets and cadence, loaded via the {@code ops-pos.connectivity} prefix.
 *
 * <p>An authority is only marked unreachable after {@code failureThreshold} consecutive
 * missed heartbeats; a single success marks it reachable again.
 */
@Component
@ConfigurationProperties(prefix = "ops-pos.connectivity")
public class ConnectivityConfig {

    private String cloudUrl;
    private String relayHostUrl;
    private String peripheralsUrl;
    private long cloudIntervalMs = 15000;
    private long relayHostIntervalMs = 10000;
    private long peripheralsIntervalMs = 10000;
    private long probeTimeoutMs = 5000;
    private int failureThreshold = 3;

    public String urlFor(Authority authority) {
        switch (authority) {
            case CLOUD:
                return cloudUrl;
            case RELAY_HOST:
                return relayHostUrl;
            default:
                return peripheralsUrl;
        }
    }

    public long intervalFor(Authority authority) {
        switch (authority) {
            case CLOUD:
                return cloudIntervalMs;
            case RELAY_HOST:
                return relayHostIntervalMs;
            default:
                return peripheralsIntervalMs;
        }
    }

    public String getCloudUrl() {
        return cloudUrl;
    }

    public void setCloudUrl(String cloudUrl) {
        this.cloudUrl = cloudUrl;
    }

    public String getRelayHostUrl() {
        return relayHostUrl;
    }

    public void setRelayHostUrl(String relayHostUrl) {
        this.relayHostUrl = relayHostUrl;
    }

    public String getPeripheralsUrl() {
        return peripheralsUrl;
    }

    public void setPeripheralsUrl(String peripheralsUrl) {
        this.peripheralsUrl = peripheralsUrl;
    }

    public long getCloudIntervalMs() {
        return cloudIntervalMs;
    }

    public void setCloudIntervalMs(long cloudIntervalMs) {
        this.cloudIntervalMs = cloudIntervalMs;
    }

    public long getRelayHostIntervalMs() {
        return relayHostIntervalMs;
    }

    public void setRelayHostIntervalMs(long relayHostIntervalMs) {
        this.relayHostIntervalMs = relayHostIntervalMs;
    }

    public long getPeripheralsIntervalMs() {
        return peripheralsIntervalMs;
    }

    public void setPeripheralsIntervalMs(long peripheralsIntervalMs) {
        this.peripheralsIntervalMs = peripheralsIntervalMs;
    }

    public long getProbeTimeoutMs() {
        return probeTimeoutMs;
    }

    public void setProbeTimeoutMs(long probeTimeoutMs) {
        this.probeTimeoutMs = probeTimeoutMs;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }
}
