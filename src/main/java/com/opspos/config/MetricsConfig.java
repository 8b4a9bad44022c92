package com.opspos.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Applies common tags (application, terminal) to every meter so dashboards can split
 * a store's numbers by terminal. Custom meters are defined in
 * {@link com.opspos.observability.CustomMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final TerminalConfig terminalConfig;

    public MetricsConfig(MeterRegistry meterRegistry, TerminalConfig terminalConfig) {
        this.meterRegistry = meterRegistry;
        this.terminalConfig = terminalConfig;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "ops-pos", "terminal", terminalConfig.getTerminalId());
    }
}
