package com.opspos.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Identity of the terminal this process runs on, loaded via the {@code ops-pos.terminal} prefix.
 */
@Component
@ConfigurationProperties(prefix = "ops-pos.terminal")
public class TerminalConfig {

    private String terminalId = "terminal-01";
    private String propertyId;

    public String getTerminalId() {
        return terminalId;
    }

    public void setTerminalId(String terminalId) {
        this.terminalId = terminalId;
    }

    public String getPropertyId() {
        return propertyId;
    }

    public void setPropertyId(String propertyId) {
        this.propertyId = propertyId;
    }
}
