package com.opspos.domain.enums;

/** Whether the fiscal scheduler advances a property's business date on its own or waits for a manager. */
public enum RolloverMode {
    AUTO,
    MANUAL
}
