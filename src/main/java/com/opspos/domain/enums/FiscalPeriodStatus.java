package com.opspos.domain.enums;

public enum FiscalPeriodStatus {
    OPEN,
    REOPENED,
    CLOSED;

    public boolean isOpen() {
        return this == OPEN || this == REOPENED;
    }
}
