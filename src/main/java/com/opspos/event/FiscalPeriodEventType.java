package com.opspos.event;

public enum FiscalPeriodEventType {
    OPENED,
    CLOSED
}
