package com.opspos.event;

public enum RecoveryEventType {
    STARTING,
    STARTED,
    STOPPED,
    FAILED,
    DEGRADED,
    RECOVERING,
    RECOVERED,
    RECOVERY_EXHAUSTED
}
