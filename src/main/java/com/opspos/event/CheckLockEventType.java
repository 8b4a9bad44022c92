package com.opspos.event;

public enum CheckLockEventType {
    ACQUIRED,
    RELEASED,
    HANDOFF_REQUESTED,
    OVERRIDDEN,
    CONFLICT_CREATED,
    CONFLICT_DETECTED,
    CONFLICT_RESOLVED
}
