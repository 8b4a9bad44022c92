package com.opspos.recovery;

public enum ServiceState {
    STARTING,
    RUNNING,
    DEGRADED,
    FAILED,
    STOPPED
}
