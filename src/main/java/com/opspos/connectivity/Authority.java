package com.opspos.connectivity;

/** Heartbeat targets in precedence order. */
public enum Authority {
    CLOUD,
    RELAY_HOST,
    PERIPHERALS
}
