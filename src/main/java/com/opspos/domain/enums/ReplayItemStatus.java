package com.opspos.domain.enums;

/** Acknowledged items are deleted, so there is no terminal success state. */
public enum ReplayItemStatus {
    PENDING,
    SYNCING,
    FAILED
}
