package com.opspos.domain.enums;

public enum OverrideOutcome {
    GRANTED,
    HANDOFF_REQUESTED,
    CONFLICT_CLONE_CREATED
}
