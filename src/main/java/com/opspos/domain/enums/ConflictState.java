package com.opspos.domain.enums;

/**
 * Conflict marker carried by a check.
 *
 * <p>NONE is the normal state. An offline override leaves the original CONFLICT_PENDING
 * and its copy CONFLICT_CLONE until a manager reconciles them; the losing side then
 * becomes SUPERSEDED and never takes another write.
 */
public enum ConflictState {
    NONE,
    CONFLICT_PENDING,
    CONFLICT_CLONE,
    SUPERSEDED;

    public boolean isCanonicalCandidate() {
        return this == NONE || this == CONFLICT_PENDING;
    }
}
