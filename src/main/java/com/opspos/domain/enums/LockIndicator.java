package com.opspos.domain.enums;

/** Tri-state lock indicator rendered next to a check on the terminals. */
public enum LockIndicator {
    GREEN,
    YELLOW,
    RED
}
