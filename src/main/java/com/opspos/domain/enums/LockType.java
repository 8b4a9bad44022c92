package com.opspos.domain.enums;

/**
 * ACTIVE grants exclusive write ownership; VIEW is an informational read marker that
 * an ACTIVE request may preempt.
 */
public enum LockType {
    ACTIVE,
    VIEW
}
