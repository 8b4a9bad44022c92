package com.opspos.domain.enums;

/**
 * Result of a lock acquisition attempt.
 *
 * <ul>
 *   <li>GRANTED -- the requester now holds the lock</li>
 *   <li>ALREADY_HELD -- the requester held it before the call (no-op)</li>
 *   <li>IN_USE -- held by another terminal that is reachable</li>
 *   <li>HOLDER_OFFLINE -- held by a terminal that cannot be reached</li>
 *   <li>VIEW_ONLY -- a view request against a check another terminal is editing</li>
 * </ul>
 */
public enum LockOutcome {
    GRANTED,
    ALREADY_HELD,
    IN_USE,
    HOLDER_OFFLINE,
    VIEW_ONLY
}
