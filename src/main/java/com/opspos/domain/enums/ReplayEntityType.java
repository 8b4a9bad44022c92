package com.opspos.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Entity kinds that travel through the replay queue. The path segment is the name
 * the authoritative store uses in its sync endpoints.
 */
@Getter
@RequiredArgsConstructor
public enum ReplayEntityType {
    CHECK("check"),
    PAYMENT("payment"),
    TIME_ENTRY("time-entry");

    private final String pathSegment;
}
