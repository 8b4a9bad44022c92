package com.opspos.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes returned to terminals. {@code retryable} tells the terminal UI whether the same
 * request may succeed later without user action (lost lock race, upstream outage).
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 400, false),
    UNAUTHORIZED("UNAUTHORIZED", 401, false),
    FORBIDDEN("FORBIDDEN", 403, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    CONFLICT("CONFLICT", 409, false),
    LOCK_CONFLICT("LOCK_CONFLICT", 409, true),
    BUSINESS_RULE_VIOLATION("BUSINESS_RULE_VIOLATION", 422, false),
    RISK_ACKNOWLEDGMENT_REQUIRED("RISK_ACKNOWLEDGMENT_REQUIRED", 428, false),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    UPSTREAM_ERROR("UPSTREAM_ERROR", 502, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
