package com.opspos.domain.enums;

public enum CheckStatus {
    OPEN,
    PARTIAL,
    CLOSED
}
