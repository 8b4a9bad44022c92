package com.opspos.domain.enums;

public enum ConflictStatus {
    PENDING,
    RESOLVED
}
