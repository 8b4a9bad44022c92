package com.opspos.domain.enums;

public enum ConflictResolution {
    KEEP_ORIGINAL,
    KEEP_CLONE,
    MERGE
}
