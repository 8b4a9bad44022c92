package com.opspos.domain.enums;

public enum ReplayOperation {
    CREATE,
    UPDATE,
    DELETE
}
