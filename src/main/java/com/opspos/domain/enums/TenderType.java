package com.opspos.domain.enums;

public enum TenderType {
    CASH,
    CARD,
    OTHER
}
