package com.opspos.domain.vo;

import java.time.Instant;
import java.time.LocalDate;
import lombok.Value;

/** Half-open interval [start, end) of instants that belong to one business date. */
@Value
public class BusinessDateRange {

    LocalDate businessDate;
    Instant start;
    Instant end;

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
