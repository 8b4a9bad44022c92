package com.opspos.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeEntrySnapshot {

    private String id;
    private String propertyId;
    private String employeeId;
    private LocalDate businessDate;
    private Instant clockInAt;
    private Instant clockOutAt;
    private boolean autoClockedOut;
}
