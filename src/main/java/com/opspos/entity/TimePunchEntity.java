package com.opspos.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the time_punches table: one shift from clock-in to clock-out.
 * The business date is the clock-in's, even when the shift is closed by the
 * end-of-day auto clock-out on a later calendar day.
 */
@Entity
@Table(name = "time_punches")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimePunchEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "property_id", length = 36, nullable = false)
    private String propertyId;

    @Column(name = "employee_id", length = 36, nullable = false)
    private String employeeId;

    @Column(name = "business_date", nullable = false)
    private LocalDate businessDate;

    @Column(name = "clock_in_at", nullable = false)
    private Instant clockInAt;

    @Column(name = "clock_out_at")
    private Instant clockOutAt;

    @Column(name = "auto_clocked_out")
    private boolean autoClockedOut;

    @Column(length = 255)
    private String notes;
}
