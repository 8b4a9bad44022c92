package com.opspos.entity;

import com.opspos.domain.enums.RolloverMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the properties table.
 * A property is one restaurant location with its own timezone and business-date rollover.
 * Unset timezone or rollover time fall back to the configured defaults.
 */
@Entity
@Table(name = "properties")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertyEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 100)
    private String name;

    /** IANA zone id, e.g. America/New_York. */
    @Column(length = 64)
    private String timezone;

    /** Rollover time of day as HH:MM in the property timezone. */
    @Column(name = "rollover_time", length = 5)
    private String rolloverTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "rollover_mode", length = 10)
    @Builder.Default
    private RolloverMode rolloverMode = RolloverMode.AUTO;

    /** Explicit operating day. Wins over the time-derived date when set. */
    @Column(name = "current_business_date")
    private LocalDate currentBusinessDate;

    @Column(name = "auto_clock_out_enabled")
    private boolean autoClockOutEnabled;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
