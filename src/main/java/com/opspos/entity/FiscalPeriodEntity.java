package com.opspos.entity;

import com.opspos.domain.enums.FiscalPeriodStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the fiscal_periods table.
 * One row per property per business date; the unique constraint keeps a second
 * period for the same day from ever being created, even by racing schedulers.
 * Totals are frozen when the period is closed.
 */
@Entity
@Table(
        name = "fiscal_periods",
        uniqueConstraints = @UniqueConstraint(columnNames = {"property_id", "business_date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FiscalPeriodEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", length = 36, nullable = false)
    private String propertyId;

    @Column(name = "business_date", nullable = false)
    private LocalDate businessDate;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    private FiscalPeriodStatus status;

    @Column(name = "gross_sales", precision = 14, scale = 2)
    private BigDecimal grossSales;

    @Column(name = "net_sales", precision = 14, scale = 2)
    private BigDecimal netSales;

    @Column(name = "tax_collected", precision = 14, scale = 2)
    private BigDecimal taxCollected;

    @Column(name = "discounts_total", precision = 14, scale = 2)
    private BigDecimal discountsTotal;

    @Column(name = "tips_total", precision = 14, scale = 2)
    private BigDecimal tipsTotal;

    @Column(name = "cash_total", precision = 14, scale = 2)
    private BigDecimal cashTotal;

    @Column(name = "card_total", precision = 14, scale = 2)
    private BigDecimal cardTotal;

    @Column(name = "check_count")
    private Integer checkCount;

    @Column(name = "guest_count")
    private Integer guestCount;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(length = 255)
    private String notes;
}
