package com.opspos.domain.model;

import com.opspos.domain.enums.CheckStatus;
import com.opspos.domain.enums.ConflictState;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Full state of a check as replayed to the authoritative store and returned by the API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckSnapshot {

    private String id;
    private String propertyId;
    private LocalDate businessDate;
    private Integer checkNumber;
    private CheckStatus status;
    private Integer guestCount;
    private BigDecimal subtotal;
    private BigDecimal discountTotal;
    private BigDecimal taxTotal;
    private BigDecimal tipTotal;
    private BigDecimal total;
    private BigDecimal paidAmount;
    private Long version;
    private ConflictState conflictState;
    private String clonedFromCheckId;
    private Instant updatedAt;
    private Instant closedAt;
    private List<CheckItemSnapshot> items;
}
