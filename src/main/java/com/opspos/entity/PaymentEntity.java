package com.opspos.entity;

import com.opspos.domain.enums.TenderType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the payments table. Payment authorisation happens outside this
 * service; rows here are the tender already accepted at the terminal.
 */
@Entity
@Table(name = "payments")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "check_id", length = 36, nullable = false)
    private String checkId;

    @Enumerated(EnumType.STRING)
    @Column(name = "tender_type", length = 10)
    private TenderType tenderType;

    @Column(precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "tip_amount", precision = 12, scale = 2)
    private BigDecimal tipAmount;

    @Column(name = "terminal_id", length = 36)
    private String terminalId;

    @Column(name = "created_at")
    private Instant createdAt;
}
