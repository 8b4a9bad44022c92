package com.opspos.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckItemSnapshot {

    private String lineItemId;
    private String menuItemId;
    private String name;
    private int quantity;
    private BigDecimal unitPrice;
    private Instant updatedAt;
}
