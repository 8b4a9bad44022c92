package com.opspos.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the check_items table.
 * {@code lineItemId} is assigned when the item is rung in and survives cloning, which is
 * what lets a merge recognise the same line on both sides of a conflict.
 */
@Entity
@Table(
        name = "check_items",
        uniqueConstraints = @UniqueConstraint(columnNames = {"check_id", "line_item_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CheckItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "line_item_id", length = 36, nullable = false)
    private String lineItemId;

    @Column(name = "check_id", length = 36, nullable = false)
    private String checkId;

    @Column(name = "menu_item_id", length = 36)
    private String menuItemId;

    @Column(length = 100)
    private String name;

    private int quantity;

    @Column(name = "unit_price", precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
