package com.opspos.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the employees table. Only the fields needed for elevated
 * authentication live here; the rest of the employee profile is owned elsewhere.
 */
@Entity
@Table(name = "employees")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmployeeEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "property_id", length = 36)
    private String propertyId;

    @Column(length = 100)
    private String name;

    /** Hex SHA-256 of the PIN. */
    @Column(name = "pin_hash", length = 64)
    private String pinHash;

    @Column(name = "can_override_locks")
    private boolean canOverrideLocks;

    private boolean active;
}
