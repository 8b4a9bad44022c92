package com.opspos.lock;

import com.opspos.entity.EmployeeEntity;
import com.opspos.exception.UnauthorizedException;
import com.opspos.repository.jpa.EmployeeJpaRepository;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Elevated authentication for lock overrides: the approving employee must be active,
 * hold the override privilege and present the right PIN.
 */
@Service
public class ManagerApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ManagerApprovalService.class);

    private final EmployeeJpaRepository employeeJpaRepository;

    public ManagerApprovalService(EmployeeJpaRepository employeeJpaRepository) {
        this.employeeJpaRepository = employeeJpaRepository;
    }

    public EmployeeEntity verify(String employeeId, String pin) {
        if (employeeId == null || pin == null) {
            throw new UnauthorizedException("Manager approval required");
        }
        EmployeeEntity employee = employeeJpaRepository
                .findById(employeeId)
                .orElseThrow(() -> new UnauthorizedException("Manager approval rejected"));

        byte[] expected = employee.getPinHash() != null
                ? employee.getPinHash().getBytes(StandardCharsets.UTF_8)
                : new byte[0];
        byte[] actual = hashPin(pin).getBytes(StandardCharsets.UTF_8);
        if (!employee.isActive() || !MessageDigest.isEqual(expected, actual)) {
            log.warn("Manager approval rejected for employee {}", employeeId);
            throw new UnauthorizedException("Manager approval rejected");
        }
        if (!employee.isCanOverrideLocks()) {
            log.warn("Employee {} lacks the lock override privilege", employeeId);
            throw new UnauthorizedException("Employee is not allowed to override check locks");
        }
        return employee;
    }

    public static String hashPin(String pin) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(pin.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
