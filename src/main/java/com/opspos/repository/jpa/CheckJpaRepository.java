package com.opspos.repository.jpa;

import com.opspos.domain.enums.CheckStatus;
import com.opspos.domain.enums.LockType;
import com.opspos.entity.CheckEntity;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the checks table.
 *
 * <p>{@link #compareAndSetLock} and {@link #compareAndRequestHandoff} are the only ways lock
 * columns change on an open check. Each succeeds (returns 1) only if the row is still at
 * {@code expectedVersion}, and bumps the version when it does, so two terminals racing for the
 * same check cannot both win. Setting the lock also clears any pending handoff.
 */
@Repository
public interface CheckJpaRepository extends JpaRepository<CheckEntity, String> {

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CheckEntity c SET c.lockHolderTerminalId = :terminalId, c.lockHolderEmployeeId = :employeeId,"
            + " c.lockType = :lockType, c.lockAcquiredAt = :acquiredAt, c.handoffToTerminalId = null,"
            + " c.handoffToEmployeeId = null, c.handoffApprovedBy = null, c.version = c.version + 1"
            + " WHERE c.id = :checkId AND c.version = :expectedVersion")
    int compareAndSetLock(
            @Param("checkId") String checkId,
            @Param("expectedVersion") Long expectedVersion,
            @Param("terminalId") String terminalId,
            @Param("employeeId") String employeeId,
            @Param("lockType") LockType lockType,
            @Param("acquiredAt") Instant acquiredAt);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CheckEntity c SET c.handoffToTerminalId = :terminalId, c.handoffToEmployeeId = :employeeId,"
            + " c.handoffApprovedBy = :approvedBy, c.version = c.version + 1"
            + " WHERE c.id = :checkId AND c.version = :expectedVersion")
    int compareAndRequestHandoff(
            @Param("checkId") String checkId,
            @Param("expectedVersion") Long expectedVersion,
            @Param("terminalId") String terminalId,
            @Param("employeeId") String employeeId,
            @Param("approvedBy") String approvedBy);

    List<CheckEntity> findByPropertyIdAndBusinessDateAndStatus(
            String propertyId, LocalDate businessDate, CheckStatus status);

    List<CheckEntity> findByLockHolderTerminalId(String terminalId);

    @Query("SELECT COALESCE(MAX(c.checkNumber), 0) FROM CheckEntity c"
            + " WHERE c.propertyId = :propertyId AND c.businessDate = :businessDate")
    int findMaxCheckNumber(@Param("propertyId") String propertyId, @Param("businessDate") LocalDate businessDate);
}
