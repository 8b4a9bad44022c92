package com.opspos.repository.jpa;

import com.opspos.entity.AuditLogEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the audit_logs table.
 */
@Repository
public interface AuditLogJpaRepository extends JpaRepository<AuditLogEntity, Long> {

    List<AuditLogEntity> findByEventType(String eventType);

    @Query("SELECT a FROM AuditLogEntity a WHERE a.entityType = :entityType AND a.entityId = :entityId"
            + " ORDER BY a.timestamp DESC")
    List<AuditLogEntity> findByEntityOrderByTimestampDesc(
            @Param("entityType") String entityType, @Param("entityId") String entityId);
}
