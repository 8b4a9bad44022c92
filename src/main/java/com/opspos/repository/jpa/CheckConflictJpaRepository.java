package com.opspos.repository.jpa;

import com.opspos.domain.enums.ConflictStatus;
import com.opspos.entity.CheckConflictEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface CheckConflictJpaRepository extends JpaRepository<CheckConflictEntity, Long> {

    List<CheckConflictEntity> findByStatusOrderByCreatedAtAsc(ConflictStatus status);

    /** Pending conflicts a terminal took part in, either as the offline holder or the overrider. */
    @Query("SELECT c FROM CheckConflictEntity c WHERE c.status = :status"
            + " AND (c.originalHolderTerminalId = :terminalId OR c.overridingTerminalId = :terminalId)"
            + " ORDER BY c.createdAt ASC")
    List<CheckConflictEntity> findByTerminalAndStatus(
            @Param("terminalId") String terminalId, @Param("status") ConflictStatus status);

    boolean existsByOriginalCheckIdAndStatus(String originalCheckId, ConflictStatus status);
}
