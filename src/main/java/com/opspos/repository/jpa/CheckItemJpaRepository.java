package com.opspos.repository.jpa;

import com.opspos.entity.CheckItemEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CheckItemJpaRepository extends JpaRepository<CheckItemEntity, Long> {

    List<CheckItemEntity> findByCheckIdOrderByIdAsc(String checkId);

    Optional<CheckItemEntity> findByCheckIdAndLineItemId(String checkId, String lineItemId);
}
