package com.opspos.repository.jpa;

import com.opspos.domain.enums.RolloverMode;
import com.opspos.entity.PropertyEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PropertyJpaRepository extends JpaRepository<PropertyEntity, String> {

    List<PropertyEntity> findByRolloverMode(RolloverMode rolloverMode);
}
