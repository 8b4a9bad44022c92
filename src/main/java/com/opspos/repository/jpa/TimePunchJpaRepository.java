package com.opspos.repository.jpa;

import com.opspos.entity.TimePunchEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TimePunchJpaRepository extends JpaRepository<TimePunchEntity, String> {

    List<TimePunchEntity> findByPropertyIdAndClockOutAtIsNullAndBusinessDateLessThanEqual(
            String propertyId, LocalDate businessDate);
}
