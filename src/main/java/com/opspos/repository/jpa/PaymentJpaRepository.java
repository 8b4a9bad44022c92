package com.opspos.repository.jpa;

import com.opspos.entity.PaymentEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PaymentJpaRepository extends JpaRepository<PaymentEntity, String> {

    List<PaymentEntity> findByCheckId(String checkId);

    List<PaymentEntity> findByCheckIdIn(Collection<String> checkIds);
}
