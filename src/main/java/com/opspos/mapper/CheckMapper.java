package com.opspos.mapper;

import com.opspos.domain.model.CheckItemSnapshot;
import com.opspos.domain.model.CheckSnapshot;
import com.opspos.domain.model.PaymentSnapshot;
import com.opspos.domain.model.TimeEntrySnapshot;
import com.opspos.entity.CheckEntity;
import com.opspos.entity.CheckItemEntity;
import com.opspos.entity.PaymentEntity;
import com.opspos.entity.TimePunchEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from the JPA entities to the snapshots that are replayed upstream
 * and returned by the API. Lock columns never appear in a snapshot; they are local
 * coordination state.
 */
@Mapper
public interface CheckMapper {

    @Mapping(target = "items", ignore = true)
    CheckSnapshot toSnapshot(CheckEntity entity);

    CheckItemSnapshot toItemSnapshot(CheckItemEntity entity);

    List<CheckItemSnapshot> toItemSnapshots(List<CheckItemEntity> entities);

    PaymentSnapshot toPaymentSnapshot(PaymentEntity entity);

    TimeEntrySnapshot toTimeEntrySnapshot(TimePunchEntity entity);

    default CheckSnapshot withItems(CheckEntity entity, List<CheckItemEntity> items) {
        CheckSnapshot snapshot = toSnapshot(entity);
        snapshot.setItems(toItemSnapshots(items));
        return snapshot;
    }
}
