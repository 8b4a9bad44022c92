package com.opspos.service;

import com.opspos.calendar.BusinessDateService;
import com.opspos.domain.enums.ReplayEntityType;
import com.opspos.domain.enums.ReplayOperation;
import com.opspos.entity.PropertyEntity;
import com.opspos.entity.TimePunchEntity;
import com.opspos.exception.BusinessException;
import com.opspos.exception.ResourceNotFoundException;
import com.opspos.mapper.CheckMapper;
import com.opspos.queue.ReplayQueueService;
import com.opspos.repository.jpa.PropertyJpaRepository;
import com.opspos.repository.jpa.TimePunchJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Employee clock-in / clock-out. A shift belongs to the business date of its clock-in.
 */
@Service
public class TimePunchService {

    private static final Logger log = LoggerFactory.getLogger(TimePunchService.class);

    private final TimePunchJpaRepository timePunchJpaRepository;
    private final PropertyJpaRepository propertyJpaRepository;
    private final BusinessDateService businessDateService;
    private final ReplayQueueService replayQueueService;
    private final CheckMapper checkMapper;
    private final Clock clock;

    public TimePunchService(
            TimePunchJpaRepository timePunchJpaRepository,
            PropertyJpaRepository propertyJpaRepository,
            BusinessDateService businessDateService,
            ReplayQueueService replayQueueService,
            CheckMapper checkMapper,
            Clock clock) {
        this.timePunchJpaRepository = timePunchJpaRepository;
        this.propertyJpaRepository = propertyJpaRepository;
        this.businessDateService = businessDateService;
        this.replayQueueService = replayQueueService;
        this.checkMapper = checkMapper;
        this.clock = clock;
    }

    @Transactional
    public TimePunchEntity clockIn(String propertyId, String employeeId) {
        PropertyEntity property = propertyJpaRepository
                .findById(propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Property", propertyId));
        Instant now = clock.instant();
        TimePunchEntity punch = timePunchJpaRepository.save(TimePunchEntity.builder()
                .id(UUID.randomUUID().toString())
                .propertyId(propertyId)
                .employeeId(employeeId)
                .businessDate(businessDateService.getCurrentBusinessDate(property))
                .clockInAt(now)
                .build());
        replayQueueService.enqueue(
                ReplayEntityType.TIME_ENTRY, punch.getId(), ReplayOperation.CREATE, checkMapper.toTimeEntrySnapshot(punch));
        log.info("Employee {} clocked in for business date {}", employeeId, punch.getBusinessDate());
        return punch;
    }

    @Transactional
    public TimePunchEntity clockOut(String punchId) {
        TimePunchEntity punch = timePunchJpaRepository
                .findById(punchId)
                .orElseThrow(() -> new ResourceNotFoundException("TimePunch", punchId));
        if (punch.getClockOutAt() != null) {
            throw new BusinessException("Time punch " + punchId + " is already clocked out");
        }
        punch.setClockOutAt(clock.instant());
        punch = timePunchJpaRepository.save(punch);
        replayQueueService.enqueue(
                ReplayEntityType.TIME_ENTRY, punch.getId(), ReplayOperation.UPDATE, checkMapper.toTimeEntrySnapshot(punch));
        log.info("Employee {} clocked out", punch.getEmployeeId());
        return punch;
    }
}
