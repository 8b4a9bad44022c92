package com.opspos.fiscal;

import com.opspos.domain.enums.ReplayEntityType;
import com.opspos.domain.enums.ReplayOperation;
import com.opspos.entity.TimePunchEntity;
import com.opspos.mapper.CheckMapper;
import com.opspos.queue.ReplayQueueService;
import com.opspos.repository.jpa.TimePunchJpaRepository;
import com.opspos.service.AuditService;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Clocks out every shift still open when its business date is closed.
 */
@Service
public class AutoClockOutService {

    private static final Logger log = LoggerFactory.getLogger(AutoClockOutService.class);

    private final TimePunchJpaRepository timePunchJpaRepository;
    private final ReplayQueueService replayQueueService;
    private final CheckMapper checkMapper;
    private final AuditService auditService;

    public AutoClockOutService(
            TimePunchJpaRepository timePunchJpaRepository,
            ReplayQueueService replayQueueService,
            CheckMapper checkMapper,
            AuditService auditService) {
        this.timePunchJpaRepository = timePunchJpaRepository;
        this.replayQueueService = replayQueueService;
        this.checkMapper = checkMapper;
        this.auditService = auditService;
    }

    /**
     * @return number of punches closed
     */
    @Transactional
    public int clockOutOpenPunches(String propertyId, LocalDate businessDate, Instant clockOutAt) {
        List<TimePunchEntity> open =
                timePunchJpaRepository.findByPropertyIdAndClockOutAtIsNullAndBusinessDateLessThanEqual(
                        propertyId, businessDate);
        for (TimePunchEntity punch : open) {
            punch.setClockOutAt(clockOutAt);
            punch.setAutoClockedOut(true);
            punch.setNotes("Automatic clock-out at close of business date " + businessDate);
            timePunchJpaRepository.save(punch);
            replayQueueService.enqueue(
                    ReplayEntityType.TIME_ENTRY,
                    punch.getId(),
                    ReplayOperation.UPDATE,
                    checkMapper.toTimeEntrySnapshot(punch));
            auditService.log(
                    "TIME_PUNCH",
                    "TIME_PUNCH",
                    punch.getId(),
                    "AUTO_CLOCK_OUT",
                    punch.getEmployeeId(),
                    null,
                    Map.of("businessDate", businessDate.toString()));
        }
        if (!open.isEmpty()) {
            log.info("Auto clock-out: {} open punch(es) closed for property {} business date {}",
                    open.size(), propertyId, businessDate);
        }
        return open.size();
    }
}
