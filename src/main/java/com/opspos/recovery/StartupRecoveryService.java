package com.opspos.recovery;

import com.opspos.calendar.BusinessDateService;
import com.opspos.entity.PropertyEntity;
import com.opspos.fiscal.FiscalPeriodService;
import com.opspos.queue.ReplayQueueService;
import com.opspos.repository.jpa.PropertyJpaRepository;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Runs the startup sequence once the application is ready:
 * <ol>
 *   <li>Return replay items left SYNCING by a crash to PENDING</li>
 *   <li>Validate every property's business-date configuration</li>
 *   <li>Open a fiscal period for properties that have none</li>
 *   <li>Register the recoverable services with the RecoveryManager and start them</li>
 * </ol>
 * A failing step is logged; the remaining steps still run where they can.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final ReplayQueueService replayQueueService;
    private final PropertyJpaRepository propertyJpaRepository;
    private final BusinessDateService businessDateService;
    private final FiscalPeriodService fiscalPeriodService;
    private final RecoveryManager recoveryManager;
    private final List<RecoverableService> recoverableServices;
    private final Clock clock;

    public StartupRecoveryService(
            ReplayQueueService replayQueueService,
            PropertyJpaRepository propertyJpaRepository,
            BusinessDateService businessDateService,
            FiscalPeriodService fiscalPeriodService,
            RecoveryManager recoveryManager,
            List<RecoverableService> recoverableServices,
            Clock clock) {
        this.replayQueueService = replayQueueService;
        this.propertyJpaRepository = propertyJpaRepository;
        this.businessDateService = businessDateService;
        this.fiscalPeriodService = fiscalPeriodService;
        this.recoveryManager = recoveryManager;
        this.recoverableServices = recoverableServices;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        run();
    }

    /**
     * Testable version of the startup sequence.
     */
    public RecoveryResult run() {
        log.info("Starting startup recovery sequence...");
        RecoveryResult result = RecoveryResult.builder().startedAt(clock.millis()).build();

        try {
            result.setStuckReplayItemsReset(replayQueueService.resetStuckSyncing());
            validateProperties(result);
            result.setFiscalPeriodsOpened(fiscalPeriodService.ensureOpenPeriods(clock.instant()));
            startServices(result);
            result.setSuccess(result.getInvalidProperties() == 0
                    && result.getServicesRunning() == result.getServicesRegistered());
        } catch (Exception e) {
            result.setSuccess(false);
            result.setError(e.getMessage());
            log.error("Startup recovery failed", e);
        }

        result.setDurationMs(clock.millis() - result.getStartedAt());
        log.info(
                "Startup recovery {}: duration={}ms, replayReset={}, invalidProperties={}, periodsOpened={}, services={}/{}",
                result.isSuccess() ? "completed" : "completed with problems",
                result.getDurationMs(),
                result.getStuckReplayItemsReset(),
                result.getInvalidProperties(),
                result.getFiscalPeriodsOpened(),
                result.getServicesRunning(),
                result.getServicesRegistered());
        return result;
    }

    void validateProperties(RecoveryResult result) {
        List<PropertyEntity> properties = propertyJpaRepository.findAll();
        int invalid = 0;
        for (PropertyEntity property : properties) {
            try {
                businessDateService.validateRolloverConfiguration(property.getTimezone(), property.getRolloverTime());
            } catch (Exception e) {
                invalid++;
                log.error("Property {} has an invalid business-date configuration: {}", property.getId(), e.getMessage());
            }
        }
        result.setPropertiesChecked(properties.size());
        result.setInvalidProperties(invalid);
    }

    void startServices(RecoveryResult result) {
        int registered = 0;
        for (RecoverableService service : recoverableServices) {
            if (!recoveryManager.isRegistered(service.getName())) {
                recoveryManager.register(service);
                registered++;
            }
        }
        recoveryManager.startAll();
        int running = (int) recoveryManager.getAllStates().values().stream()
                .filter(state -> state == ServiceState.RUNNING)
                .count();
        result.setServicesRegistered(registered);
        result.setServicesRunning(running);
    }
}
