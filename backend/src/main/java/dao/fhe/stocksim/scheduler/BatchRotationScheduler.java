package dao.fhe.stocksim.scheduler;

import dao.fhe.stocksim.config.SchedulerProperties;
import dao.fhe.stocksim.exception.SimulationException;
import dao.fhe.stocksim.service.AccessControlService;
import dao.fhe.stocksim.service.BatchLifecycleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Opens a new round on a fixed delay, acting as the current owner. Off by default.
 */
@Slf4j
@Component
public class BatchRotationScheduler {

    private final BatchLifecycleService batchLifecycle;
    private final AccessControlService accessControl;
    private final SchedulerProperties schedulerProps;

    public BatchRotationScheduler(BatchLifecycleService batchLifecycle,
                                  AccessControlService accessControl,
                                  SchedulerProperties schedulerProps) {
        this.batchLifecycle = batchLifecycle;
        this.accessControl = accessControl;
        this.schedulerProps = schedulerProps;
    }

    @Scheduled(fixedDelayString = "${scheduler.rotation.interval-ms:300000}")
    public void rotate() {
        if (!schedulerProps.getRotation().isEnabled()) {
            return;
        }
        try {
            long batchId = batchLifecycle.openBatch(accessControl.owner());
            log.info("Rotated to batch {}", batchId);
        } catch (SimulationException e) {
            log.warn("Batch rotation skipped: {}", e.getMessage());
        }
    }
}
