package dao.fhe.stocksim.scheduler;

import dao.fhe.stocksim.config.SchedulerProperties;
import dao.fhe.stocksim.model.DecryptionContext;
import dao.fhe.stocksim.service.DecryptionRequestManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reports decryption requests the oracle has not answered for a while. Reporting only:
 * requests are never expired or cancelled.
 */
@Slf4j
@Component
public class PendingDecryptionMonitor {

    private final DecryptionRequestManager decryptionManager;
    private final SchedulerProperties schedulerProps;
    private final Clock clock;

    public PendingDecryptionMonitor(DecryptionRequestManager decryptionManager,
                                    SchedulerProperties schedulerProps,
                                    Clock clock) {
        this.decryptionManager = decryptionManager;
        this.schedulerProps = schedulerProps;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${scheduler.pending-monitor.check-interval-ms:60000}")
    public void reportStaleRequests() {
        if (!schedulerProps.getPendingMonitor().isEnabled()) {
            return;
        }
        List<DecryptionContext> stale = findStale();
        if (stale.isEmpty()) return;

        log.warn("{} decryption request(s) pending longer than {}s: {}",
                stale.size(),
                schedulerProps.getPendingMonitor().getStaleAfterSeconds(),
                stale.stream().map(DecryptionContext::getRequestId).collect(Collectors.toList()));
    }

    public List<DecryptionContext> findStale() {
        long now = clock.instant().getEpochSecond();
        long staleAfter = schedulerProps.getPendingMonitor().getStaleAfterSeconds();
        return decryptionManager.pendingContexts().stream()
                .filter(c -> now - c.getRequestedAt() >= staleAfter)
                .collect(Collectors.toList());
    }
}
