package dao.fhe.stocksim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private PendingMonitorConfig pendingMonitor = new PendingMonitorConfig();
    private RotationConfig rotation = new RotationConfig();

    @Data
    public static class PendingMonitorConfig {
        /**
         * Enable/disable the outstanding decryption report
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to scan pending decryption requests (in milliseconds)
         * Default: 60000ms
         */
        private long checkIntervalMs = 60_000;

        /**
         * Age in seconds after which a pending request is reported
         * Default: 600 seconds
         */
        private long staleAfterSeconds = 600;
    }

    @Data
    public static class RotationConfig {
        /**
         * Enable/disable automatic batch rotation (acts as the configured owner)
         * Default: false
         */
        private boolean enabled = false;

        /**
         * How often a new batch is opened (in milliseconds)
         * Default: 300000ms (5 minutes)
         */
        private long intervalMs = 300_000;
    }
}
