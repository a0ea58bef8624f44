package com.evidencevault.retention;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the retention sweep on the configured cron, daily at 03:00 by default.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "vault.retention", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class RetentionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RetentionScheduler.class);

    private static final Duration SWEEP_TIMEOUT = Duration.ofHours(1);

    private final RetentionService retentionService;

    public RetentionScheduler(RetentionService retentionService) {
        this.retentionService = retentionService;
    }

    @Scheduled(cron = "${vault.retention.sweep-cron:0 0 3 * * *}")
    public void sweep() {
        logger.info("Starting retention sweep");
        try {
            SweepReport report = retentionService.expireVaults().block(SWEEP_TIMEOUT);
            if (report != null && !report.failed().isEmpty()) {
                logger.warn("Retention sweep left {} vault(s) for the next run: {}",
                        report.failed().size(), report.failed());
            }
        } catch (RuntimeException e) {
            logger.error("Retention sweep aborted", e);
        }
    }
}
