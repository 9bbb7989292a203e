package com.adsintel.optimizer.scheduler;

import com.adsintel.optimizer.config.BidOptimizerProperties;
import com.adsintel.optimizer.config.ConfigurationMissingException;
import com.adsintel.optimizer.output.JdbcReportWriter;
import com.adsintel.optimizer.service.BidOptimizationService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup optimisation runs.
 *
 * Default schedule: every day at 04:00 UTC, after the overnight click log import.
 * Override with OPTIMIZER_CRON or bid-optimizer.scheduling.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OptimizationScheduler {

    private final BidOptimizationService optimizationService;
    private final JdbcReportWriter jdbcReportWriter;
    private final BidOptimizerProperties properties;

    /**
     * On application startup:
     *  1. Ensure the report tables exist
     *  2. Optionally run once if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        if (properties.getOutput().getMode() != BidOptimizerProperties.Output.OutputMode.CSV) {
            try {
                jdbcReportWriter.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise report schema (running in CSV-only mode?): {}", e.getMessage());
            }
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, optimising campaign {}", properties.getOptimization().getCampaignId());
            runSafely();
        } else {
            log.info("Optimizer ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${bid-optimizer.scheduling.cron:0 0 4 * * ?}", zone = "UTC")
    public void scheduledRun() {
        log.info("Scheduled optimisation triggered");
        runSafely();
    }

    private void runSafely() {
        try {
            optimizationService.optimizeConfigured();
        } catch (ConfigurationMissingException e) {
            log.error("Optimisation skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Optimisation run failed: {}", e.getMessage(), e);
        }
    }
}
