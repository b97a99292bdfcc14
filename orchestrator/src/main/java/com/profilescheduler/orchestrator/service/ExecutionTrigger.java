package com.profilescheduler.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Trusted periodic trigger: runs the engine every few minutes in-process.
 *
 * fixedDelay means the next tick starts only after the previous run has
 * returned, so ticks from this trigger never overlap each other. Overlap
 * with a manual HTTP trigger is still possible and is handled by the claim.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "profilescheduler.trigger.enabled", havingValue = "true", matchIfMissing = true)
public class ExecutionTrigger {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTrigger.class);

    private final ExecutionOrchestrator orchestrator;

    public ExecutionTrigger(ExecutionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedDelayString = "${profilescheduler.trigger.interval-ms:300000}",
               initialDelayString = "${profilescheduler.trigger.initial-delay-ms:10000}")
    public void tick() {
        try {
            RunReport report = orchestrator.runOnce();
            if (!report.results().isEmpty()) {
                log.info("Periodic run: {} executed, {} failed", report.executed(), report.failed());
            }
        } catch (Exception e) {
            log.error("Periodic schedule run failed: {}", e.getMessage(), e);
        }
    }
}
