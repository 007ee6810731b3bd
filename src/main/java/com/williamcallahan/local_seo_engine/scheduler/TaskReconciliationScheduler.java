package com.williamcallahan.local_seo_engine.scheduler;

import com.williamcallahan.local_seo_engine.config.EnrichmentProperties;
import com.williamcallahan.local_seo_engine.service.enrichment.EnrichmentOrchestrator;
import com.williamcallahan.local_seo_engine.types.BulkPopulateSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Periodic reconciliation of in-flight enrichment tasks, optionally followed by populating
 * everything that became ready.
 */
@Component
public class TaskReconciliationScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TaskReconciliationScheduler.class);

    private final EnrichmentProperties enrichmentProperties;
    private final EnrichmentOrchestrator orchestrator;

    public TaskReconciliationScheduler(EnrichmentProperties enrichmentProperties,
                                       EnrichmentOrchestrator orchestrator) {
        this.enrichmentProperties = enrichmentProperties;
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedDelayString = "${enrichment.reconcile-interval-ms:300000}",
               initialDelayString = "${enrichment.reconcile-initial-delay-ms:60000}")
    public void reconcile() {
        if (!enrichmentProperties.isSchedulerEnabled()) {
            logger.debug("Task reconciliation scheduler skipped: disabled via configuration.");
            return;
        }

        Instant start = Instant.now();
        int touched;
        try {
            touched = orchestrator.refreshTaskStatuses();
        } catch (RuntimeException e) {
            logger.warn("Scheduled reconciliation failed: {}", e.getMessage(), e);
            return;
        }

        BulkPopulateSummary summary = null;
        if (enrichmentProperties.isPopulateReadyOnSchedule()) {
            try {
                summary = orchestrator.populateReadyTasks(null);
            } catch (RuntimeException e) {
                logger.warn("Scheduled populate of ready tasks failed: {}", e.getMessage(), e);
            }
        }

        Duration elapsed = Duration.between(start, Instant.now());
        if (summary == null) {
            logger.info("Task reconciliation finished in {}ms (touched={}).", elapsed.toMillis(), touched);
        } else {
            logger.info("Task reconciliation finished in {}ms (touched={}, populate={{attempted:{}, succeeded:{}, failed:{}, items:{}}}).",
                elapsed.toMillis(), touched, summary.attempted(), summary.succeeded(), summary.failed(), summary.itemCount());
        }
    }
}
