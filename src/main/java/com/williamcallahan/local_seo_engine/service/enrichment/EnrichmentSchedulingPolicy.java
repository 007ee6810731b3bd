package com.williamcallahan.local_seo_engine.service.enrichment;

import com.williamcallahan.local_seo_engine.config.EnrichmentProperties;
import com.williamcallahan.local_seo_engine.model.EnrichmentTask;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.repository.EnrichmentTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Decides per (place, kind) whether a new submission is due, comparing the age of the most
 * recent ledger row against the kind's refresh threshold.
 */
@Service
public class EnrichmentSchedulingPolicy {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentSchedulingPolicy.class);

    private final EnrichmentTaskRepository taskRepository;
    private final EnrichmentProperties enrichmentProperties;
    private final Clock clock;

    public EnrichmentSchedulingPolicy(EnrichmentTaskRepository taskRepository,
                                      EnrichmentProperties enrichmentProperties,
                                      Clock clock) {
        this.taskRepository = taskRepository;
        this.enrichmentProperties = enrichmentProperties;
        this.clock = clock;
    }

    /**
     * @param remaining cooldown left before the kind is due; zero when due
     */
    public record Decision(TaskKind kind, boolean due, Duration remaining) {
    }

    public List<Decision> evaluate(String placeId, Collection<TaskKind> requestedKinds) {
        Map<TaskKind, EnrichmentTask> latest = taskRepository.findLatestByKind(placeId);
        Instant now = clock.instant();
        List<Decision> decisions = new ArrayList<>();
        for (TaskKind kind : requestedKinds) {
            decisions.add(decide(kind, latest.get(kind), now));
        }
        return decisions;
    }

    /**
     * Requested kinds that are due, in request order. Skipped kinds are logged with their cooldown.
     */
    public List<TaskKind> dueKinds(String placeId, Collection<TaskKind> requestedKinds) {
        List<TaskKind> due = new ArrayList<>();
        for (Decision decision : evaluate(placeId, requestedKinds)) {
            if (decision.due()) {
                due.add(decision.kind());
            } else {
                logger.info("Skipping {} for place {}: refreshed recently, due again in {}h {}m.",
                    decision.kind().getCode(), placeId,
                    decision.remaining().toHours(), decision.remaining().toMinutesPart());
            }
        }
        return due;
    }

    private Decision decide(TaskKind kind, EnrichmentTask latest, Instant now) {
        Duration threshold = enrichmentProperties.thresholdFor(kind);
        if (threshold.isZero() || latest == null || latest.getCreatedAt() == null) {
            return new Decision(kind, true, Duration.ZERO);
        }
        Duration age = Duration.between(latest.getCreatedAt(), now);
        if (age.compareTo(threshold) >= 0) {
            return new Decision(kind, true, Duration.ZERO);
        }
        return new Decision(kind, false, threshold.minus(age));
    }
}
