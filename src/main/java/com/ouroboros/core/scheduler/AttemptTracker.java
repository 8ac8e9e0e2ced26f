package com.ouroboros.core.scheduler;

import com.ouroboros.core.config.OuroborosProperties;
import com.ouroboros.core.model.ImprovementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Suppresses opportunities that keep failing: an opportunity is skipped when its
 * last {@code max-consecutive-failures} results inside the suppression window
 * were all failures. Computed from the result log, so it survives restarts.
 */
@Service
public class AttemptTracker {

    private static final Logger log = LoggerFactory.getLogger(AttemptTracker.class);

    private final ResultLog resultLog;
    private final OuroborosProperties.Scheduler settings;
    private final Clock clock;

    public AttemptTracker(ResultLog resultLog, OuroborosProperties properties, Clock clock) {
        this.resultLog = resultLog;
        this.settings = properties.getScheduler();
        this.clock = clock;
    }

    public boolean isSuppressed(String opportunityId) {
        return isSuppressed(opportunityId, resultLog.readAll());
    }

    boolean isSuppressed(String opportunityId, List<ImprovementResult> results) {
        int limit = settings.getMaxConsecutiveFailures();
        if (limit <= 0) return false;
        Instant cutoff = clock.instant().minus(settings.getSuppressionWindow());
        List<ImprovementResult> recent = results.stream()
                .filter(r -> opportunityId.equals(r.opportunityId()))
                .filter(r -> r.timestamp() != null && r.timestamp().isAfter(cutoff))
                .toList();
        if (recent.size() < limit) {
            return false;
        }
        boolean suppressed = recent.subList(recent.size() - limit, recent.size()).stream()
                .noneMatch(ImprovementResult::success);
        if (suppressed) {
            log.info("Opportunity {} suppressed after {} consecutive failures", opportunityId, limit);
        }
        return suppressed;
    }

    public int consecutiveFailures(String opportunityId) {
        List<ImprovementResult> results = resultLog.readAll();
        int count = 0;
        for (int i = results.size() - 1; i >= 0; i--) {
            ImprovementResult r = results.get(i);
            if (!opportunityId.equals(r.opportunityId())) continue;
            if (r.success()) break;
            count++;
        }
        return count;
    }
}
