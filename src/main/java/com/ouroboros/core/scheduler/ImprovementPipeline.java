package com.ouroboros.core.scheduler;

import com.ouroboros.core.events.EventBus;
import com.ouroboros.core.events.ImprovementEvent;
import com.ouroboros.core.generation.ChangeGenerator;
import com.ouroboros.core.generation.ValidationReport;
import com.ouroboros.core.logging.MdcContext;
import com.ouroboros.core.metrics.OuroborosMetrics;
import com.ouroboros.core.model.ChangeKind;
import com.ouroboros.core.model.CodeChange;
import com.ouroboros.core.model.Improvement;
import com.ouroboros.core.model.ImprovementOpportunity;
import com.ouroboros.core.model.ImprovementResult;
import com.ouroboros.core.model.PipelineStage;
import com.ouroboros.core.model.PublishOutcome;
import com.ouroboros.core.model.VerificationResult;
import com.ouroboros.core.publish.GitPublisher;
import com.ouroboros.core.snapshot.RollbackException;
import com.ouroboros.core.snapshot.SnapshotException;
import com.ouroboros.core.snapshot.SnapshotManager;
import com.ouroboros.sandbox.IsolatedVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moves one opportunity through the improvement state machine:
 *
 * <pre>
 * GENERATING -> VALIDATING -> SNAPSHOTTING -> APPLYING -> [VERIFYING] -> COMMITTING -> PUBLISHING -> DONE
 * </pre>
 *
 * Failures before the snapshot leave no trace on the project tree. Any failure at or
 * after SNAPSHOTTING is rolled back before the result is returned; a rollback that
 * itself fails is escalated as critical. Every result is appended to the
 * {@link ResultLog}, published on the {@link EventBus} and counted.
 */
@Service
public class ImprovementPipeline {

    private static final Logger log = LoggerFactory.getLogger(ImprovementPipeline.class);

    private final ChangeGenerator generator;
    private final SnapshotManager snapshots;
    private final IsolatedVerifier verifier;
    private final GitPublisher publisher;
    private final ResultLog resultLog;
    private final EventBus eventBus;
    private final OuroborosMetrics metrics;
    private final Clock clock;

    public ImprovementPipeline(ChangeGenerator generator, SnapshotManager snapshots, IsolatedVerifier verifier,
                               GitPublisher publisher, ResultLog resultLog, EventBus eventBus,
                               OuroborosMetrics metrics, Clock clock) {
        this.generator = generator;
        this.snapshots = snapshots;
        this.verifier = verifier;
        this.publisher = publisher;
        this.resultLog = resultLog;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /** Mutable progress of one opportunity. */
    private static final class Run {
        final ImprovementOpportunity opportunity;
        PipelineStage stage = PipelineStage.PENDING;
        long stageStartedAt;
        String snapshotId;
        int applied;

        Run(ImprovementOpportunity opportunity) {
            this.opportunity = opportunity;
        }
    }

    /**
     * Processes one opportunity to a terminal stage. Never throws.
     */
    public ImprovementResult process(ImprovementOpportunity opportunity) {
        var run = new Run(opportunity);
        MdcContext.setOpportunity(opportunity.id());
        log.info("Processing opportunity {} ({}, priority {}): {}", opportunity.id(), opportunity.type(),
                opportunity.priority(), opportunity.description());
        try {
            return finish(execute(run));
        } catch (RuntimeException e) {
            log.error("Unexpected error at stage {} for opportunity {}: {}", run.stage, opportunity.id(),
                    e.getMessage(), e);
            if (run.stage.requiresRollbackOnFailure() && run.snapshotId != null) {
                return finish(rollback(run, "Unexpected error at " + run.stage + ": " + e.getMessage()));
            }
            return finish(ImprovementResult.failure(opportunity.id(), PipelineStage.FAILED,
                    "Failed at " + run.stage + ": " + e.getMessage(), run.snapshotId, clock.instant()));
        } finally {
            MdcContext.clearOpportunity();
        }
    }

    private ImprovementResult execute(Run run) {
        String id = run.opportunity.id();

        enter(run, PipelineStage.GENERATING);
        Improvement candidate = generator.generate(run.opportunity);
        if (candidate == null) {
            return ImprovementResult.failure(id, PipelineStage.REJECTED,
                    "Change generation produced no usable improvement", null, clock.instant());
        }

        enter(run, PipelineStage.VALIDATING);
        ValidationReport report = generator.validate(candidate);
        if (!report.ok()) {
            return ImprovementResult.failure(id, PipelineStage.REJECTED,
                    "Validation failed: " + String.join("; ", report.errors()), null, clock.instant());
        }
        Improvement improvement = report.improvement();

        enter(run, PipelineStage.SNAPSHOTTING);
        run.snapshotId = snapshots.createSnapshot(improvement.id(), improvement.touchedPaths());

        enter(run, PipelineStage.APPLYING);
        try {
            run.applied = snapshots.apply(run.snapshotId, improvement);
        } catch (SnapshotException e) {
            run.applied = e.appliedCount();
            return rollback(run, "Apply failed: " + e.getMessage());
        }

        if (improvement.hasVerificationScript()) {
            enter(run, PipelineStage.VERIFYING);
            VerificationResult verification = verifier.run(improvement.verificationScript(), affectedContent(improvement));
            if (!verification.passed()) {
                String reason = verification.timedOut()
                        ? verification.error()
                        : "exit code " + verification.exitCode()
                            + (verification.error() != null ? ": " + tail(verification.error()) : "");
                return rollback(run, "Verification failed (" + verification.backend() + "): " + reason);
            }
            if (!verification.isolated()) {
                log.warn("Improvement {} was verified without isolation", id);
            }
        } else {
            log.info("No verification script for {}; skipping verification", id);
        }

        enter(run, PipelineStage.COMMITTING);
        snapshots.commitImprovement(run.snapshotId, improvement);

        enter(run, PipelineStage.PUBLISHING);
        PublishOutcome publish = publisher.commitAndPublish(improvement.title(), improvement.description(),
                improvement.id(), improvement.touchedPaths());
        metrics.recordPublish(publish.pushed());

        enter(run, PipelineStage.DONE);
        String message = "Applied " + run.applied + " change(s): " + improvement.title();
        if (!publish.success()) {
            message += " (publish failed: " + publish.error() + ")";
        } else if (publish.isDegraded()) {
            message += " (committed " + publish.commitId() + ", push failed: " + publish.pushFailure() + ")";
        } else if (publish.pushed()) {
            message += " (published " + publish.commitId() + ")";
        }
        return new ImprovementResult(id, true, message, run.applied, clock.instant(),
                PipelineStage.DONE, run.snapshotId, publish);
    }

    private ImprovementResult rollback(Run run, String reason) {
        String id = run.opportunity.id();
        log.warn("Rolling back opportunity {} to snapshot {}: {}", id, run.snapshotId, reason);
        try {
            snapshots.rollbackTo(run.snapshotId);
            metrics.recordRollback(true);
            return new ImprovementResult(id, false, reason + "; rolled back", 0, clock.instant(),
                    PipelineStage.ROLLED_BACK, run.snapshotId, null);
        } catch (RollbackException | SnapshotException e) {
            log.error("CRITICAL: rollback of snapshot {} failed for opportunity {}: {}", run.snapshotId, id,
                    e.getMessage(), e);
            metrics.recordRollback(false);
            metrics.incrementEscalations("rollback_failed");
            var payload = new HashMap<String, Object>();
            payload.put("snapshotId", run.snapshotId);
            payload.put("reason", reason);
            payload.put("error", String.valueOf(e.getMessage()));
            eventBus.publish(new ImprovementEvent(ImprovementEvent.ROLLBACK_FAILED, id, payload, clock.instant()));
            return new ImprovementResult(id, false, reason + "; ROLLBACK FAILED: " + e.getMessage(),
                    run.applied, clock.instant(), PipelineStage.ROLLBACK_FAILED, run.snapshotId, null);
        }
    }

    private void enter(Run run, PipelineStage next) {
        long now = clock.millis();
        if (run.stage != PipelineStage.PENDING) {
            metrics.recordStageDuration(run.stage, now - run.stageStartedAt);
        }
        run.stage = next;
        run.stageStartedAt = now;
        MdcContext.setStage(next);
        log.info("Opportunity {} -> {}", run.opportunity.id(), next);
        var payload = new HashMap<String, Object>();
        payload.put("stage", next.name());
        eventBus.publish(new ImprovementEvent(ImprovementEvent.STAGE_CHANGED, run.opportunity.id(), payload,
                clock.instant()));
    }

    private ImprovementResult finish(ImprovementResult result) {
        MdcContext.setStage(result.stage());
        if (result.success()) {
            log.info("Opportunity {} finished: {}", result.opportunityId(), result.message());
        } else if (result.stage() == PipelineStage.ROLLBACK_FAILED) {
            log.error("Opportunity {} finished in {}: {}", result.opportunityId(), result.stage(), result.message());
        } else {
            log.warn("Opportunity {} finished in {}: {}", result.opportunityId(), result.stage(), result.message());
        }
        try {
            resultLog.append(result);
        } catch (RuntimeException e) {
            log.error("Failed to append result for {} to the result log: {}", result.opportunityId(), e.getMessage());
        }
        metrics.recordResult(result.stage());
        var payload = new HashMap<String, Object>();
        payload.put("result", result);
        payload.put("success", result.success());
        payload.put("stage", result.stage().name());
        eventBus.publish(new ImprovementEvent(ImprovementEvent.IMPROVEMENT_RESULT, result.opportunityId(), payload,
                result.timestamp()));
        return result;
    }

    static Map<String, String> affectedContent(Improvement improvement) {
        var content = new LinkedHashMap<String, String>();
        for (CodeChange change : improvement.changes()) {
            if (change.kind() != ChangeKind.DELETE && change.newContent() != null) {
                content.put(change.path(), change.newContent());
            }
        }
        return content;
    }

    private static String tail(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= 500 ? trimmed : "..." + trimmed.substring(trimmed.length() - 500);
    }
}
