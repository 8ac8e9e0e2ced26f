package com.ouroboros.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Audit record of one improvement attempt. Appended to the result log, never rewritten.
 *
 * @param opportunityId  the opportunity that was processed
 * @param success        whether the improvement ended up applied
 * @param message        human-readable outcome
 * @param changesApplied number of changes left applied (0 after rollback)
 * @param timestamp      when the attempt finished
 * @param stage          terminal pipeline stage
 * @param snapshotId     snapshot taken before applying (nullable)
 * @param publish        publish outcome (nullable when not reached or disabled)
 */
public record ImprovementResult(
    String opportunityId,
    boolean success,
    String message,
    int changesApplied,
    Instant timestamp,
    PipelineStage stage,
    String snapshotId,
    PublishOutcome publish
) implements Serializable {

    public static ImprovementResult failure(String opportunityId, PipelineStage stage,
                                            String message, String snapshotId, Instant at) {
        return new ImprovementResult(opportunityId, false, message, 0, at, stage, snapshotId, null);
    }

    public boolean pushed() {
        return publish != null && publish.pushed();
    }
}
