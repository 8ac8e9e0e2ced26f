package com.ouroboros.core.model;

/**
 * Stage of a single opportunity moving through the improvement pipeline.
 *
 * <pre>
 * PENDING -> GENERATING -> VALIDATING -(fail)-> REJECTED
 * VALIDATING(ok) -> SNAPSHOTTING -> APPLYING -(fail)-> ROLLED_BACK
 * APPLYING(ok) -> [VERIFYING -(fail)-> ROLLED_BACK]
 * VERIFYING(ok or absent) -> COMMITTING -> PUBLISHING -> DONE
 * </pre>
 */
public enum PipelineStage {
    PENDING,
    GENERATING,
    VALIDATING,
    SNAPSHOTTING,
    APPLYING,
    VERIFYING,
    COMMITTING,
    PUBLISHING,
    DONE,
    REJECTED,
    FAILED,
    ROLLED_BACK,
    ROLLBACK_FAILED;

    /** Stages from which a failure must be followed by a rollback. */
    public boolean requiresRollbackOnFailure() {
        return switch (this) {
            case SNAPSHOTTING, APPLYING, VERIFYING, COMMITTING, PUBLISHING -> true;
            default -> false;
        };
    }

    public boolean isTerminal() {
        return switch (this) {
            case DONE, REJECTED, FAILED, ROLLED_BACK, ROLLBACK_FAILED -> true;
            default -> false;
        };
    }
}
