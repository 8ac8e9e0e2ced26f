package com.ouroboros.core.snapshot;

/**
 * Thrown when a snapshot cannot be captured or an improvement cannot be applied
 * in full. {@link #appliedCount()} tells how many changes were written before the
 * failure, so the caller knows a rollback is needed.
 */
public class SnapshotException extends RuntimeException {

    private final int appliedCount;

    public SnapshotException(String message, int appliedCount) {
        super(message);
        this.appliedCount = appliedCount;
    }

    public SnapshotException(String message, int appliedCount, Throwable cause) {
        super(message, cause);
        this.appliedCount = appliedCount;
    }

    public int appliedCount() {
        return appliedCount;
    }
}
