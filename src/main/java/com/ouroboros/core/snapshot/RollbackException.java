package com.ouroboros.core.snapshot;

/**
 * Thrown when captured content cannot be restored. The monitored tree may be left
 * in a partially restored state; callers escalate this as critical.
 */
public class RollbackException extends RuntimeException {

    private final String snapshotId;

    public RollbackException(String snapshotId, String message) {
        super(message);
        this.snapshotId = snapshotId;
    }

    public RollbackException(String snapshotId, String message, Throwable cause) {
        super(message, cause);
        this.snapshotId = snapshotId;
    }

    public String snapshotId() {
        return snapshotId;
    }
}
