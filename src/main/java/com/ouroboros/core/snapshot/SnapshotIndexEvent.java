package com.ouroboros.core.snapshot;

import com.ouroboros.core.model.Snapshot;

import java.time.Instant;
import java.util.List;

/**
 * One line of {@code snapshots/index.jsonl}. The index is append-only; snapshot
 * state is folded from the sequence of events.
 *
 * @param type       what happened to the snapshot
 * @param snapshotId the snapshot concerned
 * @param label      label at creation, or the improvement id for later events
 * @param entries    captured entries; only present on {@link Type#CREATED}
 * @param timestamp  when the event was written
 */
public record SnapshotIndexEvent(
    Type type,
    String snapshotId,
    String label,
    List<Snapshot.Entry> entries,
    Instant timestamp
) {

    public enum Type { CREATED, SUPERSEDED, RESTORED, PRUNED }
}
