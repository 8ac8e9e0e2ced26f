package com.ouroboros.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time capture of the resources an improvement is about to touch.
 *
 * @param id        snapshot identifier
 * @param label     human-readable label
 * @param entries   one entry per captured resource
 * @param createdAt when the capture happened
 * @param state     lifecycle state folded from the snapshot index
 */
public record Snapshot(
    String id,
    String label,
    List<Entry> entries,
    Instant createdAt,
    State state
) implements Serializable {

    public Snapshot {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public enum State { ACTIVE, SUPERSEDED, RESTORED, PRUNED }

    /**
     * @param path    resource path relative to the project root
     * @param existed whether the resource existed at capture time
     * @param blob    file name of the raw captured content inside the snapshot directory (nullable)
     * @param sha256  hex digest of the captured content (nullable)
     * @param mode    POSIX permissions at capture time, e.g. {@code rwxr-xr-x} (nullable)
     */
    public record Entry(String path, boolean existed, String blob, String sha256, String mode)
            implements Serializable {}

    public List<String> paths() {
        return entries.stream().map(Entry::path).toList();
    }

    public Snapshot withState(State newState) {
        return new Snapshot(id, label, entries, createdAt, newState);
    }
}
