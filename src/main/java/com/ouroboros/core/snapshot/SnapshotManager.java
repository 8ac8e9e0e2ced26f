package com.ouroboros.core.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ouroboros.core.config.OuroborosProperties;
import com.ouroboros.core.model.ChangeKind;
import com.ouroboros.core.model.CodeChange;
import com.ouroboros.core.model.Improvement;
import com.ouroboros.core.model.Snapshot;
import com.ouroboros.core.persistence.StateFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Captures the pre-change content of the resources an improvement touches and
 * restores it on demand. This is the only component that writes to the monitored
 * project tree.
 * <p>
 * Layout under {@code <state-dir>/snapshots}: one directory per snapshot holding
 * {@code <n>.blob} raw copies, plus the append-only {@code index.jsonl}.
 */
@Service
public class SnapshotManager {

    private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);

    static final String INDEX_FILE = "index.jsonl";

    private final Path projectRoot;
    private final Path snapshotsDir;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public SnapshotManager(OuroborosProperties properties, Clock clock) {
        this(properties.projectRootPath(), properties.stateDirPath().resolve("snapshots"), clock);
    }

    public SnapshotManager(Path projectRoot, Path snapshotsDir, Clock clock) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.snapshotsDir = snapshotsDir.toAbsolutePath().normalize();
        this.clock = clock;
    }

    /**
     * Captures the current content, or absence, of each path.
     *
     * @param label human-readable label, usually the improvement id
     * @param paths paths relative to the project root
     * @return the new snapshot id
     * @throws SnapshotException when any resource cannot be captured
     */
    public String createSnapshot(String label, List<String> paths) {
        Instant now = clock.instant();
        String id = "snap-" + now.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 8);
        Path dir = snapshotsDir.resolve(id);

        lock.lock();
        try {
            Files.createDirectories(dir);
            var entries = new ArrayList<Snapshot.Entry>();
            int n = 0;
            for (String path : paths) {
                Path target = resolveInRoot(path);
                String key = projectRoot.relativize(target).toString().replace('\\', '/');
                if (Files.isRegularFile(target)) {
                    byte[] content = Files.readAllBytes(target);
                    String blob = n++ + ".blob";
                    Files.write(dir.resolve(blob), content);
                    entries.add(new Snapshot.Entry(key, true, blob, sha256(content), StateFiles.permissionsOf(target)));
                } else if (Files.exists(target)) {
                    throw new SnapshotException(path + " is not a regular file", 0);
                } else {
                    entries.add(new Snapshot.Entry(key, false, null, null, null));
                }
            }
            StateFiles.appendLine(indexFile(),
                    new SnapshotIndexEvent(SnapshotIndexEvent.Type.CREATED, id, label, entries, now));
            log.info("Created snapshot {} ({}) covering {} path(s)", id, label, entries.size());
            return id;
        } catch (IOException e) {
            deleteQuietly(dir);
            throw new SnapshotException("Failed to capture snapshot for " + label + ": " + e.getMessage(), 0, e);
        } catch (SnapshotException e) {
            deleteQuietly(dir);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes each change of {@code improvement} in order. Every path must be covered
     * by the snapshot; nothing is written when one is not.
     *
     * @return the number of changes applied
     * @throws SnapshotException on the first failing change, carrying the count
     *                           already applied
     */
    public int apply(String snapshotId, Improvement improvement) {
        Snapshot snapshot = find(snapshotId)
                .orElseThrow(() -> new SnapshotException("Unknown snapshot " + snapshotId, 0));
        Set<String> covered = Set.copyOf(snapshot.paths());
        for (CodeChange change : improvement.changes()) {
            String key = projectRoot.relativize(resolveInRoot(change.path())).toString().replace('\\', '/');
            if (!covered.contains(key)) {
                throw new SnapshotException(change.path() + " is not covered by snapshot " + snapshotId, 0);
            }
        }

        int applied = 0;
        for (CodeChange change : improvement.changes()) {
            Path target = resolveInRoot(change.path());
            try {
                if (change.kind() == ChangeKind.DELETE) {
                    Files.deleteIfExists(target);
                } else {
                    String content = change.newContent() != null ? change.newContent() : "";
                    StateFiles.writeAtomically(target, content.getBytes(StandardCharsets.UTF_8));
                }
            } catch (IOException | RuntimeException e) {
                throw new SnapshotException("Failed to apply " + change.kind() + " " + change.path()
                        + " after " + applied + " change(s): " + e.getMessage(), applied, e);
            }
            applied++;
            log.debug("Applied {} {}", change.kind(), change.path());
        }
        log.info("Applied {} change(s) of improvement {} under snapshot {}", applied, improvement.id(), snapshotId);
        return applied;
    }

    /**
     * Restores every captured resource verbatim and deletes those that did not exist
     * at capture time. Safe to call repeatedly and after a partial apply.
     *
     * @throws RollbackException when any resource cannot be restored
     */
    public void rollbackTo(String snapshotId) {
        Snapshot snapshot = find(snapshotId)
                .orElseThrow(() -> new RollbackException(snapshotId, "Unknown snapshot " + snapshotId));
        if (snapshot.state() == Snapshot.State.PRUNED) {
            throw new RollbackException(snapshotId, "Snapshot " + snapshotId + " was pruned; content is gone");
        }
        Path dir = snapshotsDir.resolve(snapshotId);

        lock.lock();
        try {
            for (Snapshot.Entry entry : snapshot.entries()) {
                Path target = resolveInRoot(entry.path());
                if (entry.existed()) {
                    byte[] content = Files.readAllBytes(dir.resolve(entry.blob()));
                    if (entry.sha256() != null && !entry.sha256().equals(sha256(content))) {
                        throw new RollbackException(snapshotId, "Captured content of " + entry.path() + " is corrupt");
                    }
                    StateFiles.writeAtomically(target, content,
                            entry.mode() != null ? PosixFilePermissions.fromString(entry.mode()) : null);
                } else if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                    Files.delete(target);
                }
            }
            if (snapshot.state() != Snapshot.State.RESTORED) {
                StateFiles.appendLine(indexFile(), new SnapshotIndexEvent(
                        SnapshotIndexEvent.Type.RESTORED, snapshotId, snapshot.label(), null, clock.instant()));
            }
            log.info("Rolled back to snapshot {} ({} path(s) restored)", snapshotId, snapshot.entries().size());
        } catch (IOException e) {
            throw new RollbackException(snapshotId, "Failed to restore snapshot " + snapshotId + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the snapshot as superseded by an accepted improvement, making it eligible
     * for pruning. Version control is not touched.
     */
    public void commitImprovement(String snapshotId, Improvement improvement) {
        lock.lock();
        try {
            StateFiles.appendLine(indexFile(), new SnapshotIndexEvent(
                    SnapshotIndexEvent.Type.SUPERSEDED, snapshotId, improvement.id(), null, clock.instant()));
        } catch (IOException e) {
            throw new SnapshotException("Failed to record commit of snapshot " + snapshotId, 0, e);
        } finally {
            lock.unlock();
        }
        log.info("Snapshot {} superseded by improvement {}", snapshotId, improvement.id());
    }

    /**
     * Deletes the captured content of superseded snapshots beyond the newest {@code keep}.
     * Active and restored snapshots are never pruned.
     *
     * @return the number of snapshots pruned
     */
    public int prune(int keep) {
        List<Snapshot> superseded = list().stream()
                .filter(s -> s.state() == Snapshot.State.SUPERSEDED)
                .sorted(Comparator.comparing(Snapshot::createdAt).reversed())
                .toList();
        if (superseded.size() <= keep) {
            return 0;
        }
        int pruned = 0;
        lock.lock();
        try {
            for (Snapshot snapshot : superseded.subList(Math.max(keep, 0), superseded.size())) {
                deleteQuietly(snapshotsDir.resolve(snapshot.id()));
                StateFiles.appendLine(indexFile(), new SnapshotIndexEvent(
                        SnapshotIndexEvent.Type.PRUNED, snapshot.id(), snapshot.label(), null, clock.instant()));
                pruned++;
            }
        } catch (IOException e) {
            throw new SnapshotException("Failed to record pruning: " + e.getMessage(), 0, e);
        } finally {
            lock.unlock();
        }
        log.info("Pruned {} superseded snapshot(s), kept {}", pruned, keep);
        return pruned;
    }

    /**
     * Snapshot metadata folded from the index, oldest first.
     */
    public List<Snapshot> list() {
        Path index = indexFile();
        if (!Files.exists(index)) {
            return List.of();
        }
        List<String> lines;
        lock.lock();
        try {
            lines = Files.readAllLines(index, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SnapshotException("Failed to read snapshot index " + index + ": " + e.getMessage(), 0, e);
        } finally {
            lock.unlock();
        }

        Map<String, Snapshot> byId = new LinkedHashMap<>();
        for (String line : lines) {
            if (line.isBlank()) continue;
            SnapshotIndexEvent event;
            try {
                event = StateFiles.mapper().readValue(line, SnapshotIndexEvent.class);
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed snapshot index line: {}", e.getOriginalMessage());
                continue;
            }
            if (event.type() == SnapshotIndexEvent.Type.CREATED) {
                byId.put(event.snapshotId(), new Snapshot(event.snapshotId(), event.label(),
                        event.entries(), event.timestamp(), Snapshot.State.ACTIVE));
            } else {
                byId.computeIfPresent(event.snapshotId(), (k, s) -> s.withState(stateFor(event.type(), s.state())));
            }
        }
        return List.copyOf(byId.values());
    }

    public Optional<Snapshot> find(String snapshotId) {
        return list().stream().filter(s -> s.id().equals(snapshotId)).findFirst();
    }

    public Path snapshotsDir() {
        return snapshotsDir;
    }

    private static Snapshot.State stateFor(SnapshotIndexEvent.Type type, Snapshot.State current) {
        if (current == Snapshot.State.PRUNED) return current;
        return switch (type) {
            case SUPERSEDED -> Snapshot.State.SUPERSEDED;
            case RESTORED -> Snapshot.State.RESTORED;
            case PRUNED -> Snapshot.State.PRUNED;
            case CREATED -> current;
        };
    }

    private Path resolveInRoot(String path) {
        Path resolved = projectRoot.resolve(path).normalize();
        if (!resolved.startsWith(projectRoot) || resolved.equals(projectRoot)) {
            throw new SnapshotException(path + " is outside the project root", 0);
        }
        return resolved;
    }

    private Path indexFile() {
        return snapshotsDir.resolve(INDEX_FILE);
    }

    static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void deleteQuietly(Path dir) {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Could not delete snapshot directory {}: {}", dir, e.getMessage());
        }
    }
}
