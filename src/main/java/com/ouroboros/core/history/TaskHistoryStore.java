package com.ouroboros.core.history;

import com.ouroboros.core.model.TaskRecord;
import com.ouroboros.core.persistence.StateFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.List;

/**
 * JSON file backing the task history. Every save replaces the whole file atomically.
 */
public class TaskHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(TaskHistoryStore.class);

    static final String FILE_NAME = "task_history.json";

    private final Path file;

    public TaskHistoryStore(Path stateDir) {
        this.file = stateDir.resolve(FILE_NAME);
    }

    /** Persisted document shape: {@code {"tasks": [...]}} most recent first. */
    public record HistoryDocument(List<TaskRecord> tasks) {}

    /** Identifies one version of the file on disk. */
    public record Stamp(FileTime modified, long size) {}

    /**
     * Loads the persisted history. A missing file yields an empty list; an unreadable one is
     * logged and also treated as empty so a corrupt store never blocks the host agent.
     */
    public List<TaskRecord> load() {
        try {
            return read();
        } catch (IOException e) {
            log.warn("Failed to load task history from {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    /**
     * Reads the persisted history, failing on an unreadable file.
     */
    public List<TaskRecord> read() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        HistoryDocument doc = StateFiles.mapper().readValue(file.toFile(), HistoryDocument.class);
        return doc.tasks() != null ? doc.tasks() : List.of();
    }

    /**
     * Current version of the file, or {@code null} when it does not exist.
     */
    public Stamp stamp() {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return new Stamp(attrs.lastModifiedTime(), attrs.size());
        } catch (IOException e) {
            return null;
        }
    }

    public void save(List<TaskRecord> mostRecentFirst) {
        try {
            byte[] json = StateFiles.mapper().writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(new HistoryDocument(mostRecentFirst));
            StateFiles.writeAtomically(file, json);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist task history to " + file, e);
        }
    }

    public Path file() {
        return file;
    }
}
