package com.ouroboros.core.history;

import com.ouroboros.core.config.OuroborosProperties;
import com.ouroboros.core.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ingests outcomes of completed agent tasks into a capped, most-recent-first history.
 *
 * <p>Appends happen under a lock and each append persists the whole capped history
 * through {@link TaskHistoryStore}, so concurrent task completions never interleave
 * partial writes.
 *
 * <p>The file is shared with other processes (the CLI records while {@code serve}
 * analyzes), so reads pick up a changed file and every append starts from the
 * file's current content.
 */
@Service
public class ActivityRecorder {

    private static final Logger log = LoggerFactory.getLogger(ActivityRecorder.class);

    private final TaskHistoryStore store;
    private final int maxEntries;
    private final Deque<TaskRecord> history = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private TaskHistoryStore.Stamp loadedStamp;

    @Autowired
    public ActivityRecorder(OuroborosProperties properties) {
        this(new TaskHistoryStore(properties.stateDirPath()), properties.getHistory().getMaxEntries());
    }

    public ActivityRecorder(TaskHistoryStore store, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.store = store;
        this.maxEntries = maxEntries;
        loadedStamp = store.stamp();
        replaceHistory(store.load());
        log.info("Activity recorder loaded {} task record(s) from {}", history.size(), store.file());
    }

    /**
     * Appends a completed task and persists the capped history. The oldest entries are
     * evicted once the cap is exceeded.
     */
    public void record(TaskRecord record) {
        lock.lock();
        try {
            reload();
            history.addFirst(record);
            while (history.size() > maxEntries) {
                history.removeLast();
            }
            store.save(List.copyOf(history));
            loadedStamp = store.stamp();
        } finally {
            lock.unlock();
        }
        log.debug("Recorded task {} (success={}, {}ms)", record.taskId(), record.success(), record.durationMs());
    }

    /**
     * Immutable most-recent-first copy of the current history.
     */
    public List<TaskRecord> history() {
        lock.lock();
        try {
            reloadIfChanged();
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            reloadIfChanged();
            return history.size();
        } finally {
            lock.unlock();
        }
    }

    private void reloadIfChanged() {
        if (!Objects.equals(store.stamp(), loadedStamp)) {
            reload();
        }
    }

    /**
     * Replaces the in-memory history with the file's content. An unreadable file
     * keeps what is in memory. Callers hold the lock.
     */
    private void reload() {
        TaskHistoryStore.Stamp stamp = store.stamp();
        try {
            replaceHistory(store.read());
            loadedStamp = stamp;
        } catch (IOException e) {
            log.warn("Keeping in-memory task history; failed to reload {}: {}", store.file(), e.getMessage());
        }
    }

    private void replaceHistory(List<TaskRecord> mostRecentFirst) {
        history.clear();
        for (TaskRecord record : mostRecentFirst) {
            if (history.size() >= maxEntries) break;
            history.addLast(record);
        }
    }
}
