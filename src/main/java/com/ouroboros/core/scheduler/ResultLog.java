package com.ouroboros.core.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ouroboros.core.config.OuroborosProperties;
import com.ouroboros.core.model.ImprovementResult;
import com.ouroboros.core.persistence.StateFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only audit log of improvement attempts ({@code improvements.jsonl}).
 * Lines are never rewritten; malformed lines are skipped on read.
 */
@Service
public class ResultLog {

    private static final Logger log = LoggerFactory.getLogger(ResultLog.class);

    static final String FILE_NAME = "improvements.jsonl";

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public ResultLog(OuroborosProperties properties) {
        this(properties.stateDirPath().resolve(FILE_NAME));
    }

    public ResultLog(Path file) {
        this.file = file;
    }

    public void append(ImprovementResult result) {
        lock.lock();
        try {
            StateFiles.appendLine(file, result);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to result log " + file, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * All results in append order.
     */
    public List<ImprovementResult> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        lock.lock();
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read result log {}: {}", file, e.getMessage());
            return List.of();
        } finally {
            lock.unlock();
        }
        var results = new ArrayList<ImprovementResult>();
        for (String line : lines) {
            if (line.isBlank()) continue;
            try {
                results.add(StateFiles.mapper().readValue(line, ImprovementResult.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed result log line: {}", e.getOriginalMessage());
            }
        }
        return results;
    }

    /**
     * The newest {@code limit} results, newest first.
     */
    public List<ImprovementResult> recent(int limit) {
        List<ImprovementResult> all = readAll();
        var recent = new ArrayList<ImprovementResult>();
        for (int i = all.size() - 1; i >= 0 && recent.size() < limit; i--) {
            recent.add(all.get(i));
        }
        return recent;
    }

    public Optional<Instant> lastAttemptTime() {
        return readAll().stream()
                .map(ImprovementResult::timestamp)
                .filter(t -> t != null)
                .max(Comparator.naturalOrder());
    }

    public Path file() {
        return file;
    }
}
