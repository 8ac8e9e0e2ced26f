package com.ouroboros.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one completed agent task, as reported by the host agent.
 *
 * @param taskId       unique task identifier
 * @param userRequest  the original request text
 * @param toolsUsed    tool names in invocation order
 * @param success      whether the task completed successfully
 * @param errorMessage error text for failed tasks (nullable)
 * @param durationMs   wall-clock duration in milliseconds
 * @param timestamp    when the task completed
 */
public record TaskRecord(
    String taskId,
    String userRequest,
    List<String> toolsUsed,
    boolean success,
    String errorMessage,
    long durationMs,
    Instant timestamp
) implements Serializable {

    public TaskRecord {
        toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
        userRequest = userRequest != null ? userRequest : "";
    }
}
