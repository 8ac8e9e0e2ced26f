package com.ouroboros.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A ranked signal that some aspect of agent behaviour could be improved.
 * Recomputed on every analysis pass and never persisted.
 *
 * @param id          deterministic identifier derived from the grouping key
 * @param type        what kind of improvement is wanted
 * @param description one-line human-readable summary
 * @param priority    1 (lowest) to 10 (highest)
 * @param context     evidence gathered by the analyzer (counts, samples, tools)
 * @param detectedAt  when the analyzer produced this opportunity
 */
public record ImprovementOpportunity(
    String id,
    OpportunityType type,
    String description,
    int priority,
    Map<String, Object> context,
    Instant detectedAt
) implements Serializable {

    public static final String CTX_ERROR_MESSAGE = "errorMessage";
    public static final String CTX_OCCURRENCES = "occurrenceCount";
    public static final String CTX_SAMPLE_REQUESTS = "sampleRequests";
    public static final String CTX_TOOLS_INVOLVED = "toolsInvolved";
    public static final String CTX_TOOL_NAME = "toolName";
    public static final String CTX_AVG_DURATION_MS = "avgDurationMs";
    public static final String CTX_TOOL_SEQUENCE = "toolSequence";

    public ImprovementOpportunity {
        if (priority < 1 || priority > 10) {
            throw new IllegalArgumentException("priority must be within 1..10, got " + priority);
        }
        context = context != null ? Map.copyOf(context) : Map.of();
    }

    /**
     * Tool names this opportunity concerns, gathered from whichever context key
     * the analyzer populated.
     */
    public List<String> affectedTools() {
        var tools = new java.util.LinkedHashSet<String>();
        for (String key : List.of(CTX_TOOLS_INVOLVED, CTX_TOOL_SEQUENCE)) {
            if (context.get(key) instanceof List<?> list) {
                list.forEach(t -> tools.add(String.valueOf(t)));
            }
        }
        if (context.get(CTX_TOOL_NAME) instanceof String name) {
            tools.add(name);
        }
        return List.copyOf(tools);
    }
}
