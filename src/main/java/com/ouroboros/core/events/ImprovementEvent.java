package com.ouroboros.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while the improvement pipeline runs, delivered to host listeners.
 *
 * @param eventType     event type (e.g. "cycle.started", "improvement.result", "rollback.failed")
 * @param opportunityId the opportunity this event relates to (nullable for cycle-level events)
 * @param payload       arbitrary key-value data associated with the event
 * @param timestamp     when the event occurred
 */
public record ImprovementEvent(
    String eventType,
    String opportunityId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String CYCLE_STARTED = "cycle.started";
    public static final String CYCLE_COMPLETED = "cycle.completed";
    public static final String STAGE_CHANGED = "stage.changed";
    public static final String IMPROVEMENT_RESULT = "improvement.result";
    public static final String ROLLBACK_FAILED = "rollback.failed";
}
