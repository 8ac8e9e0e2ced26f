package com.ouroboros.core.logging;

import com.ouroboros.core.model.PipelineStage;
import org.slf4j.MDC;

/**
 * Utility for managing pipeline-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String CYCLE_ID = "cycleId";
    public static final String OPPORTUNITY_ID = "opportunityId";
    public static final String STAGE = "stage";

    private MdcContext() {}

    public static void setCycle(String cycleId) {
        MDC.put(CYCLE_ID, cycleId);
    }

    public static void setOpportunity(String opportunityId) {
        MDC.put(OPPORTUNITY_ID, opportunityId);
    }

    public static void setStage(PipelineStage stage) {
        MDC.put(STAGE, stage.name());
    }

    public static void clearOpportunity() {
        MDC.remove(OPPORTUNITY_ID);
        MDC.remove(STAGE);
    }

    public static void clear() {
        MDC.remove(CYCLE_ID);
        MDC.remove(OPPORTUNITY_ID);
        MDC.remove(STAGE);
    }
}
