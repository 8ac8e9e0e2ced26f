package com.ouroboros.core.scheduler;

import com.ouroboros.core.model.ImprovementResult;

/**
 * Answer to a manual improvement trigger.
 *
 * @param accepted          whether the trigger ran to completion
 * @param message           human-readable outcome or rejection reason
 * @param retryAfterSeconds seconds until the cooldown expires; 0 when accepted
 * @param result            result of the processed opportunity (nullable when none was found or rejected)
 */
public record TriggerResponse(boolean accepted, String message, long retryAfterSeconds, ImprovementResult result) {

    static TriggerResponse rejected(String message, long retryAfterSeconds) {
        return new TriggerResponse(false, message, retryAfterSeconds, null);
    }

    static TriggerResponse failed(String message, long retryAfterSeconds) {
        return new TriggerResponse(false, message, retryAfterSeconds, null);
    }

    static TriggerResponse accepted(String message, ImprovementResult result) {
        return new TriggerResponse(true, message, 0, result);
    }
}
