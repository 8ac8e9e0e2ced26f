package com.ouroboros.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Result of committing and pushing an accepted improvement.
 *
 * <p>A local commit whose push failed is a degraded success:
 * {@code success == true}, {@code pushed == false}, {@code error} populated.
 */
public record PublishOutcome(
    boolean success,
    String commitId,
    boolean pushed,
    String message,
    String error,
    PushFailure pushFailure,
    List<String> filesChanged,
    Instant timestamp
) implements Serializable {

    public PublishOutcome {
        filesChanged = filesChanged != null ? List.copyOf(filesChanged) : List.of();
        pushFailure = pushFailure != null ? pushFailure : PushFailure.NONE;
    }

    public static PublishOutcome failed(String error, List<String> files, Instant at) {
        return new PublishOutcome(false, null, false, error, error, PushFailure.NONE, files, at);
    }

    public boolean isDegraded() {
        return success && commitId != null && !pushed;
    }
}
