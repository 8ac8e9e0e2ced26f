package com.ouroboros.core.generation;

import java.util.List;

/**
 * Structured output requested from the reasoning service for one opportunity.
 * The JSON schema sent with the prompt is derived from this record.
 *
 * @param title              short title, used as the commit subject
 * @param description        what the improvement does and why it addresses the opportunity
 * @param changes            ordered file changes
 * @param verificationScript optional POSIX shell script that exits 0 when the change works
 */
public record GeneratedImprovement(
    String title,
    String description,
    List<GeneratedChange> changes,
    String verificationScript
) {

    /**
     * @param path        file path relative to the project root
     * @param kind        one of "create", "modify" or "delete"
     * @param description what this change does
     * @param content     full new file content; omitted for deletes
     */
    public record GeneratedChange(
        String path,
        String kind,
        String description,
        String content
    ) {}
}
