package com.ouroboros.core.model;

import java.io.Serializable;

/**
 * One proposed change to a resource under the project root.
 *
 * @param path         target path relative to the project root
 * @param kind         create, modify or delete
 * @param priorContent content before the change, captured during validation (nullable)
 * @param newContent   content after the change; {@code null} for deletes
 * @param description  human-readable summary of the change
 */
public record CodeChange(
    String path,
    ChangeKind kind,
    String priorContent,
    String newContent,
    String description
) implements Serializable {

    public CodeChange withPriorContent(String content) {
        return new CodeChange(path, kind, content, newContent, description);
    }
}
