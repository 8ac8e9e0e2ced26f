package com.ouroboros.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A concrete set of code changes addressing one opportunity.
 *
 * @param id                 the opportunity id this improvement answers
 * @param title              short title, used as the commit subject
 * @param description        what the improvement does
 * @param changes            ordered changes; applied in this order
 * @param verificationScript optional shell script run by the isolated verifier (nullable)
 */
public record Improvement(
    String id,
    String title,
    String description,
    List<CodeChange> changes,
    String verificationScript
) implements Serializable {

    public Improvement {
        changes = changes != null ? List.copyOf(changes) : List.of();
    }

    public boolean hasVerificationScript() {
        return verificationScript != null && !verificationScript.isBlank();
    }

    public List<String> touchedPaths() {
        return changes.stream().map(CodeChange::path).toList();
    }

    public Improvement withChanges(List<CodeChange> newChanges) {
        return new Improvement(id, title, description, newChanges, verificationScript);
    }
}
