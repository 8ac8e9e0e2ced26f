package com.ouroboros.core.generation;

import com.ouroboros.core.model.Improvement;

import java.util.List;

/**
 * Result of {@link ChangeGenerator#validate}.
 *
 * @param ok          true when every change passed
 * @param errors      one message per problem found
 * @param improvement the validated improvement with prior content captured for
 *                    modify and delete changes
 */
public record ValidationReport(boolean ok, List<String> errors, Improvement improvement) {

    public ValidationReport {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
