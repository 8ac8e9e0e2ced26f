package com.ouroboros.core.model;

import java.util.Locale;

/**
 * What a {@link CodeChange} does to its target resource.
 */
public enum ChangeKind {
    CREATE,
    MODIFY,
    DELETE;

    /**
     * Lenient parse of the reasoning service's change kind ("create", "Modify", ...).
     *
     * @return the kind, or {@code null} if the value is not recognised
     */
    public static ChangeKind parse(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return ChangeKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
