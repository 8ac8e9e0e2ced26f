package com.ouroboros.core.generation.validation;

import java.util.List;
import java.util.Set;

/**
 * Syntax check for generated file content of one family of file types.
 * Implementations only parse; content is never compiled to classes or executed.
 */
public interface SourceValidator {

    /** Lower-case file extensions, without the dot, handled by this validator. */
    Set<String> extensions();

    /**
     * Parses {@code content} as the file at {@code path}.
     *
     * @return syntax errors, empty when the content parses
     */
    List<String> validate(String path, String content);
}
