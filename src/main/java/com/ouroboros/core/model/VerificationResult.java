package com.ouroboros.core.model;

import java.io.Serializable;

/**
 * Outcome of running a verification script in the isolated verifier.
 *
 * @param passed     exit code 0 and not timed out
 * @param output     captured stdout
 * @param error      captured stderr or a diagnostic (nullable)
 * @param exitCode   process / container exit code; -1 when unknown or timed out
 * @param durationMs wall-clock duration
 * @param timedOut   whether the run was force-terminated at its timeout
 * @param backend    name of the backend that ran the script ("docker", "local")
 * @param isolated   false when the degraded local fallback was used
 */
public record VerificationResult(
    boolean passed,
    String output,
    String error,
    int exitCode,
    long durationMs,
    boolean timedOut,
    String backend,
    boolean isolated
) implements Serializable {}
