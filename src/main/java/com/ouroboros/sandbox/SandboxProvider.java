package com.ouroboros.sandbox;

import java.time.Duration;

/**
 * Runs {@code sh verify.sh} in a throwaway working directory.
 * Implementations: {@link DockerSandboxProvider} (isolated), {@link LocalSandboxProvider} (degraded).
 */
public interface SandboxProvider {

    /** Short backend name, reported in verification results and metrics. */
    String name();

    /** Whether runs are network-isolated and resource-bounded. */
    boolean isolated();

    /** Whether the backend can currently accept runs. */
    boolean isAvailable();

    /**
     * Starts the verification script for {@code request}.
     * @return the sandbox id
     */
    String openSandbox(SandboxRequest request);

    /**
     * Blocks until the run exits.
     * @return the exit code (0 = success)
     * @throws SandboxTimeoutException when the run outlives {@code timeout}; the
     *                                 run has been force-terminated by then
     */
    int waitForCompletion(String sandboxId, Duration timeout);

    /**
     * Captures stdout and stderr of a finished run.
     */
    SandboxOutput captureOutput(String sandboxId);

    /**
     * Stops the run if still alive and releases its resources.
     */
    void teardownSandbox(String sandboxId);
}
