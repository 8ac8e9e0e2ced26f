package com.ouroboros.sandbox;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Everything a provider needs to start one verification run.
 *
 * @param runId         unique id of this run, used for container names
 * @param workDir       host directory holding the affected files and {@code verify.sh}
 * @param memoryLimitMb memory cap for the run
 * @param cpus          CPU cap for the run (fractional CPUs allowed)
 * @param startBudget   longest the provider may spend getting the run started,
 *                      image pulls included
 */
public record SandboxRequest(String runId, Path workDir, int memoryLimitMb, double cpus, Duration startBudget) {}
