package com.ouroboros.sandbox;

import com.ouroboros.core.metrics.OuroborosMetrics;
import com.ouroboros.core.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs a verification script against proposed content without executing anything
 * in the host process.
 *
 * <p>Flow: fresh working directory -> write affected files and {@code verify.sh} ->
 * open sandbox -> wait (bounded) -> capture output -> teardown -> delete directory.
 * The Docker backend is preferred; when it is unavailable the local backend runs
 * the script instead, flagged as not isolated.
 */
@Service
public class IsolatedVerifier {

    private static final Logger log = LoggerFactory.getLogger(IsolatedVerifier.class);

    static final String SCRIPT_NAME = "verify.sh";

    private final SandboxProvider preferred;
    private final SandboxProvider fallback;
    private final SandboxProperties properties;
    private final OuroborosMetrics metrics;

    @Autowired
    public IsolatedVerifier(@Autowired(required = false) DockerSandboxProvider docker,
                            LocalSandboxProvider local,
                            SandboxProperties properties,
                            @Autowired(required = false) OuroborosMetrics metrics) {
        this((SandboxProvider) docker, local, properties, metrics);
    }

    public IsolatedVerifier(SandboxProvider preferred, SandboxProvider fallback,
                            SandboxProperties properties, OuroborosMetrics metrics) {
        this.preferred = preferred;
        this.fallback = fallback;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Runs with the configured default timeout.
     */
    public VerificationResult run(String script, Map<String, String> affectedContent) {
        return run(script, affectedContent, Duration.ofSeconds(properties.getTimeoutSeconds()));
    }

    /**
     * @param script          shell script, written to {@code verify.sh}
     * @param affectedContent relative path to new content of each affected file
     * @param timeout         hard limit for the run, sandbox start-up included
     */
    public VerificationResult run(String script, Map<String, String> affectedContent, Duration timeout) {
        SandboxProvider provider = selectProvider();
        long start = System.currentTimeMillis();
        long deadline = System.nanoTime() + timeout.toNanos();
        Path workDir = null;
        String sandboxId = null;
        try {
            workDir = prepareWorkDir(script, affectedContent);
            var request = new SandboxRequest(UUID.randomUUID().toString().substring(0, 12), workDir,
                    properties.getMemoryLimitMb(), properties.getCpus(), remaining(deadline));
            sandboxId = provider.openSandbox(request);

            int exitCode = provider.waitForCompletion(sandboxId, remaining(deadline));
            SandboxOutput output = provider.captureOutput(sandboxId);
            boolean passed = exitCode == 0;
            long elapsed = System.currentTimeMillis() - start;
            log.info("Verification {} on {} (exit {}, {}ms)", passed ? "passed" : "failed",
                    provider.name(), exitCode, elapsed);
            return record(new VerificationResult(passed, output.stdout(),
                    output.stderr().isEmpty() ? null : output.stderr(),
                    exitCode, elapsed, false, provider.name(), provider.isolated()));
        } catch (SandboxTimeoutException e) {
            long elapsed = System.currentTimeMillis() - start;
            log.warn("Verification timed out after {}s on {}", timeout.toSeconds(), provider.name());
            SandboxOutput partial = safeCapture(provider, sandboxId);
            return record(new VerificationResult(false, partial.stdout(),
                    "timed out after " + timeout.toSeconds() + "s", -1, elapsed, true,
                    provider.name(), provider.isolated()));
        } catch (RuntimeException | IOException e) {
            long elapsed = System.currentTimeMillis() - start;
            log.error("Verification could not run on {}: {}", provider.name(), e.getMessage(), e);
            return record(new VerificationResult(false, "", "verification error: " + e.getMessage(),
                    -1, elapsed, false, provider.name(), provider.isolated()));
        } finally {
            if (sandboxId != null) {
                provider.teardownSandbox(sandboxId);
            }
            if (workDir != null) {
                deleteRecursively(workDir);
            }
        }
    }

    /**
     * The backend the next run will use.
     */
    public SandboxProvider selectProvider() {
        if (preferred != null && !"local".equalsIgnoreCase(properties.getProvider())) {
            if (preferred.isAvailable()) {
                return preferred;
            }
            log.warn("Sandbox backend '{}' unavailable; running verification in DEGRADED local mode "
                    + "(no network isolation, no resource limits)", preferred.name());
        } else {
            log.warn("Running verification in DEGRADED local mode (no network isolation, no resource limits)");
        }
        return fallback;
    }

    Path prepareWorkDir(String script, Map<String, String> affectedContent) throws IOException {
        Path workDir = Files.createTempDirectory("ouroboros-verify-").toAbsolutePath().normalize();
        try {
            for (Map.Entry<String, String> e : affectedContent.entrySet()) {
                Path target = workDir.resolve(e.getKey()).normalize();
                if (!target.startsWith(workDir) || target.equals(workDir)) {
                    throw new SandboxException("Refusing to stage " + e.getKey() + " outside the working directory");
                }
                Files.createDirectories(target.getParent());
                Files.writeString(target, e.getValue(), StandardCharsets.UTF_8);
            }
            Files.writeString(workDir.resolve(SCRIPT_NAME), script, StandardCharsets.UTF_8);
            return workDir;
        } catch (IOException | RuntimeException e) {
            deleteRecursively(workDir);
            throw e;
        }
    }

    private static Duration remaining(long deadline) {
        return Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
    }

    private SandboxOutput safeCapture(SandboxProvider provider, String sandboxId) {
        if (sandboxId == null) return SandboxOutput.empty();
        try {
            return provider.captureOutput(sandboxId);
        } catch (RuntimeException e) {
            log.debug("Could not capture output of {}: {}", sandboxId, e.getMessage());
            return SandboxOutput.empty();
        }
    }

    private VerificationResult record(VerificationResult result) {
        if (metrics != null) {
            metrics.recordVerification(result.backend(), result.passed());
        }
        return result;
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Could not delete verification directory {}: {}", dir, e.getMessage());
        }
    }
}
