package com.ouroboros.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code sh verify.sh} as a local child process in the run's working
 * directory. No network isolation and no resource limits: used only when Docker
 * is unavailable or explicitly configured away.
 */
public class LocalSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalSandboxProvider.class);

    private record LocalRun(Process process, Path stdout, Path stderr) {}

    private final Map<String, LocalRun> runs = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "local";
    }

    @Override
    public boolean isolated() {
        return false;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String openSandbox(SandboxRequest request) {
        String sandboxId = "local-" + request.runId() + "-" + UUID.randomUUID().toString().substring(0, 8);
        try {
            Path stdout = Files.createTempFile("ouroboros-verify", ".stdout");
            Path stderr = Files.createTempFile("ouroboros-verify", ".stderr");
            Process process = new ProcessBuilder("sh", "verify.sh")
                    .directory(request.workDir().toFile())
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile())
                    .start();
            runs.put(sandboxId, new LocalRun(process, stdout, stderr));
            log.info("Started local verification {} (pid {})", sandboxId, process.pid());
            return sandboxId;
        } catch (IOException e) {
            throw new SandboxException("Failed to start local verification: " + e.getMessage(), e);
        }
    }

    @Override
    public int waitForCompletion(String sandboxId, Duration timeout) {
        LocalRun run = lookup(sandboxId);
        try {
            if (!run.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                destroy(run.process());
                throw new SandboxTimeoutException(sandboxId, timeout);
            }
            return run.process().exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroy(run.process());
            throw new SandboxException("Interrupted while waiting for " + sandboxId, e);
        }
    }

    @Override
    public SandboxOutput captureOutput(String sandboxId) {
        LocalRun run = lookup(sandboxId);
        try {
            return new SandboxOutput(
                    Files.readString(run.stdout(), StandardCharsets.UTF_8),
                    Files.readString(run.stderr(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Could not read output of {}: {}", sandboxId, e.getMessage());
            return SandboxOutput.empty();
        }
    }

    @Override
    public void teardownSandbox(String sandboxId) {
        LocalRun run = runs.remove(sandboxId);
        if (run == null) return;
        if (run.process().isAlive()) {
            destroy(run.process());
        }
        try {
            Files.deleteIfExists(run.stdout());
            Files.deleteIfExists(run.stderr());
        } catch (IOException e) {
            log.debug("Could not delete output files of {}: {}", sandboxId, e.getMessage());
        }
    }

    private LocalRun lookup(String sandboxId) {
        LocalRun run = runs.get(sandboxId);
        if (run == null) {
            throw new SandboxException("Unknown sandbox " + sandboxId);
        }
        return run;
    }

    private static void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
