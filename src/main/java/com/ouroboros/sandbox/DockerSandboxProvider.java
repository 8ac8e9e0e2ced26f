package com.ouroboros.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based SandboxProvider. Every run gets a fresh container from the
 * configured image.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>network mode {@code none}</li>
 *   <li>a memory limit and a CPU quota from the {@link SandboxRequest}</li>
 *   <li>a read-only bind mount mapping the run's working directory to /workspace</li>
 *   <li>command: {@code sh verify.sh}</li>
 * </ul>
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    /** Log collection runs after the container has exited, so it only needs a short grace period. */
    static final Duration CAPTURE_TIMEOUT = Duration.ofSeconds(5);

    private final DockerClient dockerClient;
    private final String image;
    private final Duration pullTimeout;

    public DockerSandboxProvider(DockerClient dockerClient, String image, Duration pullTimeout) {
        this.dockerClient = dockerClient;
        this.image = image;
        this.pullTimeout = pullTimeout;
    }

    @Override
    public String name() {
        return "docker";
    }

    @Override
    public boolean isolated() {
        return true;
    }

    @Override
    public boolean isAvailable() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (Exception e) {
            log.debug("Docker daemon not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String openSandbox(SandboxRequest request) {
        String containerName = "ouroboros-verify-" + request.runId();
        ensureImage(containerName, request.startBudget());
        log.info("Opening sandbox {} (image: {})", containerName, image);

        var hostConfig = HostConfig.newHostConfig()
                .withNetworkMode("none")
                .withBinds(new Bind(request.workDir().toString(), new Volume("/workspace"), AccessMode.ro))
                .withMemory((long) request.memoryLimitMb() * 1024 * 1024)
                .withNanoCPUs((long) (request.cpus() * 1_000_000_000L));

        var response = dockerClient.createContainerCmd(image)
                .withName(containerName)
                .withHostConfig(hostConfig)
                .withNetworkDisabled(true)
                .withCmd("sh", "verify.sh")
                .withWorkingDir("/workspace")
                .exec();

        String containerId = response.getId();
        dockerClient.startContainerCmd(containerId).exec();
        log.info("Sandbox {} started (container {})", containerName, containerId);
        return containerId;
    }

    @Override
    public int waitForCompletion(String sandboxId, Duration timeout) {
        Integer status = null;
        try (var callback = dockerClient.waitContainerCmd(sandboxId)
                .exec(new WaitContainerResultCallback())) {
            status = callback.awaitStatusCode(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (DockerClientException e) {
            // awaitStatusCode signals an expired timeout with this exception
            kill(sandboxId);
            throw new SandboxTimeoutException(sandboxId, timeout);
        } catch (IOException e) {
            log.debug("Could not close wait callback for {}: {}", sandboxId, e.getMessage());
        }
        return status != null ? status : -1;
    }

    @Override
    public SandboxOutput captureOutput(String sandboxId) {
        var stdout = new StringBuilder();
        var stderr = new StringBuilder();
        try (var callback = dockerClient.logContainerCmd(sandboxId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            String text = new String(frame.getPayload(), StandardCharsets.UTF_8);
                            if (frame.getStreamType() == StreamType.STDERR) {
                                stderr.append(text);
                            } else {
                                stdout.append(text);
                            }
                        }
                    })) {
            if (!callback.awaitCompletion(CAPTURE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Output of sandbox {} incomplete after {}s", sandboxId, CAPTURE_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while capturing output from sandbox {}", sandboxId);
        } catch (IOException e) {
            log.debug("Could not close log callback for {}: {}", sandboxId, e.getMessage());
        }
        return new SandboxOutput(stdout.toString(), stderr.toString());
    }

    @Override
    public void teardownSandbox(String sandboxId) {
        try {
            dockerClient.removeContainerCmd(sandboxId).withForce(true).exec();
            log.info("Sandbox {} torn down", sandboxId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", sandboxId);
        } catch (Exception e) {
            log.warn("Failed to remove container {}", sandboxId, e);
        }
    }

    private void kill(String sandboxId) {
        try {
            dockerClient.killContainerCmd(sandboxId).exec();
            log.warn("Killed sandbox {} after timeout", sandboxId);
        } catch (Exception e) {
            log.debug("Container {} may already be stopped: {}", sandboxId, e.getMessage());
        }
    }

    /**
     * Pulls the image when it is missing, waiting no longer than the pull timeout
     * or the run's start budget, whichever is shorter. Running out of start budget
     * counts against the run's own timeout.
     */
    private void ensureImage(String containerName, Duration budget) {
        try {
            dockerClient.inspectImageCmd(image).exec();
        } catch (NotFoundException e) {
            boolean budgetBound = budget != null && budget.compareTo(pullTimeout) < 0;
            Duration wait = budgetBound ? budget : pullTimeout;
            log.info("Image {} not found locally, pulling (waiting up to {}s)", image, wait.toSeconds());
            try (var callback = dockerClient.pullImageCmd(image).exec(new PullImageResultCallback())) {
                if (!callback.awaitCompletion(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                    if (budgetBound) {
                        throw new SandboxTimeoutException(containerName, budget);
                    }
                    throw new SandboxException("Timed out pulling image " + image);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new SandboxException("Interrupted while pulling image " + image, ie);
            } catch (IOException io) {
                log.debug("Could not close pull callback for {}: {}", image, io.getMessage());
            }
        }
    }
}
