package com.ouroboros.core.health;

import com.ouroboros.core.config.OuroborosProperties;
import com.ouroboros.core.publish.GitPublisher;
import com.ouroboros.sandbox.DockerSandboxProvider;
import com.ouroboros.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final GitPublisher gitPublisher;
    private final DockerSandboxProvider dockerProvider;
    private final SandboxProperties sandboxProperties;
    private final OuroborosProperties properties;

    public HealthCheckService(
            GitPublisher gitPublisher,
            @Autowired(required = false) DockerSandboxProvider dockerProvider,
            SandboxProperties sandboxProperties,
            OuroborosProperties properties) {
        this.gitPublisher = gitPublisher;
        this.dockerProvider = dockerProvider;
        this.sandboxProperties = sandboxProperties;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGit());
        results.add(checkSandbox());
        results.add(checkStorage());
        return results;
    }

    HealthStatus checkGit() {
        if (!gitPublisher.isGitAvailable()) {
            return new HealthStatus("git", HealthStatus.Status.DOWN,
                    "git executable not available", Map.of());
        }
        if (!gitPublisher.isRepository()) {
            return new HealthStatus("git", HealthStatus.Status.DOWN,
                    "Project root is not a git repository", Map.of("projectRoot", properties.getProjectRoot()));
        }
        String branch = String.valueOf(gitPublisher.currentBranch());
        if (!gitPublisher.hasRemote()) {
            return new HealthStatus("git", HealthStatus.Status.DEGRADED,
                    "No remote '" + properties.getPublish().getRemote() + "'; commits stay local",
                    Map.of("branch", branch));
        }
        return new HealthStatus("git", HealthStatus.Status.UP, "Repository with remote",
                Map.of("branch", branch, "remote", properties.getPublish().getRemote()));
    }

    HealthStatus checkSandbox() {
        if (dockerProvider == null || "local".equalsIgnoreCase(sandboxProperties.getProvider())) {
            return new HealthStatus("sandbox", HealthStatus.Status.DEGRADED,
                    "Docker backend disabled; verification runs locally without isolation",
                    Map.of("backend", "local"));
        }
        try {
            if (dockerProvider.isAvailable()) {
                return new HealthStatus("sandbox", HealthStatus.Status.UP, "Docker daemon reachable",
                        Map.of("backend", "docker", "image", sandboxProperties.getImage()));
            }
        } catch (Exception e) {
            log.warn("Sandbox health check failed: {}", e.getMessage());
        }
        return new HealthStatus("sandbox", HealthStatus.Status.DEGRADED,
                "Docker daemon unreachable; verification falls back to local execution",
                Map.of("backend", "local"));
    }

    HealthStatus checkStorage() {
        Path stateDir = properties.stateDirPath();
        try {
            Files.createDirectories(stateDir);
            if (!Files.isWritable(stateDir)) {
                return new HealthStatus("storage", HealthStatus.Status.DOWN,
                        "State directory is not writable", Map.of("stateDir", stateDir.toString()));
            }
            return new HealthStatus("storage", HealthStatus.Status.UP, "State directory writable",
                    Map.of("stateDir", stateDir.toString()));
        } catch (IOException e) {
            log.warn("Storage health check failed: {}", e.getMessage());
            return new HealthStatus("storage", HealthStatus.Status.DOWN,
                    "Cannot create state directory: " + e.getMessage(), Map.of("stateDir", stateDir.toString()));
        }
    }
}
