package com.ouroboros.core.health;

import com.ouroboros.core.config.OuroborosProperties;
import com.ouroboros.core.publish.GitPublisher;
import com.ouroboros.sandbox.DockerSandboxProvider;
import com.ouroboros.sandbox.SandboxProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path tempDir;

    private GitPublisher git;
    private DockerSandboxProvider docker;
    private SandboxProperties sandboxProperties;
    private OuroborosProperties properties;

    @BeforeEach
    void setUp() {
        git = mock(GitPublisher.class);
        docker = mock(DockerSandboxProvider.class);
        sandboxProperties = new SandboxProperties();
        properties = new OuroborosProperties();
        properties.setStateDir(tempDir.resolve("state").toString());
        when(git.isGitAvailable()).thenReturn(true);
        when(git.isRepository()).thenReturn(true);
        when(git.hasRemote()).thenReturn(true);
        when(git.currentBranch()).thenReturn("main");
        when(docker.isAvailable()).thenReturn(true);
    }

    private HealthCheckService service(DockerSandboxProvider provider) {
        return new HealthCheckService(git, provider, sandboxProperties, properties);
    }

    @Test
    @DisplayName("checkAll returns git, sandbox, storage components")
    void checkAllReturnsAllComponents() {
        List<HealthStatus> results = service(docker).checkAll();

        assertEquals(List.of("git", "sandbox", "storage"), results.stream().map(HealthStatus::component).toList());
        results.forEach(s -> assertEquals(HealthStatus.Status.UP, s.status(), s.component() + " should be UP"));
    }

    @Test
    @DisplayName("Missing git executable -> git DOWN")
    void gitMissing() {
        when(git.isGitAvailable()).thenReturn(false);
        assertEquals(HealthStatus.Status.DOWN, service(docker).checkGit().status());
    }

    @Test
    @DisplayName("Not a repository -> git DOWN")
    void notARepository() {
        when(git.isRepository()).thenReturn(false);
        assertEquals(HealthStatus.Status.DOWN, service(docker).checkGit().status());
    }

    @Test
    @DisplayName("No remote -> git DEGRADED")
    void noRemote() {
        when(git.hasRemote()).thenReturn(false);
        HealthStatus status = service(docker).checkGit();
        assertEquals(HealthStatus.Status.DEGRADED, status.status());
        assertEquals("main", status.metadata().get("branch"));
    }

    @Test
    @DisplayName("No docker provider -> sandbox DEGRADED with local backend")
    void noDocker() {
        HealthStatus status = service(null).checkSandbox();
        assertEquals(HealthStatus.Status.DEGRADED, status.status());
        assertEquals("local", status.metadata().get("backend"));
    }

    @Test
    @DisplayName("Unreachable daemon -> sandbox DEGRADED")
    void daemonDown() {
        when(docker.isAvailable()).thenReturn(false);
        assertEquals(HealthStatus.Status.DEGRADED, service(docker).checkSandbox().status());
    }

    @Test
    @DisplayName("Local provider configured -> sandbox DEGRADED even with docker present")
    void localConfigured() {
        sandboxProperties.getSandbox().setProvider("local");
        assertEquals(HealthStatus.Status.DEGRADED, service(docker).checkSandbox().status());
    }

    @Test
    @DisplayName("Storage is created on demand")
    void storageCreated() {
        HealthStatus status = service(docker).checkStorage();
        assertEquals(HealthStatus.Status.UP, status.status());
        assertTrue(Files.isDirectory(tempDir.resolve("state")));
    }

    @Test
    @DisplayName("State dir blocked by a file -> storage DOWN")
    void storageBlocked() throws Exception {
        Files.writeString(tempDir.resolve("state"), "not a directory");
        assertEquals(HealthStatus.Status.DOWN, service(docker).checkStorage().status());
    }
}
