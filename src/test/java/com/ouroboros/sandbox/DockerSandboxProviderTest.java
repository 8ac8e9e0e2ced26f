package com.ouroboros.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.*;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DockerSandboxProvider.
 *
 * <p>The docker-java fluent builders are mocked by hand with RETURNS_SELF so each
 * verification targets the exact command that was built.
 */
class DockerSandboxProviderTest {

    private DockerClient dockerClient;
    private DockerSandboxProvider provider;

    private final SandboxRequest request = new SandboxRequest("run-001", Path.of("/tmp/verify-1"), 256, 0.5,
            Duration.ofSeconds(60));

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        provider = new DockerSandboxProvider(dockerClient, "alpine:3.19", Duration.ofSeconds(30));
        mockInspectImageSuccess();
    }

    // ── availability ───────────────────────────────────────────────────

    @Test
    void availableWhenPingSucceeds() {
        when(dockerClient.pingCmd()).thenReturn(mock(PingCmd.class));
        assertTrue(provider.isAvailable());
    }

    @Test
    void unavailableWhenPingFails() {
        var ping = mock(PingCmd.class);
        when(dockerClient.pingCmd()).thenReturn(ping);
        when(ping.exec()).thenThrow(new RuntimeException("Cannot connect to the Docker daemon"));
        assertFalse(provider.isAvailable());
    }

    // ── openSandbox ────────────────────────────────────────────────────

    @Test
    void openSandboxCreatesIsolatedContainerAndStartsIt() {
        var createCmd = mockCreateContainerCmd("container-abc");
        var startCmd = mock(StartContainerCmd.class);
        when(dockerClient.startContainerCmd("container-abc")).thenReturn(startCmd);

        String id = provider.openSandbox(request);

        assertEquals("container-abc", id);
        verify(dockerClient).createContainerCmd("alpine:3.19");
        verify(createCmd).withName("ouroboros-verify-run-001");
        verify(createCmd).withCmd("sh", "verify.sh");
        verify(createCmd).withWorkingDir("/workspace");
        verify(createCmd).withNetworkDisabled(true);
        verify(startCmd).exec();
    }

    @Test
    void openSandboxBoundsMemoryAndCpuWithoutNetwork() {
        var createCmd = mockCreateContainerCmd("container-hc");
        when(dockerClient.startContainerCmd(anyString())).thenReturn(mock(StartContainerCmd.class));

        provider.openSandbox(request);

        var captor = ArgumentCaptor.forClass(HostConfig.class);
        verify(createCmd).withHostConfig(captor.capture());
        HostConfig hostConfig = captor.getValue();
        assertEquals("none", hostConfig.getNetworkMode());
        assertEquals(256L * 1024 * 1024, hostConfig.getMemory());
        assertEquals(500_000_000L, hostConfig.getNanoCPUs());
        assertEquals("/tmp/verify-1", hostConfig.getBinds()[0].getPath());
        assertEquals(AccessMode.ro, hostConfig.getBinds()[0].getAccessMode());
    }

    @Test
    void openSandboxPullsMissingImage() throws Exception {
        var pullCallback = mockPull();
        when(pullCallback.awaitCompletion(30_000L, TimeUnit.MILLISECONDS)).thenReturn(true);

        mockCreateContainerCmd("container-pulled");
        when(dockerClient.startContainerCmd(anyString())).thenReturn(mock(StartContainerCmd.class));

        provider.openSandbox(request);

        verify(dockerClient).pullImageCmd("alpine:3.19");
        verify(pullCallback).close();
    }

    @Test
    void slowPullIsBoundedByStartBudget() throws Exception {
        var pullCallback = mockPull();
        when(pullCallback.awaitCompletion(anyLong(), any(TimeUnit.class))).thenReturn(false);
        var shortRun = new SandboxRequest("run-002", Path.of("/tmp/verify-2"), 256, 0.5, Duration.ofSeconds(2));

        var e = assertThrows(SandboxTimeoutException.class, () -> provider.openSandbox(shortRun));

        assertEquals(Duration.ofSeconds(2), e.timeout());
        verify(pullCallback).awaitCompletion(2_000L, TimeUnit.MILLISECONDS);
        verify(dockerClient, never()).createContainerCmd(anyString());
    }

    @Test
    void slowPullWithinBudgetFailsOnPullTimeout() throws Exception {
        var pullCallback = mockPull();
        when(pullCallback.awaitCompletion(anyLong(), any(TimeUnit.class))).thenReturn(false);

        var e = assertThrows(SandboxException.class, () -> provider.openSandbox(request));

        assertFalse(e instanceof SandboxTimeoutException);
        verify(pullCallback).awaitCompletion(30_000L, TimeUnit.MILLISECONDS);
    }

    // ── waitForCompletion ──────────────────────────────────────────────

    @Test
    void waitForCompletionReturnsExitCode() throws Exception {
        var callback = mockWait("container-123");
        when(callback.awaitStatusCode(60_000L, TimeUnit.MILLISECONDS)).thenReturn(3);

        assertEquals(3, provider.waitForCompletion("container-123", Duration.ofSeconds(60)));
        verify(callback).close();
    }

    @Test
    void waitForCompletionReturnsMinusOneOnNullStatus() {
        var callback = mockWait("container-123");
        when(callback.awaitStatusCode(60_000L, TimeUnit.MILLISECONDS)).thenReturn(null);

        assertEquals(-1, provider.waitForCompletion("container-123", Duration.ofSeconds(60)));
    }

    @Test
    void waitForCompletionKillsContainerOnTimeout() {
        var callback = mockWait("container-slow");
        when(callback.awaitStatusCode(1_000L, TimeUnit.MILLISECONDS))
                .thenThrow(new DockerClientException("Awaiting status code timeout."));
        var killCmd = mock(KillContainerCmd.class);
        when(dockerClient.killContainerCmd("container-slow")).thenReturn(killCmd);

        var e = assertThrows(SandboxTimeoutException.class,
                () -> provider.waitForCompletion("container-slow", Duration.ofSeconds(1)));

        assertEquals(Duration.ofSeconds(1), e.timeout());
        verify(killCmd).exec();
    }

    // ── captureOutput ──────────────────────────────────────────────────

    @Test
    void captureOutputSplitsStdoutAndStderr() {
        var logCmd = mock(LogContainerCmd.class, RETURNS_SELF);
        when(dockerClient.logContainerCmd("container-123")).thenReturn(logCmd);
        doAnswer(invocation -> {
            var callback = (LogContainerResultCallback) invocation.getArgument(0);
            callback.onNext(new Frame(StreamType.STDOUT, "ok\n".getBytes(StandardCharsets.UTF_8)));
            callback.onNext(new Frame(StreamType.STDERR, "warn\n".getBytes(StandardCharsets.UTF_8)));
            callback.onComplete();
            return callback;
        }).when(logCmd).exec(any());

        SandboxOutput output = provider.captureOutput("container-123");

        assertEquals("ok\n", output.stdout());
        assertEquals("warn\n", output.stderr());
        verify(logCmd).withFollowStream(false);
    }

    // ── teardownSandbox ────────────────────────────────────────────────

    @Test
    void teardownForceRemovesContainer() {
        var removeCmd = mock(RemoveContainerCmd.class);
        when(dockerClient.removeContainerCmd("container-123")).thenReturn(removeCmd);
        when(removeCmd.withForce(true)).thenReturn(removeCmd);

        provider.teardownSandbox("container-123");

        verify(removeCmd).exec();
    }

    @Test
    void teardownToleratesMissingContainer() {
        var removeCmd = mock(RemoveContainerCmd.class);
        when(dockerClient.removeContainerCmd("container-123")).thenReturn(removeCmd);
        when(removeCmd.withForce(true)).thenReturn(removeCmd);
        when(removeCmd.exec()).thenThrow(new NotFoundException("No such container"));

        assertDoesNotThrow(() -> provider.teardownSandbox("container-123"));
    }

    // ── helpers ────────────────────────────────────────────────────────

    private PullImageResultCallback mockPull() {
        var inspectCmd = mock(InspectImageCmd.class);
        when(dockerClient.inspectImageCmd("alpine:3.19")).thenReturn(inspectCmd);
        when(inspectCmd.exec()).thenThrow(new NotFoundException("no such image"));

        var pullCmd = mock(PullImageCmd.class);
        when(dockerClient.pullImageCmd("alpine:3.19")).thenReturn(pullCmd);
        var pullCallback = mock(PullImageResultCallback.class);
        when(pullCmd.exec(any(PullImageResultCallback.class))).thenReturn(pullCallback);
        return pullCallback;
    }

    private WaitContainerResultCallback mockWait(String containerId) {
        var waitCmd = mock(WaitContainerCmd.class);
        when(dockerClient.waitContainerCmd(containerId)).thenReturn(waitCmd);
        var callback = mock(WaitContainerResultCallback.class);
        when(waitCmd.exec(any(WaitContainerResultCallback.class))).thenReturn(callback);
        return callback;
    }

    private CreateContainerCmd mockCreateContainerCmd(String containerId) {
        var createCmd = mock(CreateContainerCmd.class, RETURNS_SELF);
        when(dockerClient.createContainerCmd(anyString())).thenReturn(createCmd);

        var createResponse = mock(CreateContainerResponse.class);
        when(createResponse.getId()).thenReturn(containerId);
        when(createCmd.exec()).thenReturn(createResponse);

        return createCmd;
    }

    private void mockInspectImageSuccess() {
        var inspectCmd = mock(InspectImageCmd.class);
        when(dockerClient.inspectImageCmd(anyString())).thenReturn(inspectCmd);
        when(inspectCmd.exec()).thenReturn(mock(InspectImageResponse.class));
    }
}
