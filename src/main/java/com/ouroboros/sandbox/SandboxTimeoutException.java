package com.ouroboros.sandbox;

import java.time.Duration;

/**
 * A sandbox run did not finish within its timeout and was force-terminated.
 */
public class SandboxTimeoutException extends SandboxException {

    private final Duration timeout;

    public SandboxTimeoutException(String sandboxId, Duration timeout) {
        super("Sandbox " + sandboxId + " timed out after " + timeout.toSeconds() + "s");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
