package com.ouroboros.sandbox;

/**
 * Captured output of a finished sandbox run.
 */
public record SandboxOutput(String stdout, String stderr) {

    public static SandboxOutput empty() {
        return new SandboxOutput("", "");
    }
}
