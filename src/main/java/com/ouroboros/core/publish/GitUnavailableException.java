package com.ouroboros.core.publish;

/**
 * The {@code git} executable could not be started. Detected once per process;
 * every later call fails fast with this exception.
 */
public class GitUnavailableException extends RuntimeException {

    public GitUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
