package com.ouroboros.core.model;

/**
 * Why a push to the remote did not succeed.
 */
public enum PushFailure {
    NONE,
    /** Remote is ahead; a rebase was attempted and did not resolve it. */
    REJECTED,
    /** Remote host could not be reached. */
    UNREACHABLE,
    AUTHENTICATION,
    NO_REMOTE,
    OTHER
}
