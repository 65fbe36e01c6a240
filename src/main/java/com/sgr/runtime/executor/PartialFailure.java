package com.sgr.runtime.executor;

/**
 * A failure recorded during a task that did not necessarily abort it.
 */
public record PartialFailure(String role, FailureKind kind, String message) {

    /** The text that stands in for the role's output downstream. */
    public String marker() {
        return "[FAILED role=" + role + " kind=" + kind + "] " + message;
    }
}
