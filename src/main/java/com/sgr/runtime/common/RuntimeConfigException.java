package com.sgr.runtime.common;

/**
 * Raised while turning a runtime configuration into an executable graph.
 * These errors are fatal for the agent being built and are never degraded.
 */
public class RuntimeConfigException extends RuntimeException {

    public enum Reason {
        CONFIG_NOT_FOUND,
        CONFIG_UNREACHABLE,
        INVALID_CONFIG,
        UNSUPPORTED_EXECUTION_TYPE,
        DANGLING_ROLE_REFERENCE,
        INSTRUCTION_UNRESOLVED,
        UNKNOWN_BUILTIN_TOOL,
        SECRET_RESOLUTION_FAILED,
        TOOL_SERVER_UNAVAILABLE
    }

    private final Reason reason;

    public RuntimeConfigException(Reason reason, String message) {
        this(reason, message, null);
    }

    public RuntimeConfigException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
