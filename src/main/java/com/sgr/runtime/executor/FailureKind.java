package com.sgr.runtime.executor;

public enum FailureKind {
    PROVIDER_ERROR,
    TOOL_EXECUTION_ERROR,
    MAX_TURNS_EXCEEDED,
    DEPENDENCY_FAILED,
    ROUTING_NO_MATCH,
    DEADLINE_EXCEEDED
}
