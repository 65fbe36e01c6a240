package com.sgr.runtime.executor;

public enum TaskStatus {
    COMPLETED,
    PARTIAL,
    FAILED,
    DEADLINE_EXCEEDED,
    ROUTING_NO_MATCH
}
