package com.sgr.runtime.executor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of one task.
 *
 * @param roleOutputs output per role in completion order, failure markers included
 * @param notes non-error events, such as a hub falling back to broadcast
 */
public record ExecutionResult(
        TaskStatus status,
        String output,
        Map<String, String> roleOutputs,
        List<PartialFailure> failures,
        List<String> notes,
        Duration duration) {

    public ExecutionResult {
        roleOutputs = roleOutputs == null ? Map.of() : roleOutputs;
        failures = failures == null ? List.of() : List.copyOf(failures);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
