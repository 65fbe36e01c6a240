package com.sgr.runtime.common.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sgr.runtime.executor.ExecutionResult;
import com.sgr.runtime.executor.PartialFailure;

import java.util.List;
import java.util.Map;

public record TaskResponse(
        @JsonProperty("agent_id") String agentId,
        String status,
        String output,
        @JsonProperty("role_outputs") Map<String, String> roleOutputs,
        List<PartialFailure> failures,
        List<String> notes,
        @JsonProperty("duration_ms") long durationMs) {

    public static TaskResponse from(String agentId, ExecutionResult result) {
        return new TaskResponse(agentId, result.status().name(), result.output(), result.roleOutputs(),
                result.failures(), result.notes(), result.duration().toMillis());
    }
}
