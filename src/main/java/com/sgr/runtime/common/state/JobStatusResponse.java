package com.sgr.runtime.common.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sgr.runtime.common.service.TaskResponse;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("agent_id") String agentId,
        String status,
        String message,
        TaskResponse result) {
}
