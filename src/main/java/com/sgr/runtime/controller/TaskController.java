package com.sgr.runtime.controller;

import com.sgr.runtime.common.service.TaskRequest;
import com.sgr.runtime.common.service.TaskResponse;
import com.sgr.runtime.common.service.TaskService;
import com.sgr.runtime.common.state.JobManager;
import com.sgr.runtime.common.state.JobStatusResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/agents")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskService taskService;
    private final JobManager jobManager;

    public TaskController(TaskService taskService, JobManager jobManager) {
        this.taskService = taskService;
        this.jobManager = jobManager;
    }

    /**
     * Runs a task and waits for the aggregated result.
     */
    @PostMapping("/{agentId}/tasks")
    public TaskResponse execute(@PathVariable String agentId, @RequestBody TaskRequest request) {
        log.info("Received task for agent: {}", agentId);
        return taskService.execute(agentId, request);
    }

    /**
     * Submits a task to be processed asynchronously.
     * Returns 202 Accepted immediately with a jobId.
     */
    @PostMapping("/{agentId}/tasks/submit")
    public ResponseEntity<JobStatusResponse> submit(@PathVariable String agentId, @RequestBody TaskRequest request) {
        log.info("Received submission for agent: {}", agentId);
        String jobId = taskService.submit(agentId, request);
        return ResponseEntity.accepted()
                .body(new JobStatusResponse(jobId, agentId, JobManager.STATUS_PENDING, null, null));
    }

    /**
     * Client endpoint to poll for the status of a job.
     */
    @GetMapping("/tasks/status/{jobId}")
    public ResponseEntity<JobStatusResponse> getStatus(@PathVariable String jobId) {
        return jobManager.getJobStatus(jobId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
