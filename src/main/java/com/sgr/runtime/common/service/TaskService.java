package com.sgr.runtime.common.service;

import com.sgr.runtime.common.state.JobManager;
import com.sgr.runtime.executor.ExecutionResult;
import com.sgr.runtime.executor.GraphExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Runs inbound tasks against agent runtimes, synchronously or as background jobs.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final AgentRuntimeRegistry registry;
    private final GraphExecutor graphExecutor;
    private final JobManager jobManager;
    private final ExecutorService jobExecutor;
    private final long defaultTimeoutMs;

    public TaskService(AgentRuntimeRegistry registry,
            GraphExecutor graphExecutor,
            JobManager jobManager,
            @Qualifier("jobExecutorService") ExecutorService jobExecutor,
            @Value("${runtime.executor.default-timeout-ms:120000}") long defaultTimeoutMs) {
        this.registry = registry;
        this.graphExecutor = graphExecutor;
        this.jobManager = jobManager;
        this.jobExecutor = jobExecutor;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public TaskResponse execute(String agentId, TaskRequest request) {
        requireMessage(request);
        AgentRuntime runtime = registry.getRuntime(agentId);
        ExecutionResult result = graphExecutor.execute(runtime.graph(), request.message(), timeoutOf(request));
        return TaskResponse.from(agentId, result);
    }

    /**
     * Queues the task and returns the job id immediately.
     */
    public String submit(String agentId, TaskRequest request) {
        requireMessage(request);
        String jobId = jobManager.createJob(agentId);
        jobExecutor.execute(() -> runJob(jobId, agentId, request));
        return jobId;
    }

    private void runJob(String jobId, String agentId, TaskRequest request) {
        try {
            jobManager.updateJobStatus(jobId, JobManager.STATUS_PROCESSING, "Task started.", null);
            log.info("Starting async processing for Job ID: {}", jobId);

            TaskResponse response = execute(agentId, request);

            jobManager.updateJobStatus(jobId, JobManager.STATUS_COMPLETED, "Task finished.", response);
            log.info("Task completed for Job ID: {} with status {}", jobId, response.status());
        } catch (RuntimeException e) {
            log.error("Task failed for Job ID: {}", jobId, e);
            jobManager.updateJobStatus(jobId, JobManager.STATUS_FAILED, "Processing failed: " + e.getMessage(), null);
        }
    }

    private Duration timeoutOf(TaskRequest request) {
        if (request.timeoutSeconds() != null && request.timeoutSeconds() > 0) {
            return Duration.ofSeconds(request.timeoutSeconds());
        }
        return Duration.ofMillis(defaultTimeoutMs);
    }

    private void requireMessage(TaskRequest request) {
        if (request == null || !StringUtils.hasText(request.message())) {
            throw new IllegalArgumentException("Task message is required");
        }
    }
}
