package com.sgr.runtime.common.state;

import com.sgr.runtime.common.service.TaskResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class JobManager {

    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    // Thread-safe map to store job data (Id -> Status/Result)
    private final Map<String, JobEntry> jobStore = new ConcurrentHashMap<>();

    // Status Constants
    public static final String STATUS_PENDING = "PENDING";
    public static final String STATUS_PROCESSING = "PROCESSING";
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_FAILED = "FAILED";

    private final Duration finishedTtl;
    private final Clock clock;

    @Autowired
    public JobManager(@Value("${runtime.jobs.finished-ttl-ms:3600000}") long finishedTtlMs) {
        this(Duration.ofMillis(finishedTtlMs), Clock.systemUTC());
    }

    JobManager(Duration finishedTtl, Clock clock) {
        this.finishedTtl = finishedTtl;
        this.clock = clock;
    }

    /**
     * Creates a new job record in memory.
     *
     * @return The unique job ID.
     */
    public String createJob(String agentId) {
        evictExpired();
        String jobId = UUID.randomUUID().toString();
        jobStore.put(jobId, new JobEntry(new JobStatusResponse(jobId, agentId, STATUS_PENDING, null, null), null));
        return jobId;
    }

    /**
     * Updates the status of an existing job. Completed and failed jobs are
     * kept for the finished TTL, then dropped.
     */
    public void updateJobStatus(String jobId, String status, String message, TaskResponse result) {
        JobEntry current = jobStore.get(jobId);
        if (current == null) {
            throw new IllegalArgumentException("Job ID not found: " + jobId);
        }
        Instant finishedAt = isFinished(status) ? clock.instant() : null;
        jobStore.put(jobId, new JobEntry(
                new JobStatusResponse(jobId, current.status().agentId(), status, message, result), finishedAt));
    }

    /**
     * Retrieves the current status and result for a job.
     */
    public Optional<JobStatusResponse> getJobStatus(String jobId) {
        evictExpired();
        return Optional.ofNullable(jobStore.get(jobId)).map(JobEntry::status);
    }

    int size() {
        return jobStore.size();
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(finishedTtl);
        int before = jobStore.size();
        jobStore.values().removeIf(entry -> entry.finishedAt() != null && !entry.finishedAt().isAfter(cutoff));
        int evicted = before - jobStore.size();
        if (evicted > 0) {
            log.debug("Evicted {} finished job(s) older than {}", evicted, finishedTtl);
        }
    }

    private static boolean isFinished(String status) {
        return STATUS_COMPLETED.equals(status) || STATUS_FAILED.equals(status);
    }

    private record JobEntry(JobStatusResponse status, Instant finishedAt) {
    }
}
