package com.sgr.runtime.common.state;

import com.sgr.runtime.common.service.TaskResponse;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobManagerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final JobManager jobManager = new JobManager(Duration.ofMinutes(10), clock);

    @Test
    void newJobIsPending() {
        String jobId = jobManager.createJob("research-team");

        JobStatusResponse status = jobManager.getJobStatus(jobId).orElseThrow();
        assertEquals(JobManager.STATUS_PENDING, status.status());
        assertEquals("research-team", status.agentId());
        assertNull(status.result());
    }

    @Test
    void updateKeepsAgentAndStoresResult() {
        String jobId = jobManager.createJob("a1");
        TaskResponse result = new TaskResponse("a1", "COMPLETED", "done", Map.of("r1", "done"), List.of(), List.of(),
                12);

        jobManager.updateJobStatus(jobId, JobManager.STATUS_COMPLETED, "Task finished.", result);

        JobStatusResponse status = jobManager.getJobStatus(jobId).orElseThrow();
        assertEquals(JobManager.STATUS_COMPLETED, status.status());
        assertEquals("a1", status.agentId());
        assertSame(result, status.result());
    }

    @Test
    void unknownJob() {
        assertTrue(jobManager.getJobStatus("missing").isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> jobManager.updateJobStatus("missing", JobManager.STATUS_FAILED, null, null));
    }

    @Test
    void managersDoNotShareJobs() {
        String jobId = jobManager.createJob("a1");

        assertTrue(new JobManager(600_000).getJobStatus(jobId).isEmpty());
    }

    @Test
    void finishedJobsExpireAfterTtl() {
        String done = jobManager.createJob("a1");
        String failed = jobManager.createJob("a1");
        jobManager.updateJobStatus(done, JobManager.STATUS_COMPLETED, "Task finished.", null);
        jobManager.updateJobStatus(failed, JobManager.STATUS_FAILED, "boom", null);

        clock.advance(Duration.ofMinutes(9));
        assertTrue(jobManager.getJobStatus(done).isPresent());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(jobManager.getJobStatus(done).isEmpty());
        assertTrue(jobManager.getJobStatus(failed).isEmpty());
        assertEquals(0, jobManager.size());
    }

    @Test
    void runningJobsAreNeverEvicted() {
        String pending = jobManager.createJob("a1");
        String running = jobManager.createJob("a1");
        jobManager.updateJobStatus(running, JobManager.STATUS_PROCESSING, "Running", null);

        clock.advance(Duration.ofDays(1));
        jobManager.createJob("a2");

        assertEquals(JobManager.STATUS_PENDING, jobManager.getJobStatus(pending).orElseThrow().status());
        assertEquals(JobManager.STATUS_PROCESSING, jobManager.getJobStatus(running).orElseThrow().status());
        assertEquals(3, jobManager.size());
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
