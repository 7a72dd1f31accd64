package com.dispatchhub.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JobTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private Job newJob(int maxAttempts) {
        return new Job("job-1", "email", null, JobPriority.NORMAL.getValue(), maxAttempts, T0);
    }

    @Test
    public void testNewJobIsPending() {
        Job job = newJob(3);
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(0, job.getAttempts());
        assertEquals(T0, job.getCreatedAt());
        assertEquals(T0, job.getUpdatedAt());
        assertNull(job.getProcessedAt());
        assertNull(job.getError());
    }

    @Test
    public void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Job("id", "", null, 0, 3, T0));
        assertThrows(IllegalArgumentException.class, () -> new Job("id", "email", null, 0, 0, T0));
        assertThrows(NullPointerException.class, () -> new Job(null, "email", null, 0, 3, T0));
    }

    @Test
    public void testSuccessfulLifecycle() {
        Job job = newJob(3);
        Instant t1 = T0.plusSeconds(1);
        Instant t2 = T0.plusSeconds(2);

        job.markProcessing(t1);
        assertEquals(JobStatus.PROCESSING, job.getStatus());
        assertEquals(1, job.getAttempts());
        assertEquals(t1, job.getUpdatedAt());

        job.markCompleted(t2);
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(t2, job.getProcessedAt());
        assertTrue(job.getStatus().isTerminal());
    }

    @Test
    public void testRetryThenFail() {
        Job job = newJob(2);

        job.markProcessing(T0);
        assertTrue(job.hasAttemptsLeft());
        job.markRetrying("first", T0);
        assertEquals(JobStatus.RETRYING, job.getStatus());
        assertEquals("first", job.getError());

        job.markProcessing(T0);
        assertEquals(2, job.getAttempts());
        assertFalse(job.hasAttemptsLeft());
        assertThrows(IllegalStateException.class, () -> job.markRetrying("again", T0));

        job.markFailed("second", T0);
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("second", job.getError());
    }

    @Test
    public void testCannotFailWithAttemptsLeft() {
        Job job = newJob(3);
        job.markProcessing(T0);
        assertThrows(IllegalStateException.class, () -> job.markFailed("too early", T0));
    }

    @Test
    public void testIllegalTransitionsAreRejected() {
        Job job = newJob(3);
        assertThrows(IllegalStateException.class, () -> job.markCompleted(T0));

        job.markProcessing(T0);
        job.markCompleted(T0);
        assertThrows(IllegalStateException.class, () -> job.markProcessing(T0));
    }

    @Test
    public void testSnapshotIsIndependent() {
        Job job = newJob(3);
        Job snapshot = job.snapshot();

        job.markProcessing(T0);

        assertEquals(JobStatus.PENDING, snapshot.getStatus());
        assertEquals(0, snapshot.getAttempts());
        assertEquals(job.getId(), snapshot.getId());
    }

    @Test
    public void testPayloadRoundTripThroughGson() {
        String payload = Job.toPayload(new EmailData("user@example.com", "Welcome"));
        Job job = new Job("job-2", "email", payload, 0, 1, T0);

        EmailData data = job.payloadAs(EmailData.class);
        assertEquals("user@example.com", data.to);
        assertEquals("Welcome", data.subject);

        Map<?, ?> raw = job.payloadAs(Map.class);
        assertEquals("Welcome", raw.get("subject"));
    }

    @Test
    public void testEmptyPayloadDecodesToNull() {
        assertNull(newJob(1).payloadAs(EmailData.class));
    }

    static class EmailData {
        String to;
        String subject;

        EmailData(String to, String subject) {
            this.to = to;
            this.subject = subject;
        }
    }
}
