package pmc.domain.jobs;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import pmc.domain.status.StatusSnapshot;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author Martin Sustik <sustik@herman.cz>
 * @since 13/10/2026
 */
@ExtendWith(MockitoExtension.class)
class JobTrackerTest {

    @Mock
    private IJobStore store;

    private JobTracker tracker;
    private List<TrackedJob> ended;

    @BeforeEach
    void setUp() {
        tracker = new JobTracker(store);
        ended = new ArrayList<>();
        tracker.setOnJobEnded(ended::add);
    }

    @Test
    @DisplayName("Should return the same job when started twice")
    void shouldStartJobIdempotently() {
        // When
        TrackedJob first = tracker.startJob("SN1", "10.0.0.5", "job-1", "a.3mf");
        TrackedJob second = tracker.startJob("SN1", "10.0.0.5", "job-1", "other.3mf");

        // Then
        assertThat(second).isSameAs(first);
        assertThat(second.getFileName()).isEqualTo("a.3mf");
        assertThat(tracker.getCurrentJob("SN1")).isSameAs(first);
    }

    @Test
    @DisplayName("Should use a local key when the printer reports no job id")
    void shouldUseLocalKey() {
        // When
        TrackedJob job = tracker.startJob("SN1", "10.0.0.5", null, "a.3mf");

        // Then
        assertThat(job.getJobId()).isEqualTo("_local_a.3mf");
        assertThat(job.isLocalKey()).isTrue();
    }

    @Test
    @DisplayName("Should end a job once and fire the callback once")
    void shouldEndJobOnce() {
        // Given
        tracker.startJob("SN1", "10.0.0.5", "job-1", "a.3mf");
        TrackedJob finished = tracker.finishJob("SN1", "job-1");
        DateTime finishedAt = finished.getFinishedAt();

        // When
        TrackedJob again = tracker.finishJob("SN1", "job-1");
        TrackedJob cancelled = tracker.cancelJob("SN1", "job-1");

        // Then
        assertThat(again).isSameAs(finished);
        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.FINISHED);
        assertThat(cancelled.getFinishedAt()).isEqualTo(finishedAt);
        assertThat(ended).containsExactly(finished);
        assertThat(tracker.getCurrentJob("SN1")).isNull();
    }

    @Test
    @DisplayName("Should end a job whose id arrives with surrounding whitespace")
    void shouldEndJobWithPaddedId() {
        // Given
        TrackedJob started = tracker.startJob("SN1", "10.0.0.5", " job1 ", "a.3mf");

        // When
        TrackedJob finished = tracker.finishJob("SN1", " job1 ");

        // Then
        assertThat(started.getJobId()).isEqualTo("job1");
        assertThat(finished).isSameAs(started);
        assertThat(finished.getStatus()).isEqualTo(JobStatus.FINISHED);
        assertThat(tracker.getCurrentJob("SN1")).isNull();
    }

    @Test
    @DisplayName("Should grant the report claim of a finished job to one caller at a time")
    void shouldGrantReportClaimOnce() {
        // Given
        tracker.startJob("SN1", "10.0.0.5", "job-1", "a.3mf");
        boolean whileRunning = tracker.claimForReport("SN1", "job-1");
        tracker.finishJob("SN1", "job-1");

        // When
        boolean first = tracker.claimForReport("SN1", "job-1");
        boolean second = tracker.claimForReport("SN1", "job-1");
        tracker.releaseReportClaim("SN1", "job-1");
        boolean afterRelease = tracker.claimForReport("SN1", "job-1");
        tracker.markAsSent("SN1", "job-1", "ev-1");
        boolean afterSent = tracker.claimForReport("SN1", "job-1");

        // Then
        assertThat(whileRunning).isFalse();
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(afterRelease).isTrue();
        assertThat(afterSent).isFalse();
    }

    @Test
    @DisplayName("Should return null when ending an unknown job")
    void shouldIgnoreUnknownJob() {
        assertThat(tracker.finishJob("SN1", "nope")).isNull();
        assertThat(ended).isEmpty();
    }

    @Test
    @DisplayName("Should keep working when the callback fails")
    void shouldSurviveFailingCallback() {
        // Given
        tracker.setOnJobEnded(job -> {
            throw new IllegalStateException("bus down");
        });
        tracker.startJob("SN1", null, "job-1", "a.3mf");

        // When
        TrackedJob job = tracker.cancelJob("SN1", "job-1");

        // Then
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    @DisplayName("Should list pending jobs until they are marked sent")
    void shouldTrackPendingJobs() {
        // Given
        tracker.startJob("SN1", null, "job-1", "a.3mf");
        tracker.startJob("SN2", null, "job-2", "b.3mf");
        tracker.finishJob("SN1", "job-1");

        // When
        List<TrackedJob> pendingBefore = tracker.getPendingJobs();
        boolean marked = tracker.markAsSent("SN1", "job-1", "evt-1");

        // Then
        assertThat(pendingBefore).extracting(TrackedJob::getJobId).containsExactly("job-1");
        assertThat(marked).isTrue();
        assertThat(tracker.getPendingJobs()).isEmpty();
        assertThat(tracker.getJob("SN1", "job-1").getBackendEventId()).isEqualTo("evt-1");
        assertThat(tracker.markAsSent("SN1", "missing", "evt-2")).isFalse();
    }

    @Test
    @DisplayName("Should follow telemetry: start on printing, cancel on failure")
    void shouldFollowTelemetry() {
        // When
        TrackedJob started = tracker.updateFromStatus("SN1", "10.0.0.5", snapshot("RUNNING", "job-1"));
        TrackedJob unchanged = tracker.updateFromStatus("SN1", "10.0.0.5", snapshot("RUNNING", "job-1"));
        TrackedJob cancelled = tracker.updateFromStatus("SN1", "10.0.0.5", snapshot("FAILED", "job-1"));
        TrackedJob late = tracker.updateFromStatus("SN1", "10.0.0.5", snapshot("RUNNING", "job-1"));

        // Then
        assertThat(started).isNotNull();
        assertThat(unchanged).isNull();
        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(late).isNull();
        assertThat(ended).hasSize(1);
    }

    @Test
    @DisplayName("Should not start jobs from idle readings")
    void shouldIgnoreIdleReadings() {
        assertThat(tracker.updateFromStatus("SN1", null, snapshot("IDLE", "job-1"))).isNull();
        assertThat(tracker.getAllJobs()).isEmpty();
    }

    @Test
    @DisplayName("Should restore printing and unsent jobs from the store")
    void shouldLoadFromDatabase() throws IOException {
        // Given
        DateTime now = DateTime.now(DateTimeZone.UTC);
        when(store.loadAll()).thenReturn(List.of(
                TrackedJob.restore("job-1", "SN1", null, "a.3mf", JobStatus.PRINTING, now, null, false, null, null, null),
                TrackedJob.restore("job-2", "SN1", null, "b.3mf", JobStatus.FINISHED, now.minusHours(1), now, false, null, null, null),
                TrackedJob.restore("job-3", "SN1", null, "c.3mf", JobStatus.FINISHED, now.minusHours(2), now, true, "e", null, null)));

        // When
        int restored = tracker.loadFromDatabase();

        // Then
        assertThat(restored).isEqualTo(2);
        assertThat(tracker.getCurrentJob("SN1").getJobId()).isEqualTo("job-1");
        assertThat(tracker.getPendingJobs()).extracting(TrackedJob::getJobId).containsExactly("job-2");
        assertThat(tracker.getJob("SN1", "job-3")).isNull();
    }

    @Test
    @DisplayName("Should skip jobs already known in memory when loading")
    void shouldSkipKnownJobsWhenLoading() throws IOException {
        // Given
        TrackedJob live = tracker.startJob("SN1", null, "job-1", "a.3mf");
        when(store.loadAll()).thenReturn(List.of(
                TrackedJob.restore("job-1", "SN1", null, "a.3mf", JobStatus.PRINTING, DateTime.now(), null, false, null, null, null)));

        // When
        int restored = tracker.loadFromDatabase();

        // Then
        assertThat(restored).isZero();
        assertThat(tracker.getJob("SN1", "job-1")).isSameAs(live);
    }

    @Test
    @DisplayName("Should keep state in memory when persistence fails")
    void shouldSurvivePersistenceFailure() throws IOException {
        // Given
        doThrow(new IOException("disk full")).when(store).save(any());

        // When
        TrackedJob job = tracker.startJob("SN1", null, "job-1", "a.3mf");

        // Then
        assertThat(tracker.getJob("SN1", "job-1")).isSameAs(job);
        verify(store, atLeastOnce()).save(job);
    }

    @Test
    @DisplayName("Should list jobs newest first")
    void shouldListNewestFirst() throws IOException {
        // Given
        DateTime now = DateTime.now(DateTimeZone.UTC);
        lenient().when(store.loadAll()).thenReturn(List.of(
                TrackedJob.restore("old", "SN1", null, "a.3mf", JobStatus.FINISHED, now.minusDays(1), now, false, null, null, null),
                TrackedJob.restore("new", "SN2", null, "b.3mf", JobStatus.FINISHED, now.minusMinutes(1), now, false, null, null, null)));
        tracker.loadFromDatabase();

        // When
        List<TrackedJob> all = tracker.getAllJobs();

        // Then
        assertThat(all).extracting(TrackedJob::getJobId).containsExactly("new", "old");
        assertThat(tracker.getJobsForPrinter("SN1")).extracting(TrackedJob::getJobId).containsExactly("old");
    }

    private static StatusSnapshot snapshot(String gcodeState, String jobId) {
        return new StatusSnapshot(gcodeState, gcodeState, 10.0, null, null, null, null, null, jobId, "a.3mf", 0L);
    }
}
