package pmc.domain.jobs;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.domain.status.PrintStates;
import pmc.domain.status.StatusSnapshot;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Lifecycle state of print jobs across all printers, with persistence and restart recovery.
 *
 * <p>Jobs are keyed by (printer serial, job id). When the printer reports no job id the key
 * {@code _local_<fileName>} is used. Status only moves forward; the job-ended callback fires once per
 * job, outside the tracker lock, and its failures are logged. A terminal job is reported to the backend by
 * whoever holds its report claim, see {@link #claimForReport(String, String)}.</p>
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 09/10/2026
 */
public class JobTracker {
    private static final Logger logger = LoggerFactory.getLogger(JobTracker.class);

    static final String LOCAL_KEY_PREFIX = "_local_";

    private final IJobStore store;
    private final Object lock = new Object();
    private final Map<String, TrackedJob> jobs = new LinkedHashMap<>();
    private final Map<String, String> currentJobPerPrinter = new HashMap<>();
    private final Set<String> reportsInFlight = new HashSet<>();

    private volatile Consumer<TrackedJob> onJobEnded;

    public JobTracker(IJobStore store) {
        this.store = store;
    }

    public void setOnJobEnded(Consumer<TrackedJob> onJobEnded) {
        this.onJobEnded = onJobEnded;
    }

    public static String localJobKey(String fileName) {
        return LOCAL_KEY_PREFIX + (fileName == null || fileName.isBlank() ? "unknown" : fileName);
    }

    private static String key(String printerSerial, String jobId) {
        return printerSerial + "|" + jobId;
    }

    private static String resolveJobId(String jobId, String fileName) {
        return (jobId == null || jobId.isBlank()) ? localJobKey(fileName) : jobId.trim();
    }

    private static String trimId(String jobId) {
        return jobId == null ? null : jobId.trim();
    }

    public TrackedJob startJob(String printerSerial, String printerIp, String jobId, String fileName) {
        return startJob(printerSerial, printerIp, jobId, fileName, null, null);
    }

    /**
     * Start tracking a job. Idempotent: a known (serial, job) returns the existing instance unchanged.
     */
    public TrackedJob startJob(String printerSerial, String printerIp, String jobId, String fileName,
                               String productId, String productName) {
        String resolvedId = resolveJobId(jobId, fileName);
        TrackedJob job;
        synchronized (lock) {
            TrackedJob existing = jobs.get(key(printerSerial, resolvedId));
            if (existing != null) {
                logger.debug("[tracker] Job already tracked: {}/{}", printerSerial, resolvedId);
                return existing;
            }
            job = new TrackedJob(resolvedId, printerSerial, printerIp, fileName == null ? "unknown" : fileName,
                    DateTime.now(DateTimeZone.UTC), productId, productName);
            jobs.put(key(printerSerial, resolvedId), job);
            currentJobPerPrinter.put(printerSerial, resolvedId);
        }
        logger.info("[tracker] JOB STARTED: printer={}, job={}, file={}", printerSerial, resolvedId, job.getFileName());
        persist(job);
        return job;
    }

    public TrackedJob finishJob(String printerSerial, String jobId) {
        return endJob(printerSerial, jobId, JobStatus.FINISHED);
    }

    public TrackedJob cancelJob(String printerSerial, String jobId) {
        return endJob(printerSerial, jobId, JobStatus.CANCELLED);
    }

    /**
     * @return the job, unchanged when already terminal; null when unknown
     */
    private TrackedJob endJob(String printerSerial, String rawJobId, JobStatus newStatus) {
        String jobId = trimId(rawJobId);
        if (jobId == null || jobId.isEmpty()) {
            return null;
        }
        TrackedJob job;
        synchronized (lock) {
            job = jobs.get(key(printerSerial, jobId));
            if (job == null) {
                logger.debug("[tracker] Job not found for end: {}/{}", printerSerial, jobId);
                return null;
            }
            if (job.isTerminal()) {
                logger.debug("[tracker] Job already ended: {}/{} (status={})", printerSerial, jobId, job.getStatus());
                return job;
            }
            job.end(newStatus, DateTime.now(DateTimeZone.UTC));
            if (jobId.equals(currentJobPerPrinter.get(printerSerial))) {
                currentJobPerPrinter.remove(printerSerial);
            }
        }
        logger.info("[tracker] JOB {}: printer={}, job={}, file={}", newStatus, printerSerial, jobId, job.getFileName());
        persist(job);

        Consumer<TrackedJob> callback = onJobEnded;
        if (callback != null) {
            try {
                callback.accept(job);
            } catch (Exception e) {
                logger.warn("[tracker] Job ended callback failed: {}", e.getMessage());
            }
        }
        return job;
    }

    /**
     * Flag a job as reported to the backend
     * @return true when the job was found
     */
    public boolean markAsSent(String printerSerial, String rawJobId, String eventId) {
        String jobId = trimId(rawJobId);
        TrackedJob job;
        synchronized (lock) {
            reportsInFlight.remove(key(printerSerial, jobId));
            job = jobs.get(key(printerSerial, jobId));
            if (job == null) {
                return false;
            }
            job.markSent(eventId);
        }
        logger.info("[tracker] JOB SENT: printer={}, job={}, event_id={}", printerSerial, jobId, eventId);
        persist(job);
        return true;
    }

    /**
     * Take the exclusive right to report a terminal job. Released by {@link #markAsSent} or
     * {@link #releaseReportClaim}.
     * @return false when the job is unknown, still running, already sent or being reported by someone else
     */
    public boolean claimForReport(String printerSerial, String jobId) {
        String id = trimId(jobId);
        synchronized (lock) {
            TrackedJob job = jobs.get(key(printerSerial, id));
            if (job == null || !job.isTerminal() || job.isSentToBackend()) {
                return false;
            }
            return reportsInFlight.add(key(printerSerial, id));
        }
    }

    /**
     * Give up a report claim after a failed delivery, so a later flush retries
     */
    public void releaseReportClaim(String printerSerial, String jobId) {
        synchronized (lock) {
            reportsInFlight.remove(key(printerSerial, trimId(jobId)));
        }
    }

    public TrackedJob getJob(String printerSerial, String jobId) {
        synchronized (lock) {
            return jobs.get(key(printerSerial, trimId(jobId)));
        }
    }

    /**
     * All jobs, newest first
     */
    public List<TrackedJob> getAllJobs() {
        List<TrackedJob> all;
        synchronized (lock) {
            all = new ArrayList<>(jobs.values());
        }
        all.sort(Comparator.comparing(TrackedJob::getStartedAt).reversed());
        return all;
    }

    public List<TrackedJob> getJobsForPrinter(String printerSerial) {
        return getAllJobs().stream()
                .filter(job -> job.getPrinterSerial().equals(printerSerial))
                .collect(Collectors.toList());
    }

    public TrackedJob getCurrentJob(String printerSerial) {
        synchronized (lock) {
            String jobId = currentJobPerPrinter.get(printerSerial);
            return jobId == null ? null : jobs.get(key(printerSerial, jobId));
        }
    }

    /**
     * Terminal jobs not yet reported to the backend
     */
    public List<TrackedJob> getPendingJobs() {
        synchronized (lock) {
            return jobs.values().stream()
                    .filter(job -> job.isTerminal() && !job.isSentToBackend())
                    .collect(Collectors.toList());
        }
    }

    /**
     * Follow telemetry: start tracking a newly printing job, cancel the current one when the printer reports failure.
     * Completion is left to the debounced completion monitor.
     * @return the job that was started or cancelled, null when nothing changed
     */
    public TrackedJob updateFromStatus(String printerSerial, String printerIp, StatusSnapshot snapshot) {
        String gcodeState = snapshot.gcodeState() != null ? snapshot.gcodeState() : snapshot.state();
        TrackedJob current = getCurrentJob(printerSerial);

        if (current != null && (isCancelledState(gcodeState) || isCancelledState(snapshot.state()))) {
            return cancelJob(printerSerial, current.getJobId());
        }

        String jobId = snapshot.currentJobId();
        String fileName = snapshot.fileName();
        if ((jobId == null || jobId.isBlank()) && (fileName == null || fileName.isBlank())) {
            return null;
        }
        if (!PrintStates.isJobActive(gcodeState)) {
            return null;
        }
        String resolvedId = resolveJobId(jobId, fileName);
        if (current != null && current.getJobId().equals(resolvedId)) {
            return null;
        }
        if (getJob(printerSerial, resolvedId) != null) {
            // ended already, a late reading of the same job does not restart it
            return null;
        }
        return startJob(printerSerial, printerIp, resolvedId, fileName == null ? "unknown" : fileName);
    }

    public static boolean isCancelledState(String state) {
        return PrintStates.isFailed(state);
    }

    /**
     * Rebuild in-memory state from the store after a restart.
     * Printing jobs become current again; terminal unsent jobs are kept for the pending flush.
     * Jobs already known in memory are skipped.
     * @return number of jobs restored
     */
    public int loadFromDatabase() {
        if (store == null) {
            return 0;
        }
        List<TrackedJob> persisted;
        try {
            persisted = store.loadAll();
        } catch (IOException e) {
            logger.error("[tracker] Failed to load persisted jobs: {}", e.getMessage());
            return 0;
        }

        int restored = 0;
        synchronized (lock) {
            for (TrackedJob job : persisted) {
                boolean relevant = job.getStatus() == JobStatus.PRINTING || !job.isSentToBackend();
                String jobKey = key(job.getPrinterSerial(), job.getJobId());
                if (!relevant || jobs.containsKey(jobKey)) {
                    continue;
                }
                jobs.put(jobKey, job);
                if (job.getStatus() == JobStatus.PRINTING) {
                    currentJobPerPrinter.put(job.getPrinterSerial(), job.getJobId());
                }
                restored++;
            }
        }
        logger.info("[tracker] Restored {} job(s) from store", restored);
        return restored;
    }

    private void persist(TrackedJob job) {
        if (store == null) {
            return;
        }
        try {
            store.save(job);
        } catch (IOException e) {
            logger.error("[tracker] Failed to persist job {}/{}: {}", job.getPrinterSerial(), job.getJobId(), e.getMessage());
        }
    }
}
