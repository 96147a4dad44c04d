package pmc.domain.jobs;

import org.joda.time.DateTime;

/**
 * One print job observed on a printer.
 * Mutated only by {@link JobTracker}; callers get the same instance but no public mutators.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 09/10/2026
 */
public class TrackedJob {
    private final String jobId;
    private final String printerSerial;
    private final String printerIp;
    private final String fileName;
    private final DateTime startedAt;
    private final String productId;
    private final String productName;

    private JobStatus status;
    private DateTime finishedAt;
    private boolean sentToBackend;
    private String backendEventId;

    TrackedJob(String jobId, String printerSerial, String printerIp, String fileName, DateTime startedAt,
               String productId, String productName) {
        this.jobId = jobId;
        this.printerSerial = printerSerial;
        this.printerIp = printerIp;
        this.fileName = fileName;
        this.startedAt = startedAt;
        this.productId = productId;
        this.productName = productName;
        this.status = JobStatus.PRINTING;
    }

    /**
     * Rebuild a job from persisted state
     */
    public static TrackedJob restore(String jobId, String printerSerial, String printerIp, String fileName,
                                     JobStatus status, DateTime startedAt, DateTime finishedAt,
                                     boolean sentToBackend, String backendEventId,
                                     String productId, String productName) {
        TrackedJob job = new TrackedJob(jobId, printerSerial, printerIp, fileName, startedAt, productId, productName);
        job.status = status;
        job.finishedAt = finishedAt;
        job.sentToBackend = sentToBackend;
        job.backendEventId = backendEventId;
        return job;
    }

    public String getJobId() {
        return jobId;
    }

    public String getPrinterSerial() {
        return printerSerial;
    }

    public String getPrinterIp() {
        return printerIp;
    }

    public String getFileName() {
        return fileName;
    }

    public DateTime getStartedAt() {
        return startedAt;
    }

    public String getProductId() {
        return productId;
    }

    public String getProductName() {
        return productName;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized DateTime getFinishedAt() {
        return finishedAt;
    }

    public synchronized boolean isSentToBackend() {
        return sentToBackend;
    }

    public synchronized String getBackendEventId() {
        return backendEventId;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Synthesized job id used when the printer reports none
     */
    public boolean isLocalKey() {
        return jobId.startsWith(JobTracker.LOCAL_KEY_PREFIX);
    }

    synchronized void end(JobStatus newStatus, DateTime when) {
        this.status = newStatus;
        this.finishedAt = when;
    }

    synchronized void markSent(String eventId) {
        this.sentToBackend = true;
        this.backendEventId = eventId;
    }

    @Override
    public synchronized String toString() {
        return String.format("TrackedJob{printer='%s', job='%s', file='%s', status=%s, sent=%s}",
                printerSerial, jobId, fileName, status, sentToBackend);
    }
}
