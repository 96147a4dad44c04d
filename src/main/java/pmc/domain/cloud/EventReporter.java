package pmc.domain.cloud;

import com.google.common.eventbus.Subscribe;
import com.google.gson.JsonObject;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.domain.events.HmsErrorEvent;
import pmc.domain.events.JobEndedEvent;
import pmc.domain.hms.HmsError;
import pmc.domain.jobs.JobStatus;
import pmc.domain.jobs.JobTracker;
import pmc.domain.jobs.TrackedJob;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports job endings and HMS errors to the cloud event endpoint.
 * A job reported successfully is marked as sent; the rest stay pending and are flushed later.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 15/10/2026
 */
public class EventReporter {
    private static final Logger logger = LoggerFactory.getLogger(EventReporter.class);
    private static final DateTimeFormatter ISO = ISODateTimeFormat.dateTime().withZoneUTC();

    static final String EVENTS_PATH = "/api/printer-events/report";

    public static final String PRINT_COMPLETED = "print_completed";
    public static final String PRINT_FAILED = "print_failed";
    public static final String HMS_ERROR = "hms_error";

    private final CloudHttpClient http;
    private final JobTracker jobTracker;
    private final boolean enabled;

    public EventReporter(CloudHttpClient http, JobTracker jobTracker) {
        this.http = http;
        this.jobTracker = jobTracker;
        this.enabled = http.getConfig().enabled();
    }

    @Subscribe
    public void onJobEnded(JobEndedEvent event) {
        reportJob(event.job());
    }

    @Subscribe
    public void onHmsError(HmsErrorEvent event) {
        reportHmsError(event.printerSerial(), event.printerIp(), event.error());
    }

    /**
     * Report a terminal job and mark it sent
     * @return true when the backend accepted the event
     */
    public boolean reportJob(TrackedJob job) {
        if (!enabled || !job.isTerminal() || job.isSentToBackend()) {
            return false;
        }
        boolean completed = job.getStatus() == JobStatus.FINISHED;

        Map<String, Object> statusData = new LinkedHashMap<>();
        statusData.put("fileName", job.getFileName());
        statusData.put("startedAt", job.getStartedAt() == null ? null : ISO.print(job.getStartedAt()));
        statusData.put("finishedAt", job.getFinishedAt() == null ? null : ISO.print(job.getFinishedAt()));
        statusData.put("status", job.getStatus().wireValue());
        if (job.getProductId() != null) {
            statusData.put("productId", job.getProductId());
            statusData.put("productName", job.getProductName());
        }

        String message = (completed ? "Print job completed: " : "Print job failed: ") + job.getFileName();
        if (!jobTracker.claimForReport(job.getPrinterSerial(), job.getJobId())) {
            logger.debug("[{}] Job {} is already being reported", job.getPrinterSerial(), job.getJobId());
            return false;
        }
        String eventId = null;
        boolean delivered = false;
        try {
            eventId = sendEvent(job.getPrinterSerial(), job.getPrinterIp(),
                    completed ? PRINT_COMPLETED : PRINT_FAILED, completed ? "success" : "failed",
                    job.isLocalKey() ? null : job.getJobId(), null, statusData, message);
            delivered = true;
        } catch (IOException e) {
            logger.warn("[{}] Job event for {} not delivered, kept pending: {}", job.getPrinterSerial(), job.getJobId(), e.getMessage());
            return false;
        } finally {
            if (!delivered) {
                jobTracker.releaseReportClaim(job.getPrinterSerial(), job.getJobId());
            }
        }
        jobTracker.markAsSent(job.getPrinterSerial(), job.getJobId(), eventId);
        return true;
    }

    public boolean reportHmsError(String printerSerial, String printerIp, HmsError error) {
        if (!enabled) {
            return false;
        }
        try {
            sendEvent(printerSerial, printerIp, HMS_ERROR, "failed", null, error.toEventData(), null,
                    "HMS Error " + error.hmsCode() + ": " + error.description());
            return true;
        } catch (IOException e) {
            logger.warn("[{}] HMS event {} not delivered: {}", printerSerial, error.hmsCode(), e.getMessage());
            return false;
        }
    }

    /**
     * Report every terminal job not yet sent
     * @return number of jobs delivered
     */
    public int flushPending() {
        List<TrackedJob> pending = jobTracker.getPendingJobs();
        if (pending.isEmpty()) {
            return 0;
        }
        int sent = 0;
        for (TrackedJob job : pending) {
            if (reportJob(job)) {
                sent++;
            }
        }
        logger.info("Flushed {}/{} pending job event(s)", sent, pending.size());
        return sent;
    }

    private String sendEvent(String printerSerial, String printerIp, String eventType, String eventStatus, String printJobId,
                             Map<String, Object> errorData, Map<String, Object> statusData, String message) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recipientId", http.getConfig().recipientId());
        payload.put("printerSerial", printerSerial);
        payload.put("printerIpAddress", printerIp);
        payload.put("eventType", eventType);
        payload.put("eventStatus", eventStatus);
        if (printJobId != null) {
            payload.put("printJobId", printJobId);
        }
        if (errorData != null) {
            payload.put("errorData", errorData);
        }
        if (statusData != null) {
            payload.put("statusData", statusData);
        }
        if (message != null) {
            payload.put("message", message);
        }

        JsonObject response = http.post(EVENTS_PATH, payload);
        String eventId = CloudHttpClient.stringMember(response, "eventId", "id");
        logger.info("[{}] Event {} reported (event id {})", printerSerial, eventType, eventId);
        return eventId;
    }
}
