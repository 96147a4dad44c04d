package pmc.domain.cloud;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.domain.status.StatusSnapshot;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Sends printer status to the cloud, at most once per report interval unless the state changes
 * @author Martin Sustik <sustik@herman.cz>
 * @since 15/10/2026
 */
public class StatusReporter {
    private static final Logger logger = LoggerFactory.getLogger(StatusReporter.class);

    static final String STATUS_PATH = "/api/printer-status/update";

    private final CloudHttpClient http;
    private final long intervalMs;
    private final LongSupplier clock;
    private final Map<String, LastReport> lastReports = new ConcurrentHashMap<>();

    public StatusReporter(CloudHttpClient http) {
        this(http, System::currentTimeMillis);
    }

    StatusReporter(CloudHttpClient http, LongSupplier clock) {
        this.http = http;
        this.intervalMs = http.getConfig().statusReportIntervalSec() * 1000L;
        this.clock = clock;
    }

    /**
     * Report when the state changed or the interval elapsed
     * @return true when a report was sent
     */
    public boolean maybeReport(String printerSerial, String printerIp, StatusSnapshot snapshot) {
        if (!http.getConfig().enabled()) {
            return false;
        }
        long now = clock.getAsLong();
        LastReport last = lastReports.get(printerSerial);
        boolean stateChanged = last == null || !Objects.equals(last.state, snapshot.state())
                || !Objects.equals(last.gcodeState, snapshot.gcodeState());
        if (!stateChanged && now - last.sentAt < intervalMs) {
            return false;
        }

        try {
            http.post(STATUS_PATH, toPayload(printerSerial, printerIp, snapshot));
        } catch (IOException e) {
            logger.warn("[{} @ {}] Status update failed: {}", printerSerial, printerIp, e.getMessage());
            return false;
        }
        lastReports.put(printerSerial, new LastReport(snapshot.state(), snapshot.gcodeState(), now));
        logger.info("Status update: {} | {} | {}", printerIp, snapshot.state(),
                snapshot.progressPercent() == null ? "-" : snapshot.progressPercent() + "%");
        return true;
    }

    Map<String, Object> toPayload(String printerSerial, String printerIp, StatusSnapshot snapshot) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recipientId", http.getConfig().recipientId());
        payload.put("printerSerial", printerSerial);
        payload.put("printerIpAddress", printerIp);
        payload.put("status", snapshot.state());
        payload.put("state", snapshot.state());
        if (snapshot.gcodeState() != null) {
            payload.put("gcodeState", snapshot.gcodeState());
        }
        if (snapshot.progressPercent() != null) {
            payload.put("progressPercent", Math.max(0.0, Math.min(100.0, snapshot.progressPercent())));
        }
        payload.put("nozzleTemp", snapshot.nozzleTemp() == null ? 0.0 : snapshot.nozzleTemp());
        payload.put("bedTemp", snapshot.bedTemp() == null ? 0.0 : snapshot.bedTemp());
        if (snapshot.remainingTimeSeconds() != null) {
            payload.put("remainingTimeSeconds", snapshot.remainingTimeSeconds());
        }
        if (snapshot.currentJobId() != null) {
            payload.put("currentJobId", snapshot.currentJobId());
        }
        if (snapshot.fileName() != null) {
            payload.put("fileName", snapshot.fileName());
        }
        if (snapshot.hmsErrorCode() != null) {
            payload.put("hmsErrorCode", snapshot.hmsErrorCode());
        }
        if (snapshot.errorMessage() != null) {
            payload.put("errorMessage", snapshot.errorMessage());
        }
        return payload;
    }

    private static final class LastReport {
        final String state;
        final String gcodeState;
        final long sentAt;

        LastReport(String state, String gcodeState, long sentAt) {
            this.state = state;
            this.gcodeState = gcodeState;
            this.sentAt = sentAt;
        }
    }
}
