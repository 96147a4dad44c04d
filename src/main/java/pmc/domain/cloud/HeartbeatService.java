package pmc.domain.cloud;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.common.PrinterConstants;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic liveness signal to the cloud. Consecutive failures double the delay up to 60s;
 * every successful heartbeat flushes pending job events.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 15/10/2026
 */
public class HeartbeatService {
    private static final Logger logger = LoggerFactory.getLogger(HeartbeatService.class);

    static final String HEARTBEAT_PATH = "/api/heartbeat";

    private final CloudHttpClient http;
    private final EventReporter eventReporter;
    private final int intervalSec;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> nextBeat;
    private volatile boolean running;
    private int consecutiveFailures;

    public HeartbeatService(CloudHttpClient http, EventReporter eventReporter) {
        this.http = http;
        this.eventReporter = eventReporter;
        this.intervalSec = Math.max(PrinterConstants.MIN_HEARTBEAT_INTERVAL_SEC, http.getConfig().heartbeatIntervalSec());
    }

    public synchronized void start(ScheduledExecutorService executorService) {
        if (running) {
            return;
        }
        running = true;
        scheduler = executorService;
        nextBeat = scheduler.schedule(this::beatAndReschedule, 0, TimeUnit.SECONDS);
        logger.info("Heartbeat started (every {}s)", intervalSec);
    }

    public synchronized void stop() {
        running = false;
        if (nextBeat != null) {
            nextBeat.cancel(false);
            nextBeat = null;
        }
    }

    public boolean isRunning() {
        return running;
    }

    private void beatAndReschedule() {
        beatOnce();
        synchronized (this) {
            if (running) {
                nextBeat = scheduler.schedule(this::beatAndReschedule, nextDelaySec(), TimeUnit.SECONDS);
            }
        }
    }

    /**
     * Send one heartbeat
     * @return true when the cloud accepted it
     */
    public boolean beatOnce() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recipientId", http.getConfig().recipientId());
        payload.put("clientVersion", PrinterConstants.CLIENT_VERSION);
        try {
            http.post(HEARTBEAT_PATH, payload);
        } catch (IOException | RuntimeException e) {
            consecutiveFailures++;
            logger.warn("Heartbeat failed ({} consecutive): {}", consecutiveFailures, e.getMessage());
            return false;
        }
        if (consecutiveFailures > 0) {
            logger.info("Heartbeat recovered after {} failure(s)", consecutiveFailures);
        }
        consecutiveFailures = 0;
        eventReporter.flushPending();
        return true;
    }

    int nextDelaySec() {
        if (consecutiveFailures == 0) {
            return intervalSec;
        }
        long delay = (long) intervalSec << Math.min(consecutiveFailures, 8);
        return (int) Math.min(Math.max(intervalSec, PrinterConstants.MAX_HEARTBEAT_BACKOFF_SEC), delay);
    }

    int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
