package pmc.domain.start;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.common.PrinterConstants;
import pmc.dal.MonitorConfig;
import pmc.dal.PrinterConfig;
import pmc.domain.device.ControlSequence;
import pmc.domain.device.DeviceCapabilityAdapter;
import pmc.domain.device.DeviceMethods;
import pmc.domain.device.IDeviceHandle;
import pmc.domain.device.InvocationOutcome;
import pmc.domain.errors.ProtocolConflictException;
import pmc.domain.errors.StartException;
import pmc.domain.errors.TransportMismatchException;
import pmc.domain.status.SnapshotNormalizer;
import pmc.domain.status.StatusSnapshot;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Starts a print and waits for the printer to confirm the new job.
 *
 * <p>A reading of FINISH at 100% right after the start call is a leftover of the previous job and never
 * counts as acknowledgement. When the start is not acknowledged and the printer shows a material slot
 * conflict, the attempt is stopped and submitted once more with the material system off (natively, or over
 * the control channel when it was already off). The configured transport is never changed.</p>
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 11/10/2026
 */
public class PrintStartProtocol {
    private static final Logger logger = LoggerFactory.getLogger(PrintStartProtocol.class);

    private static final Set<String> ACK_GCODE_STATES = Set.of("HEATING", "RUNNING", "PRINTING", "PREPARE");
    private static final String[] ACK_STATE_TOKENS = {"heat", "warm", "run", "print"};
    static final String CONTROL_CHANNEL = "control_channel";

    private final long ackTimeoutMs;
    private final long ackPollMs;
    private final SnapshotNormalizer normalizer;
    private final ControlSequence sequence;

    public PrintStartProtocol(MonitorConfig config, SnapshotNormalizer normalizer, ControlSequence sequence) {
        this(config.startAckTimeoutSec() * 1000L, config.startAckPollSec() * 1000L, normalizer, sequence);
    }

    public PrintStartProtocol(long ackTimeoutMs, long ackPollMs, SnapshotNormalizer normalizer, ControlSequence sequence) {
        this.ackTimeoutMs = Math.max(0, ackTimeoutMs);
        this.ackPollMs = Math.max(1, ackPollMs);
        this.normalizer = normalizer;
        this.sequence = sequence;
    }

    public StartResult startPrint(PrinterConfig printer, IDeviceHandle device, String remoteFile, String paramPath,
                                  StartOptions options) throws StartException, TransportMismatchException {
        String serial = printer.serialNumber();
        if (options.requiredTransport() != null && options.requiredTransport() != printer.connectionType()) {
            logger.error("[{}] Start of {} rejected: requires {} transport, printer is configured for {}",
                    printer.toCredentials().describe(), remoteFile, options.requiredTransport(), printer.connectionType());
            throw new TransportMismatchException(serial, options.requiredTransport(), printer.connectionType());
        }

        String param = (paramPath == null || paramPath.isBlank()) ? options.defaultParamPath() : paramPath;
        DeviceCapabilityAdapter adapter = new DeviceCapabilityAdapter(device);

        logger.info("[{}] Starting print {} (param={}, useAms={})", serial, remoteFile, param, options.useAms());
        InvocationOutcome started = adapter.invokeFirst(DeviceMethods.START_PRINT, remoteFile, param, options.useAms());
        if (!started.succeeded()) {
            throw new StartException(serial, "Start print call failed for " + remoteFile + ": "
                    + (started.lastError() == null ? "no start verb available" : started.lastError()));
        }

        AckWatch watch = awaitAcknowledgement(adapter);
        if (watch.acknowledged) {
            logger.info("[{}] Print start acknowledged (state={}, progress={})", serial, watch.state, watch.percentage);
            return new StartResult(true, watch.state, watch.percentage, options.useAms(), false, started.method());
        }
        if (!watch.conflict) {
            logger.warn("[{}] Print start not acknowledged within {}ms (state={}, progress={})",
                    serial, ackTimeoutMs, watch.state, watch.percentage);
            return new StartResult(false, watch.state, watch.percentage, options.useAms(), false, started.method());
        }

        logger.warn("[{}] Material conflict detected after start ({}), retrying without AMS", serial, watch.hmsCode);
        InvocationOutcome stopped = adapter.invokeFirst(DeviceMethods.STOP);
        if (!stopped.succeeded()) {
            logger.warn("[{}] Could not stop stalled attempt: {}", serial, stopped.lastError());
        }

        String method;
        if (options.useAms()) {
            InvocationOutcome retried = adapter.invokeFirst(DeviceMethods.START_PRINT, remoteFile, param, false);
            if (!retried.succeeded()) {
                throw new ProtocolConflictException(serial, "Fallback start without AMS failed: " + retried.lastError(), watch.hmsCode);
            }
            method = retried.method();
        } else {
            InvocationOutcome sent = adapter.invokeFirst(DeviceMethods.CONTROL_MESSAGE, projectFilePayload(remoteFile, param));
            if (!sent.succeeded()) {
                throw new ProtocolConflictException(serial, "Fallback start over control channel failed: " + sent.lastError(), watch.hmsCode);
            }
            method = CONTROL_CHANNEL;
        }

        AckWatch retry = awaitAcknowledgement(adapter);
        if (!retry.acknowledged) {
            throw new ProtocolConflictException(serial, "Printer rejected start of " + remoteFile
                    + " after material fallback (state=" + retry.state + ")", watch.hmsCode);
        }
        logger.info("[{}] Print start acknowledged after fallback via {}", serial, method);
        return new StartResult(true, retry.state, retry.percentage, false, true, method);
    }

    /**
     * Poll until acknowledged or the timeout elapses. The first reading is taken immediately.
     */
    private AckWatch awaitAcknowledgement(DeviceCapabilityAdapter adapter) throws StartException {
        AckWatch watch = new AckWatch();
        long deadline = System.currentTimeMillis() + ackTimeoutMs;
        while (true) {
            Object state = adapter.query(DeviceMethods.STATE);
            Object pct = adapter.query(DeviceMethods.PERCENTAGE);
            Object gcode = adapter.query(DeviceMethods.GCODE_STATE);
            Object raw = adapter.query(DeviceMethods.RAW_STATUS);

            StatusSnapshot snapshot = normalizer.normalize(raw, state, pct, gcode, System.currentTimeMillis());
            watch.state = snapshot.state();
            watch.percentage = snapshot.progressPercent();

            if (isAcknowledged(snapshot)) {
                watch.acknowledged = true;
                return watch;
            }
            if (PrinterConstants.AMS_CONFLICT_HMS_CODE.equals(snapshot.hmsErrorCode()) || normalizer.looksLikeAmsConflict(raw)) {
                watch.conflict = true;
                watch.hmsCode = snapshot.hmsErrorCode() != null ? snapshot.hmsErrorCode() : PrinterConstants.AMS_CONFLICT_HMS_CODE;
                return watch;
            }

            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return watch;
            }
            try {
                Thread.sleep(Math.min(ackPollMs, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StartException(adapter.getDevice().getSerial(), "Interrupted while waiting for print start");
            }
        }
    }

    /**
     * Whether a reading shows the new job running. FINISH at 100% is stale and never acknowledges.
     */
    static boolean isAcknowledged(StatusSnapshot snapshot) {
        String state = snapshot.state() == null ? "" : snapshot.state().toLowerCase(Locale.ROOT);
        String gcode = snapshot.gcodeState() == null ? "" : snapshot.gcodeState().toUpperCase(Locale.ROOT);
        Double pct = snapshot.progressPercent();

        boolean finished = "finish".equals(state) || "FINISH".equals(gcode);
        if (finished && pct != null && pct >= 100.0) {
            return false;
        }
        for (String token : ACK_STATE_TOKENS) {
            if (state.contains(token)) {
                return true;
            }
        }
        if (ACK_GCODE_STATES.contains(gcode)) {
            return true;
        }
        return pct != null && pct > 0.0 && !finished;
    }

    Map<String, Object> projectFilePayload(String remoteFile, String param) {
        String name = remoteFile.startsWith("sdcard/") ? remoteFile.substring("sdcard/".length()) : remoteFile;
        Map<String, Object> print = new LinkedHashMap<>();
        print.put("sequence_id", sequence.next());
        print.put("command", "project_file");
        print.put("param", param);
        print.put("url", "file:///sdcard/" + name);
        print.put("subtask_name", name);
        print.put("use_ams", false);
        print.put("timelapse", false);
        print.put("bed_leveling", true);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("print", print);
        return payload;
    }

    private static final class AckWatch {
        boolean acknowledged;
        boolean conflict;
        String hmsCode;
        String state;
        Double percentage;
    }
}
