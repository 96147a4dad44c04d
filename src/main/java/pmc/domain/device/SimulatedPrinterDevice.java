package pmc.domain.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.domain.errors.TransportException;
import pmc.domain.transfer.ITransferSession;
import pmc.domain.transfer.TransferReply;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process printer used for connection type NONE.
 * Progress advances by a fixed step on every state read while printing; at 100% the job finishes.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 07/10/2026
 */
public class SimulatedPrinterDevice implements IDeviceHandle {
    private static final Logger logger = LoggerFactory.getLogger(SimulatedPrinterDevice.class);

    private static final Set<String> SUPPORTED = Set.of(
            "get_state", "get_percentage", "get_gcode_state", "get_status",
            "start_print", "pause_print", "resume_print", "stop_print",
            "send_gcode", "send_control",
            "set_nozzle_temperature", "set_bed_temperature", "set_print_speed_factor");

    private final String serial;
    private final double progressStep;
    private final Map<String, byte[]> storedFiles = new ConcurrentHashMap<>();

    private volatile boolean connected = false;
    private String gcodeState = "IDLE";
    private double progress = 0.0;
    private double nozzleTemp = 25.0;
    private double bedTemp = 25.0;
    private int speedFactor = 100;
    private String currentFile;
    private int jobCounter = 0;

    public SimulatedPrinterDevice(String serial) {
        this(serial, 2.0);
    }

    public SimulatedPrinterDevice(String serial, double progressStep) {
        this.serial = serial;
        this.progressStep = progressStep;
    }

    @Override
    public String getSerial() {
        return serial;
    }

    @Override
    public void connect(int timeoutSeconds) throws TransportException {
        connected = true;
        logger.debug("Simulated printer {} connected", serial);
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public boolean supports(String method) {
        return SUPPORTED.contains(method);
    }

    @Override
    public synchronized Object invoke(String method, Object... args) throws Exception {
        if (!connected) {
            throw new IllegalStateException("Simulated printer " + serial + " is not connected");
        }
        switch (method) {
            case "get_state":
                advance();
                return gcodeState;
            case "get_percentage":
                return progress;
            case "get_gcode_state":
                return gcodeState;
            case "get_status":
                return rawStatus();
            case "start_print":
                return startPrint(String.valueOf(args[0]));
            case "pause_print":
                if ("RUNNING".equals(gcodeState)) {
                    gcodeState = "PAUSE";
                }
                return true;
            case "resume_print":
                if ("PAUSE".equals(gcodeState)) {
                    gcodeState = "RUNNING";
                }
                return true;
            case "stop_print":
                if ("RUNNING".equals(gcodeState) || "PAUSE".equals(gcodeState) || "FINISH".equals(gcodeState)) {
                    gcodeState = "IDLE";
                    progress = 0.0;
                }
                return true;
            case "send_gcode":
                return applyGcode(String.valueOf(args[0]));
            case "send_control":
                return true;
            case "set_nozzle_temperature":
                nozzleTemp = ((Number) args[0]).doubleValue();
                return true;
            case "set_bed_temperature":
                bedTemp = ((Number) args[0]).doubleValue();
                return true;
            case "set_print_speed_factor":
                speedFactor = ((Number) args[0]).intValue();
                return true;
            default:
                throw new UnsupportedOperationException(method);
        }
    }

    private boolean startPrint(String fileName) {
        String bare = fileName.startsWith("sdcard/") ? fileName.substring("sdcard/".length()) : fileName;
        if (!storedFiles.containsKey(bare)) {
            throw new IllegalStateException("File not found on simulated SD card: " + fileName);
        }
        jobCounter++;
        currentFile = bare;
        progress = 0.0;
        gcodeState = "RUNNING";
        return true;
    }

    private boolean applyGcode(String gcode) {
        String line = gcode.trim().toUpperCase();
        if (line.startsWith("M104 S")) {
            nozzleTemp = Double.parseDouble(line.substring(6).trim());
        } else if (line.startsWith("M140 S")) {
            bedTemp = Double.parseDouble(line.substring(6).trim());
        }
        return true;
    }

    private void advance() {
        if ("RUNNING".equals(gcodeState)) {
            progress = Math.min(100.0, progress + progressStep);
            if (progress >= 100.0) {
                gcodeState = "FINISH";
            }
        }
    }

    private Map<String, Object> rawStatus() {
        Map<String, Object> print = new LinkedHashMap<>();
        print.put("gcode_state", gcodeState);
        print.put("mc_percent", progress);
        print.put("mc_remaining_time", (int) Math.round((100.0 - progress) / Math.max(progressStep, 0.1)));
        print.put("nozzle_temper", nozzleTemp);
        print.put("bed_temper", bedTemp);
        print.put("spd_mag", speedFactor);
        if (currentFile != null) {
            print.put("subtask_name", currentFile);
            print.put("task_id", "SIM-" + serial + "-" + jobCounter);
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("print", print);
        return root;
    }

    @Override
    public ITransferSession openTransferSession(int timeoutSeconds) throws TransportException {
        if (!connected) {
            throw new TransportException(serial, "Simulated printer " + serial + " is not connected");
        }
        return new SimulatedTransferSession();
    }

    /**
     * Files stored on the simulated SD card
     */
    public Set<String> getStoredFiles() {
        return Set.copyOf(storedFiles.keySet());
    }

    private class SimulatedTransferSession implements ITransferSession {

        @Override
        public TransferReply changeDirectory(String directory) {
            return "/sdcard".equals(directory)
                    ? TransferReply.of("250", "CWD command successful")
                    : TransferReply.of("550", "No such directory");
        }

        @Override
        public TransferReply delete(String path) {
            return storedFiles.remove(stripPrefix(path)) != null
                    ? TransferReply.of("250", "DELE command successful")
                    : TransferReply.of("550", "File not found");
        }

        @Override
        public TransferReply store(String path, InputStream data, int chunkSize) throws IOException {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            byte[] chunk = new byte[chunkSize];
            int read;
            while ((read = data.read(chunk)) != -1) {
                buffer.write(chunk, 0, read);
            }
            storedFiles.put(stripPrefix(path), buffer.toByteArray());
            return TransferReply.of("226", "Transfer complete");
        }

        @Override
        public TransferReply siteCommand(String command) {
            return TransferReply.of("200", "OK");
        }

        @Override
        public void close() {
            // nothing to release
        }

        private String stripPrefix(String path) {
            return path.startsWith("sdcard/") ? path.substring("sdcard/".length()) : path;
        }
    }
}
