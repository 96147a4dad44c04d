package pmc.domain.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.common.ECommandType;
import pmc.domain.device.ControlSequence;
import pmc.domain.device.DeviceCapabilityAdapter;
import pmc.domain.device.DeviceMethods;
import pmc.domain.device.InvocationOutcome;
import pmc.domain.errors.PrinterOperationException;
import pmc.domain.errors.UnsupportedCommandException;
import pmc.domain.status.SnapshotNormalizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps command verbs onto device capabilities
 * @author Martin Sustik <sustik@herman.cz>
 * @since 13/10/2026
 */
public class CommandExecutor {
    private static final Logger logger = LoggerFactory.getLogger(CommandExecutor.class);

    private static final Set<String> NOTHING_TO_STOP = Set.of("IDLE", "FINISH", "FAILED");
    private static final double DEFAULT_JOG_FEED = 3000;

    private final ControlSequence sequence;

    public CommandExecutor(ControlSequence sequence) {
        this.sequence = sequence;
    }

    /**
     * Execute the command on the device
     * @return human readable result message
     * @throws UnsupportedCommandException when the verb is unknown
     * @throws PrinterOperationException when parameters are invalid or the device refused every variant
     */
    public String execute(Command command, DeviceCapabilityAdapter adapter) throws PrinterOperationException {
        String serial = adapter.getDevice().getSerial();
        ECommandType type = command.type()
                .orElseThrow(() -> new UnsupportedCommandException(serial, command.commandType()));
        logger.debug("[{}] Executing {} ({})", serial, type, command.commandId());

        switch (type) {
            case HEAT:
                return heat(serial, adapter, command.metadataDouble("nozzleTemp", "nozzle"),
                        command.metadataDouble("bedTemp", "bed"));
            case COOLDOWN:
                return heat(serial, adapter, 0.0, 0.0);
            case PAUSE:
                if ("PAUSE".equals(currentGcodeState(adapter))) {
                    return "Already paused";
                }
                control(serial, adapter, DeviceMethods.PAUSE, "pause");
                return "Paused";
            case RESUME:
                if (!"PAUSE".equals(currentGcodeState(adapter))) {
                    return "Nothing to resume";
                }
                control(serial, adapter, DeviceMethods.RESUME, "resume");
                return "Resumed";
            case STOP:
                String state = currentGcodeState(adapter);
                if (state != null && NOTHING_TO_STOP.contains(state)) {
                    return "Nothing to stop";
                }
                control(serial, adapter, DeviceMethods.STOP, "stop");
                return "Stopped";
            case SET_SPEED:
                int speed = clamp(requireValue(serial, command, "setSpeed", "percent", "speed", "value"), 10, 300);
                nativeOrGcode(serial, adapter, DeviceMethods.PRINT_SPEED, speed, "M220 S" + speed);
                return "Speed set to " + speed + "%";
            case SET_FLOW:
                int flow = clamp(requireValue(serial, command, "setFlow", "percent", "flow", "value"), 50, 150);
                nativeOrGcode(serial, adapter, DeviceMethods.FLOW, flow, "M221 S" + flow);
                return "Flow set to " + flow + "%";
            case SET_FAN:
                int fan = clamp(requireValue(serial, command, "setFan", "percent", "fan", "value"), 0, 100);
                nativeOrGcode(serial, adapter, DeviceMethods.FAN, fan, "M106 S" + (fan * 255 / 100));
                return "Fan set to " + fan + "%";
            case HOME:
                if (!adapter.sendGcode("G28").succeeded()) {
                    requireSuccess(serial, "home", adapter.invokeFirst(DeviceMethods.HOME));
                }
                return "Homed";
            case JOG:
                return jog(serial, adapter, command);
            case SEND_RAW:
                String raw = command.metadataString("gcode");
                if (raw == null) {
                    raw = command.metadataString("command");
                }
                if (raw == null) {
                    throw new PrinterOperationException(serial, "sendRaw requires a gcode or command value");
                }
                gcode(serial, adapter, raw);
                return "Sent: " + raw;
            case POKE:
                Object value = adapter.query(DeviceMethods.STATE);
                return "State: " + (value == null ? "unknown" : SnapshotNormalizer.coerceString(value));
            default:
                throw new UnsupportedCommandException(serial, command.commandType());
        }
    }

    private String heat(String serial, DeviceCapabilityAdapter adapter, Double nozzle, Double bed) throws PrinterOperationException {
        if (nozzle == null && bed == null) {
            throw new PrinterOperationException(serial, "heat requires nozzleTemp or bedTemp");
        }
        StringBuilder message = new StringBuilder("Temperatures set:");
        if (nozzle != null) {
            int target = (int) Math.round(nozzle);
            InvocationOutcome outcome = adapter.invokeFirst(DeviceMethods.NOZZLE_TEMPERATURE, target);
            if (!outcome.succeeded()) {
                gcode(serial, adapter, "M104 S" + target);
            }
            message.append(" nozzle=").append(target);
        }
        if (bed != null) {
            int target = (int) Math.round(bed);
            InvocationOutcome outcome = adapter.invokeFirst(DeviceMethods.BED_TEMPERATURE, target);
            if (!outcome.succeeded()) {
                gcode(serial, adapter, "M140 S" + target);
            }
            message.append(" bed=").append(target);
        }
        return message.toString();
    }

    private String jog(String serial, DeviceCapabilityAdapter adapter, Command command) throws PrinterOperationException {
        StringBuilder move = new StringBuilder("G1");
        boolean any = false;
        for (String axis : List.of("x", "y", "z", "e")) {
            Double delta = command.metadataDouble(axis, axis.toUpperCase(Locale.ROOT));
            if (delta != null && delta != 0.0) {
                move.append(' ').append(axis.toUpperCase(Locale.ROOT)).append(formatNumber(delta));
                any = true;
            }
        }
        if (!any) {
            throw new PrinterOperationException(serial, "jog requires at least one of x, y, z, e");
        }
        Double feed = command.metadataDouble("feedrate", "feed", "f", "F");
        move.append(" F").append(formatNumber(feed == null ? DEFAULT_JOG_FEED : feed));

        gcode(serial, adapter, "G91");
        try {
            gcode(serial, adapter, move.toString());
        } finally {
            adapter.sendGcode("G90");
        }
        return "Jogged: " + move;
    }

    /**
     * Native verb first, then the control channel message
     */
    private void control(String serial, DeviceCapabilityAdapter adapter, List<String> methods, String verb)
            throws PrinterOperationException {
        InvocationOutcome outcome = adapter.invokeFirst(methods);
        if (outcome.succeeded()) {
            return;
        }
        Map<String, Object> print = new LinkedHashMap<>();
        print.put("sequence_id", sequence.next());
        print.put("command", verb);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("print", print);
        requireSuccess(serial, verb, adapter.invokeFirst(DeviceMethods.CONTROL_MESSAGE, payload));
    }

    private void nativeOrGcode(String serial, DeviceCapabilityAdapter adapter, List<String> methods, int value, String line)
            throws PrinterOperationException {
        if (!adapter.invokeFirst(methods, value).succeeded()) {
            gcode(serial, adapter, line);
        }
    }

    private void gcode(String serial, DeviceCapabilityAdapter adapter, String line) throws PrinterOperationException {
        requireSuccess(serial, "gcode '" + line + "'", adapter.sendGcode(line));
    }

    private static void requireSuccess(String serial, String action, InvocationOutcome outcome) throws PrinterOperationException {
        if (!outcome.succeeded()) {
            throw new PrinterOperationException(serial, action + " failed: "
                    + (outcome.lastError() == null ? "no supported method" : outcome.lastError()));
        }
    }

    private static double requireValue(String serial, Command command, String verb, String... keys) throws PrinterOperationException {
        Double value = command.metadataDouble(keys);
        if (value == null) {
            throw new PrinterOperationException(serial, verb + " requires one of " + String.join(", ", keys));
        }
        return value;
    }

    private static String currentGcodeState(DeviceCapabilityAdapter adapter) {
        Object value = adapter.query(DeviceMethods.GCODE_STATE);
        if (value == null) {
            value = adapter.query(DeviceMethods.STATE);
        }
        String state = SnapshotNormalizer.coerceString(value);
        return state == null ? null : state.trim().toUpperCase(Locale.ROOT);
    }

    static int clamp(double value, int min, int max) {
        return (int) Math.max(min, Math.min(max, Math.round(value)));
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
