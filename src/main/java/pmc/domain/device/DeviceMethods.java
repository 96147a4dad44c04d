package pmc.domain.device;

import java.util.List;

/**
 * Capability variants in priority order. The first variant a driver supports and completes wins.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public final class DeviceMethods {

    private DeviceMethods() {
    }

    // Queries
    public static final List<String> STATE = List.of("get_state", "get_print_state");
    public static final List<String> PERCENTAGE = List.of("get_percentage", "get_progress");
    public static final List<String> GCODE_STATE = List.of("get_gcode_state");
    public static final List<String> RAW_STATUS = List.of("get_status", "mqtt_dump", "get_raw_state");

    // Print control
    public static final List<String> START_PRINT = List.of("start_print");
    public static final List<String> PAUSE = List.of("pause_print", "pause");
    public static final List<String> RESUME = List.of("resume_print", "resume");
    public static final List<String> STOP = List.of("stop_print", "stop");

    // Motion and temperature
    public static final List<String> HOME = List.of("home_printer", "home");
    public static final List<String> PARK = List.of("park_head", "park");
    public static final List<String> NOZZLE_TEMPERATURE = List.of("set_nozzle_temperature");
    public static final List<String> BED_TEMPERATURE = List.of("set_bed_temperature");
    public static final List<String> PRINT_SPEED = List.of("set_print_speed_factor", "set_print_speed");
    public static final List<String> FLOW = List.of("set_flow_factor");
    public static final List<String> FAN = List.of("set_fan_speed", "set_part_fan_speed");

    // Raw fallbacks
    public static final List<String> GCODE = List.of("send_gcode", "gcode");
    public static final List<String> CONTROL_MESSAGE = List.of("send_control", "send_request", "publish");
}
