package pmc.common;

/**
 * Default values and protocol constants
 * @author Martin Sustik <sustik@herman.cz>
 * @since 05/10/2026
 */
public final class PrinterConstants {

    private PrinterConstants() {
    }

    // Command polling
    public static final int DEFAULT_CONTROL_POLL_SEC = 15;
    public static final int MIN_CONTROL_POLL_SEC = 3;
    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 30;
    public static final int ROUTER_ERROR_LOG_EVERY = 50;

    // Status subscriber
    public static final double DEFAULT_STATUS_POLL_SEC = 1.0;
    public static final double MIN_STATUS_POLL_SEC = 0.5;
    public static final double DEFAULT_HEARTBEAT_SEC = 5.0;
    public static final double MIN_HEARTBEAT_SEC = 1.0;
    public static final double DEFAULT_RECONNECT_DELAY_SEC = 3.0;
    public static final int DEFAULT_STALL_HEARTBEATS = 3;
    public static final double DEFAULT_NUMERIC_EPSILON = 0.05;

    // Completion
    public static final int DEFAULT_COMPLETION_DEBOUNCE = 1;

    // Print start
    public static final int DEFAULT_START_ACK_TIMEOUT_SEC = 60;
    public static final int DEFAULT_START_ACK_POLL_SEC = 2;

    // File transfer
    public static final int DEFAULT_TRANSFER_CHUNK_SIZE = 64 * 1024;
    public static final String DEFAULT_REACTIVATE_COMMANDS = "ENABLE_STOR";
    public static final int REMOTE_NAME_MAX_LENGTH = 60;
    public static final String TRANSFER_OK_CODE = "226";

    // Cloud
    public static final int DEFAULT_HEARTBEAT_INTERVAL_SEC = 20;
    public static final int MIN_HEARTBEAT_INTERVAL_SEC = 10;
    public static final int MAX_HEARTBEAT_BACKOFF_SEC = 60;
    public static final int DEFAULT_STATUS_REPORT_INTERVAL_SEC = 300;
    public static final String CLIENT_VERSION = "1.0.0";

    // Control payload sequence ids roll over after this value
    public static final int MAX_SEQUENCE_ID = 9999;

    // Synthesized HMS code for AMS filament conflicts
    public static final String AMS_CONFLICT_HMS_CODE = "HMS_07FF-2000-0002-0004";
    public static final String AMS_CONFLICT_MESSAGE = "Possible AMS filament conflict";
}
