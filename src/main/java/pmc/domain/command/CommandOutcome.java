package pmc.domain.command;

import java.util.Locale;
import java.util.Set;

/**
 * Result of executing one command, as sent back to the cloud
 * @param commandId command id
 * @param status completed or failed
 * @param message human readable result, may be null
 * @param errorMessage failure description, null on success
 */
public record CommandOutcome(String commandId, String status, String message, String errorMessage) {

    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
    public static final String PROCESSING = "processing";

    private static final Set<String> SUCCESS_ALIASES = Set.of("success", "ok", "done", "completed", "complete");
    private static final Set<String> FAILURE_ALIASES = Set.of("failed", "error", "errored", "ko", "failure");

    public static CommandOutcome completed(String commandId, String message) {
        return new CommandOutcome(commandId, COMPLETED, message, null);
    }

    public static CommandOutcome failed(String commandId, String errorMessage) {
        return new CommandOutcome(commandId, FAILED, null, errorMessage);
    }

    public boolean isSuccess() {
        return COMPLETED.equals(status);
    }

    /**
     * Map status aliases onto completed / failed. Unknown values pass through lower-cased.
     */
    public static String normalizeStatus(String status) {
        if (status == null) {
            return FAILED;
        }
        String value = status.trim().toLowerCase(Locale.ROOT);
        if (SUCCESS_ALIASES.contains(value)) {
            return COMPLETED;
        }
        if (FAILURE_ALIASES.contains(value)) {
            return FAILED;
        }
        return value;
    }
}
