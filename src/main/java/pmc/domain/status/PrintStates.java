package pmc.domain.status;

import java.util.Locale;
import java.util.Set;

/**
 * State vocabularies shared by completion detection, job tracking and stall detection
 * @author Martin Sustik <sustik@herman.cz>
 * @since 08/10/2026
 */
public final class PrintStates {

    public static final Set<String> COMPLETION = Set.of("finish", "finished", "completed", "complete");
    public static final Set<String> FAILED = Set.of("failed", "cancelled", "canceled", "stopped", "aborted", "error");
    public static final Set<String> PRINTING = Set.of("running", "printing", "prepare", "preheating", "slicing");
    public static final Set<String> JOB_ACTIVE = Set.of("printing", "running", "prepare", "preheating");

    private PrintStates() {
    }

    public static String normalize(String state) {
        return state == null ? "" : state.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isCompletion(String state) {
        return COMPLETION.contains(normalize(state));
    }

    public static boolean isFailed(String state) {
        return FAILED.contains(normalize(state));
    }

    public static boolean isPrinting(String state) {
        return PRINTING.contains(normalize(state));
    }

    public static boolean isJobActive(String state) {
        return JOB_ACTIVE.contains(normalize(state));
    }

    /**
     * Completion or failure vocabulary
     */
    public static boolean isTerminal(String state) {
        return isCompletion(state) || isFailed(state);
    }
}
