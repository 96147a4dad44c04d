package pmc.domain.jobs;

import java.util.Locale;

/**
 * Lifecycle of a tracked print job. PRINTING moves to FINISHED or CANCELLED, never back.
 * @author Martin Sustik <sustik@herman.cz>
 * @since 09/10/2026
 */
public enum JobStatus {
    PRINTING,
    FINISHED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PRINTING;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Job status is missing");
        }
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
