package pmc.domain.hms;

import java.util.Locale;

/**
 * Severity of a printer health management (HMS) error
 * @author Martin Sustik <sustik@herman.cz>
 * @since 12/10/2026
 */
public enum HmsSeverity {
    CRITICAL,
    ERROR,
    WARNING,
    UNKNOWN;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
