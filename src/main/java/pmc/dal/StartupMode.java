package pmc.dal;

/**
 * Defines how strictly the client enforces printer agent initialization
 * @author Martin Sustik <sustik@herman.cz>
 * @since 05/10/2026
 */
public enum StartupMode {
    /**
     * STRICT mode - every configured printer must connect
     * Use for: production farms where all printers are expected online
     */
    STRICT("All printers must initialize"),

    /**
     * LENIENT mode - at least one printer must connect, the rest keep reconnecting
     */
    LENIENT("At least one printer must initialize"),

    /**
     * PERMISSIVE mode - client always starts, printers may all be offline
     * Use for: testing against simulated printers or an empty farm
     */
    PERMISSIVE("Client starts regardless of printer status");

    private final String description;

    StartupMode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return name() + ": " + description;
    }
}
