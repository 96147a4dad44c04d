package pmc.dal;

/**
 * Exception thrown when configuration is invalid or missing
 * @author Martin Sustik <sustik@herman.cz>
 * @since 05/10/2026
 */
public class ConfigurationException extends Exception {
    private final String key;

    public ConfigurationException(String message) {
        this(null, message);
    }

    public ConfigurationException(String key, String message) {
        super(message);
        this.key = key;
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.key = null;
    }

    public static ConfigurationException missing(String key) {
        return new ConfigurationException(key, "Required property '" + key + "' is not configured");
    }

    /**
     * Property key the problem relates to, null when not bound to a single key
     */
    public String getKey() {
        return key;
    }
}
