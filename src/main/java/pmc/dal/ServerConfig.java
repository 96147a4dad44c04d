package pmc.dal;

/**
 * Type-safe configuration for the local status endpoint and scheduler
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 05/10/2026
 */
public record ServerConfig(int port, String host, boolean enabled, int threadPoolSize, StartupMode startupMode) {

    @Override
    public String toString() {
        return String.format("ServerConfiguration{port=%d, host='%s', enabled=%s, threads=%d, startupMode=%s}",
                port, host, enabled, threadPoolSize, startupMode.name());
    }

    /**
     * Validate configuration
     */
    public void validate() throws ConfigurationException {
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("server.port", "Server port must be between 1 and 65535");
        }
        if (host == null || host.trim().isEmpty()) {
            throw new ConfigurationException("server.host", "Server host cannot be empty");
        }
        if (threadPoolSize < 2) {
            throw new ConfigurationException("server.thread.pool", "Thread pool must have at least 2 threads");
        }
        if (startupMode == null) {
            throw new ConfigurationException("server.startup.mode", "Startup mode cannot be null");
        }
    }
}
