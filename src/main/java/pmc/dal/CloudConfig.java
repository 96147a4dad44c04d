package pmc.dal;

/**
 * Type-safe configuration for the cloud control plane
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 05/10/2026
 */
public record CloudConfig(
        boolean enabled,
        String baseUrl,
        String recipientId,
        String apiKey,
        int controlPollSec,
        int connectTimeoutSec,
        int heartbeatIntervalSec,
        int statusReportIntervalSec) {

    /**
     * Base URL without trailing slash
     */
    public String normalizedBaseUrl() {
        String url = baseUrl == null ? "" : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    @Override
    public String toString() {
        return String.format("CloudConfiguration{enabled=%s, baseUrl='%s', recipientId='%s', apiKey=%s, poll=%ds, connectTimeout=%ds, heartbeat=%ds, statusReport=%ds}",
                enabled, baseUrl, recipientId, (apiKey == null || apiKey.isEmpty()) ? "<none>" : "***",
                controlPollSec, connectTimeoutSec, heartbeatIntervalSec, statusReportIntervalSec);
    }

    public void validate() throws ConfigurationException {
        if (!enabled) {
            return;
        }
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            throw ConfigurationException.missing("cloud.base.url");
        }
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            throw new ConfigurationException("cloud.base.url", "Cloud base URL must start with http:// or https://");
        }
        if (recipientId == null || recipientId.trim().isEmpty()) {
            throw ConfigurationException.missing("cloud.recipient.id");
        }
        if (connectTimeoutSec < 1) {
            throw new ConfigurationException("connect.timeout.seconds", "Connect timeout must be at least 1 second");
        }
    }
}
