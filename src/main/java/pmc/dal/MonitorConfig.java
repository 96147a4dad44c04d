package pmc.dal;

/**
 * Telemetry, completion and print start tuning
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public record MonitorConfig(
        double statusPollSec,
        double heartbeatSec,
        double reconnectDelaySec,
        int stallHeartbeats,
        double numericEpsilon,
        int completionDebounce,
        int startAckTimeoutSec,
        int startAckPollSec) {

    public long statusPollMs() {
        return Math.round(statusPollSec * 1000);
    }

    public long heartbeatMs() {
        return Math.round(heartbeatSec * 1000);
    }

    public long reconnectDelayMs() {
        return Math.round(reconnectDelaySec * 1000);
    }

    public void validate() throws ConfigurationException {
        if (stallHeartbeats < 1) {
            throw new ConfigurationException("status.stall.heartbeats", "Stall heartbeat count must be at least 1");
        }
        if (numericEpsilon < 0) {
            throw new ConfigurationException("status.numeric.epsilon", "Numeric epsilon cannot be negative");
        }
        if (completionDebounce < 1) {
            throw new ConfigurationException("completion.debounce.count", "Completion debounce must be at least 1");
        }
        if (startAckTimeoutSec < 1 || startAckPollSec < 1) {
            throw new ConfigurationException("start.ack.timeout.sec", "Start acknowledgement timing must be positive");
        }
    }
}
