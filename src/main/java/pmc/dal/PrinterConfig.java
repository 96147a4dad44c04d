package pmc.dal;

import pmc.common.EConnectionType;
import pmc.domain.device.PrinterCredentials;

/**
 * Type-safe configuration for one printer
 * Supports LAN, CLOUD and simulated (NONE) connections
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 05/10/2026
 */
public record PrinterConfig(
        String serialNumber,
        String ipAddress,
        String accessCode,
        String nickname,
        EConnectionType connectionType) {

    /**
     * Factory method: Create LAN printer configuration
     */
    public static PrinterConfig lan(String serial, String ip, String accessCode, String nickname) {
        return new PrinterConfig(serial, ip, accessCode, nickname, EConnectionType.LAN);
    }

    /**
     * Factory method: Create cloud-connected printer configuration
     */
    public static PrinterConfig cloud(String serial, String ip, String accessCode, String nickname) {
        return new PrinterConfig(serial, ip, accessCode, nickname, EConnectionType.CLOUD);
    }

    /**
     * Factory method: Create simulated printer configuration
     */
    public static PrinterConfig simulated(String serial, String nickname) {
        return new PrinterConfig(serial, "127.0.0.1", "", nickname, EConnectionType.NONE);
    }

    public PrinterCredentials toCredentials() {
        return new PrinterCredentials(ipAddress, serialNumber, accessCode, nickname);
    }

    @Override
    public String toString() {
        return switch (connectionType) {
            case LAN, CLOUD -> String.format("PrinterConfiguration{type=%s, serial='%s', nickname='%s', ip='%s'}",
                    connectionType, serialNumber, nickname, ipAddress);
            case NONE -> String.format("PrinterConfiguration{type=NONE (Simulated), serial='%s', nickname='%s'}",
                    serialNumber, nickname);
        };
    }

    /**
     * Validate configuration based on connection type
     */
    public void validate() throws ConfigurationException {
        if (serialNumber == null || serialNumber.trim().isEmpty()) {
            throw new ConfigurationException("Printer serial number cannot be empty");
        }
        if (connectionType == null) {
            throw new ConfigurationException("Connection type cannot be null for printer " + serialNumber);
        }
        if (connectionType == EConnectionType.NONE) {
            return;
        }
        if (ipAddress == null || ipAddress.trim().isEmpty()) {
            throw new ConfigurationException("Printer IP address cannot be empty for " + connectionType + " printer " + serialNumber);
        }
        if (accessCode == null || accessCode.trim().isEmpty()) {
            throw new ConfigurationException("Access code cannot be empty for " + connectionType + " printer " + serialNumber);
        }
    }

    public boolean isSimulated() {
        return connectionType == EConnectionType.NONE;
    }
}
