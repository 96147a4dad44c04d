package pmc.common;

import java.util.Locale;
import java.util.Optional;

/**
 * How the client talks to a printer
 * @author Martin Sustik <sustik@herman.cz>
 * @since 05/10/2026
 */
public enum EConnectionType {
    LAN,      // Direct local network access (control channel + secure file transfer)
    CLOUD,    // Vendor cloud connect flow
    NONE;     // Simulated printer (no physical hardware)

    /**
     * Resolve a transport name as used in configuration, commands and print requests.
     * Accepts the constant names plus "local", "bambu_connect" / "bambuConnect" / "connect" and "simulated".
     */
    public static Optional<EConnectionType> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        switch (normalized) {
            case "lan":
            case "local":
                return Optional.of(LAN);
            case "cloud":
            case "bambuconnect":
            case "connect":
                return Optional.of(CLOUD);
            case "none":
            case "simulated":
                return Optional.of(NONE);
            default:
                return Optional.empty();
        }
    }
}
