package pmc.domain.errors;

import pmc.common.EConnectionType;

/**
 * Operation requires a connection method the printer is not configured for.
 * Never downgraded to another transport.
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public class TransportMismatchException extends PrinterOperationException {
    private final EConnectionType required;
    private final EConnectionType configured;

    public TransportMismatchException(String printerSerial, EConnectionType required, EConnectionType configured) {
        super(printerSerial, String.format("Printer %s is configured for %s but the operation requires %s",
                printerSerial, configured, required));
        this.required = required;
        this.configured = configured;
    }

    public EConnectionType getRequired() {
        return required;
    }

    public EConnectionType getConfigured() {
        return configured;
    }
}
