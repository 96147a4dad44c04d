package pmc.domain.errors;

/**
 * Printer unreachable, connect failed or a bounded call timed out.
 * Retried by the owning loop with a fixed backoff.
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public class TransportException extends PrinterOperationException {

    public TransportException(String printerSerial, String message) {
        super(printerSerial, message);
    }

    public TransportException(String printerSerial, String message, Throwable cause) {
        super(printerSerial, message, cause);
    }
}
