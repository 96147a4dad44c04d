package pmc.domain.errors;

/**
 * Print start rejected, or the printer exposes no way to start a print
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public class StartException extends PrinterOperationException {

    public StartException(String printerSerial, String message) {
        super(printerSerial, message);
    }

    public StartException(String printerSerial, String message, Throwable cause) {
        super(printerSerial, message, cause);
    }
}
