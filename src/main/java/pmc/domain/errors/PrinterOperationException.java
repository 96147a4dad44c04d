package pmc.domain.errors;

/**
 * Base class for failures while driving a printer
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public class PrinterOperationException extends Exception {
    private final String printerSerial;

    public PrinterOperationException(String printerSerial, String message) {
        super(message);
        this.printerSerial = printerSerial;
    }

    public PrinterOperationException(String printerSerial, String message, Throwable cause) {
        super(message, cause);
        this.printerSerial = printerSerial;
    }

    public String getPrinterSerial() {
        return printerSerial;
    }
}
