package pmc.domain.errors;

/**
 * Command type unknown to the worker, reported as failed without retry
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public class UnsupportedCommandException extends PrinterOperationException {
    private final String commandType;

    public UnsupportedCommandException(String printerSerial, String commandType) {
        super(printerSerial, "Unsupported command type: " + commandType);
        this.commandType = commandType;
    }

    public String getCommandType() {
        return commandType;
    }
}
