package pmc.domain.errors;

/**
 * File upload rejected by the printer (after the reactivation retry) or local file unreadable
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public class TransferException extends PrinterOperationException {
    private final String replyCode;

    public TransferException(String printerSerial, String message, String replyCode) {
        super(printerSerial, message);
        this.replyCode = replyCode;
    }

    public TransferException(String printerSerial, String message, Throwable cause) {
        super(printerSerial, message, cause);
        this.replyCode = null;
    }

    /**
     * Last reply code of the transfer channel, null if the failure happened before any reply
     */
    public String getReplyCode() {
        return replyCode;
    }
}
