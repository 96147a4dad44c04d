package pmc.domain.errors;

/**
 * Printer keeps refusing the start because of material system (AMS slot / filament) state,
 * even after the forced fallback attempt
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public class ProtocolConflictException extends StartException {
    private final String hmsCode;

    public ProtocolConflictException(String printerSerial, String message, String hmsCode) {
        super(printerSerial, message);
        this.hmsCode = hmsCode;
    }

    public String getHmsCode() {
        return hmsCode;
    }
}
