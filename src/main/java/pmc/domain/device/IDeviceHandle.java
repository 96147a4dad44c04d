package pmc.domain.device;

import pmc.domain.errors.TransportException;
import pmc.domain.transfer.ITransferSession;

/**
 * Capability surface of a connected printer driver.
 * Vendor and firmware builds expose different subsets of verbs, so every verb is addressed by name.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public interface IDeviceHandle {

    String getSerial();

    /**
     * Open the control session, bounded by the timeout
     */
    void connect(int timeoutSeconds) throws TransportException;

    void disconnect();

    boolean isConnected();

    /**
     * Whether this driver build exposes the named verb at all
     */
    boolean supports(String method);

    /**
     * Invoke a named verb
     * @throws UnsupportedOperationException when the verb is not exposed by this driver
     * @throws Exception any driver failure
     */
    Object invoke(String method, Object... args) throws Exception;

    /**
     * Open the secure file transfer channel of the printer
     */
    ITransferSession openTransferSession(int timeoutSeconds) throws TransportException;
}
