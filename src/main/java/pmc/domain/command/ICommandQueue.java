package pmc.domain.command;

import java.io.IOException;
import java.util.List;

/**
 * Remote command queue of the cloud control plane
 * @author Martin Sustik <sustik@herman.cz>
 * @since 13/10/2026
 */
public interface ICommandQueue {

    /**
     * Pending commands, optionally narrowed to one printer (null arguments are omitted)
     */
    List<Command> fetchCommands(String printerSerial, String printerIpAddress) throws IOException;

    void acknowledge(String printerSerial, String commandId, String status, String message, String errorMessage) throws IOException;

    void reportResult(CommandOutcome outcome) throws IOException;
}
