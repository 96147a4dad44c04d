package pmc.dal;

import java.util.List;

/**
 * File transfer settings
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public record TransferConfig(List<String> reactivateCommands, int chunkSize) {

    public TransferConfig {
        reactivateCommands = reactivateCommands == null ? List.of() : List.copyOf(reactivateCommands);
    }

    public void validate() throws ConfigurationException {
        if (chunkSize < 1024) {
            throw new ConfigurationException("transfer.chunk.size", "Transfer chunk size must be at least 1024 bytes");
        }
    }
}
