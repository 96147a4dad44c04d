package pmc.domain.transfer;

import java.io.IOException;
import java.io.InputStream;

/**
 * Open file transfer session with a printer (implicit TLS file channel on real hardware).
 * I/O failures are thrown, protocol level refusals come back as replies.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 07/10/2026
 */
public interface ITransferSession extends AutoCloseable {

    TransferReply changeDirectory(String directory) throws IOException;

    TransferReply delete(String path) throws IOException;

    /**
     * Stream the data in chunks of the given size
     */
    TransferReply store(String path, InputStream data, int chunkSize) throws IOException;

    /**
     * Send a raw site-specific command, e.g. "SITE ENABLE_STOR"
     */
    TransferReply siteCommand(String command) throws IOException;

    @Override
    void close();
}
