package pmc.domain.transfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.common.PrinterConstants;
import pmc.dal.TransferConfig;
import pmc.domain.device.IDeviceHandle;
import pmc.domain.device.PrinterCredentials;
import pmc.domain.errors.TransferException;
import pmc.domain.errors.TransportException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Resilient file upload to a printer.
 *
 * <p>Connect, change into the SD card directory (or fall back to a path prefix), remove a stale
 * file of the same name, stream the file. A permission/state refusal of the store is answered
 * with the configured reactivation commands and exactly one more store attempt. Some printers
 * keep their transfer subsystem latched after an aborted transfer until reactivated.</p>
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 07/10/2026
 */
public class UploadProtocol {
    private static final Logger logger = LoggerFactory.getLogger(UploadProtocol.class);

    static final String PRIMARY_DIRECTORY = "/sdcard";
    static final String SECONDARY_DIRECTORY = "sdcard";
    static final String FALLBACK_PREFIX = "sdcard/";

    private final TransferConfig transferConfig;
    private final int connectTimeoutSeconds;

    public UploadProtocol(TransferConfig transferConfig, int connectTimeoutSeconds) {
        this.transferConfig = transferConfig;
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    /**
     * Upload and return the remote file name
     */
    public String upload(PrinterCredentials credentials, IDeviceHandle device, Path localFile, String remoteName)
            throws TransferException {
        return uploadWithDetails(credentials, device, localFile, remoteName).remoteFileName();
    }

    public UploadSession uploadWithDetails(PrinterCredentials credentials, IDeviceHandle device, Path localFile, String remoteName)
            throws TransferException {
        String serial = credentials.serialNumber();
        if (localFile == null || !Files.isReadable(localFile)) {
            throw new TransferException(serial, "Local file is not readable: " + localFile, (String) null);
        }
        String fileName = RemoteFileNames.sanitize(remoteName);

        ITransferSession session;
        try {
            session = device.openTransferSession(connectTimeoutSeconds);
        } catch (TransportException e) {
            throw new TransferException(serial, credentials.maskSecrets(
                    "Transfer channel unavailable on " + credentials.describe() + ": " + e.getMessage()), e);
        }

        try (session) {
            String prefix = resolveTargetPrefix(session, credentials);
            String remotePath = prefix + fileName;

            removeStaleFile(session, credentials, remotePath);

            TransferReply reply = store(session, credentials, localFile, remotePath);
            if (reply.is(PrinterConstants.TRANSFER_OK_CODE)) {
                logger.info("[{}] Uploaded {} as {}", credentials.describe(), localFile.getFileName(), remotePath);
                return new UploadSession(fileName, remotePath, 1, false, reply);
            }

            if (!reply.isPermissionOrStateError()) {
                throw new TransferException(serial,
                        "Transfer of " + fileName + " rejected by " + credentials.describe() + ": " + reply, reply.code());
            }

            logger.warn("[{}] Store of {} refused ({}), reactivating transfer channel and retrying once",
                    credentials.describe(), remotePath, reply);
            boolean reactivated = reactivate(session, credentials);

            TransferReply retry = store(session, credentials, localFile, remotePath);
            if (retry.is(PrinterConstants.TRANSFER_OK_CODE)) {
                logger.info("[{}] Uploaded {} as {} after reactivation", credentials.describe(), localFile.getFileName(), remotePath);
                return new UploadSession(fileName, remotePath, 2, reactivated, retry);
            }
            throw new TransferException(serial,
                    "Transfer of " + fileName + " rejected twice by " + credentials.describe() + ": " + retry, retry.code());
        }
    }

    /**
     * Directory change: /sdcard, then sdcard, else store with a "sdcard/" prefix
     */
    private String resolveTargetPrefix(ITransferSession session, PrinterCredentials credentials) {
        for (String directory : List.of(PRIMARY_DIRECTORY, SECONDARY_DIRECTORY)) {
            try {
                if (session.changeDirectory(directory).isPositive()) {
                    return "";
                }
            } catch (IOException e) {
                logger.debug("[{}] cwd {} failed: {}", credentials.serialNumber(), directory, e.getMessage());
            }
        }
        logger.debug("[{}] Using path prefix {}", credentials.serialNumber(), FALLBACK_PREFIX);
        return FALLBACK_PREFIX;
    }

    private void removeStaleFile(ITransferSession session, PrinterCredentials credentials, String remotePath)
            throws TransferException {
        TransferReply reply;
        try {
            reply = session.delete(remotePath);
        } catch (IOException e) {
            throw new TransferException(credentials.serialNumber(),
                    credentials.maskSecrets("Removing stale " + remotePath + " failed: " + e.getMessage()), e);
        }
        if (reply.isPositive() || reply.isNotFound()) {
            return;
        }
        throw new TransferException(credentials.serialNumber(),
                "Removing stale " + remotePath + " refused: " + reply, reply.code());
    }

    private TransferReply store(ITransferSession session, PrinterCredentials credentials, Path localFile, String remotePath)
            throws TransferException {
        try (InputStream input = Files.newInputStream(localFile)) {
            return session.store(remotePath, input, transferConfig.chunkSize());
        } catch (IOException e) {
            throw new TransferException(credentials.serialNumber(),
                    credentials.maskSecrets("Transfer of " + remotePath + " failed: " + e.getMessage()), e);
        }
    }

    /**
     * Send the configured commands, SITE-prefixed when needed. Individual refusals are ignored.
     * @return true when at least one command was sent
     */
    private boolean reactivate(ITransferSession session, PrinterCredentials credentials) {
        boolean sent = false;
        for (String command : transferConfig.reactivateCommands()) {
            String full = command.toUpperCase(Locale.ROOT).startsWith("SITE ") ? command : "SITE " + command;
            try {
                TransferReply reply = session.siteCommand(full);
                logger.debug("[{}] {} -> {}", credentials.serialNumber(), full, reply);
                sent = true;
            } catch (IOException e) {
                logger.warn("[{}] Reactivation command {} failed: {}", credentials.serialNumber(), full, e.getMessage());
            }
        }
        return sent;
    }
}
