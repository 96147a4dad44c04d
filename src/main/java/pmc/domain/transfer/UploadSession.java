package pmc.domain.transfer;

/**
 * Outcome of one file transfer
 * @param remoteFileName name the file was stored under
 * @param remotePath full path used in the store command
 * @param attempts number of store attempts (1 or 2)
 * @param reactivated whether the reactivation commands were sent
 * @param finalReply last reply of the channel
 */
public record UploadSession(String remoteFileName, String remotePath, int attempts, boolean reactivated, TransferReply finalReply) {
}
