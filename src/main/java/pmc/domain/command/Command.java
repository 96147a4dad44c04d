package pmc.domain.command;

import pmc.common.ECommandType;
import pmc.domain.status.SnapshotNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remote command pulled from the cloud queue
 * @param commandId unique id, consumed once
 * @param commandType verb as received, may be unknown to this client
 * @param metadata opaque parameters
 * @param targetSerial serial of the target printer, may be null
 * @param targetIp address of the target printer, may be null
 */
public record Command(String commandId, String commandType, Map<String, Object> metadata, String targetSerial, String targetIp) {

    private static final List<String> SERIAL_KEYS = List.of("printerSerial", "serial", "printerId");

    public Command {
        metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(metadata);
    }

    public Optional<ECommandType> type() {
        return ECommandType.fromWire(commandType);
    }

    /**
     * Possible target serials: metadata keys first, then the command level target
     */
    public List<String> serialCandidates() {
        List<String> candidates = new ArrayList<>();
        for (String key : SERIAL_KEYS) {
            String value = metadataString(key);
            if (value != null && !candidates.contains(value)) {
                candidates.add(value);
            }
        }
        if (targetSerial != null && !targetSerial.isBlank() && !candidates.contains(targetSerial.trim())) {
            candidates.add(targetSerial.trim());
        }
        return candidates;
    }

    public String resolveTargetSerial() {
        List<String> candidates = serialCandidates();
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    public String resolveTargetIp() {
        String ip = metadataString("printerIpAddress");
        if (ip == null) {
            ip = metadataString("ipAddress");
        }
        return ip != null ? ip : (targetIp == null || targetIp.isBlank() ? null : targetIp.trim());
    }

    public String metadataString(String key) {
        String value = SnapshotNormalizer.coerceString(metadata.get(key));
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * First numeric metadata value among the keys, null when none present
     */
    public Double metadataDouble(String... keys) {
        for (String key : keys) {
            Double value = SnapshotNormalizer.coerceDouble(metadata.get(key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return String.format("Command{id='%s', type='%s', target=%s}", commandId, commandType,
                targetSerial != null ? targetSerial : targetIp);
    }
}
