package pmc.domain.status;

/**
 * Snapshot emitted by a status subscriber
 * @author Martin Sustik <sustik@herman.cz>
 * @since 08/10/2026
 */
public class StatusSnapshotEvent {

    public enum EType {
        CHANGE,
        HEARTBEAT
    }

    private final String printerSerial;
    private final StatusSnapshot snapshot;
    private final EType type;
    private final boolean stallOverride;

    public StatusSnapshotEvent(String printerSerial, StatusSnapshot snapshot, EType type, boolean stallOverride) {
        this.printerSerial = printerSerial;
        this.snapshot = snapshot;
        this.type = type;
        this.stallOverride = stallOverride;
    }

    public String getPrinterSerial() {
        return printerSerial;
    }

    public StatusSnapshot getSnapshot() {
        return snapshot;
    }

    public EType getType() {
        return type;
    }

    /**
     * True when the snapshot was forced to idle by the stall safeguard
     */
    public boolean isStallOverride() {
        return stallOverride;
    }

    public long getTimestamp() {
        return snapshot.timestamp();
    }

    @Override
    public String toString() {
        return String.format("StatusSnapshotEvent{serial='%s', type=%s, state='%s', gcode='%s', progress=%s}",
                printerSerial, type, snapshot.state(), snapshot.gcodeState(), snapshot.progressPercent());
    }
}
