package pmc.domain.status;

import java.util.Objects;

/**
 * Canonical telemetry of one printer at one point in time
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 08/10/2026
 */
public record StatusSnapshot(
        String state,
        String gcodeState,
        Double progressPercent,
        Double nozzleTemp,
        Double bedTemp,
        Integer remainingTimeSeconds,
        String hmsErrorCode,
        String errorMessage,
        String currentJobId,
        String fileName,
        long timestamp) {

    public static final String IDLE = "idle";

    public static StatusSnapshot empty(long timestamp) {
        return new StatusSnapshot(null, null, null, null, null, null, null, null, null, null, timestamp);
    }

    /**
     * Same telemetry with state, gcode state and progress forced to idle / 0
     */
    public StatusSnapshot asIdle() {
        return new StatusSnapshot(IDLE, IDLE, 0.0, nozzleTemp, bedTemp, 0, hmsErrorCode, errorMessage,
                currentJobId, fileName, timestamp);
    }

    public StatusSnapshot withTimestamp(long newTimestamp) {
        return new StatusSnapshot(state, gcodeState, progressPercent, nozzleTemp, bedTemp, remainingTimeSeconds,
                hmsErrorCode, errorMessage, currentJobId, fileName, newTimestamp);
    }

    public boolean isAtFullProgress() {
        return progressPercent != null && progressPercent >= 100.0;
    }

    public boolean hasError() {
        return hmsErrorCode != null || errorMessage != null;
    }

    /**
     * Material difference on the tracked fields. Numbers differ when the delta exceeds epsilon.
     */
    public boolean differsFrom(StatusSnapshot other, double epsilon) {
        if (other == null) {
            return true;
        }
        return !Objects.equals(state, other.state)
                || !Objects.equals(gcodeState, other.gcodeState)
                || numberDiffers(progressPercent, other.progressPercent, epsilon)
                || numberDiffers(nozzleTemp, other.nozzleTemp, epsilon)
                || numberDiffers(bedTemp, other.bedTemp, epsilon)
                || numberDiffers(remainingTimeSeconds, other.remainingTimeSeconds, epsilon)
                || !Objects.equals(hmsErrorCode, other.hmsErrorCode)
                || !Objects.equals(errorMessage, other.errorMessage);
    }

    private static boolean numberDiffers(Number first, Number second, double epsilon) {
        if (first == null && second == null) {
            return false;
        }
        if (first == null || second == null) {
            return true;
        }
        return Math.abs(first.doubleValue() - second.doubleValue()) > epsilon;
    }
}
