package pmc.domain.start;

import pmc.common.EConnectionType;

/**
 * Options for starting a print
 * @param useAms request the automatic material system
 * @param plateIndex plate used for the default gcode path inside the project file
 * @param requiredTransport transport the caller insists on, null when any configured transport is fine
 */
public record StartOptions(boolean useAms, int plateIndex, EConnectionType requiredTransport) {

    public static StartOptions defaults() {
        return new StartOptions(true, 1, null);
    }

    public StartOptions withoutAms() {
        return new StartOptions(false, plateIndex, requiredTransport);
    }

    /**
     * Gcode path inside the 3mf used when no explicit param path is given
     */
    public String defaultParamPath() {
        return "Metadata/plate_" + Math.max(1, plateIndex) + ".gcode";
    }
}
