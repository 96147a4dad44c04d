package pmc.domain.hms;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses HMS codes in either {@code HMS_0300-0300-0002-0003} or {@code 0300_0300_0002_0003} form
 * @author Martin Sustik <sustik@herman.cz>
 * @since 12/10/2026
 */
public final class HmsParser {

    private static final Pattern CODE = Pattern.compile(
            "^(?:HMS_)?([0-9A-F]{4})[-_]([0-9A-F]{4})[-_]([0-9A-F]{4})[-_]([0-9A-F]{4})$");

    private static final Map<String, String> MODULES = Map.of(
            "0300", "hotbed",
            "0500", "extruder",
            "0700", "motion",
            "0C00", "ams",
            "0D00", "filament",
            "1200", "chamber");

    private static final Map<String, String> DESCRIPTIONS = Map.ofEntries(
            Map.entry("0300_0300_0002_0003", "Hotbed heating abnormal; check the hotbed wiring and connector, then retry."),
            Map.entry("0500_0200_0001_0001", "Nozzle temperature abnormal; the temperature sensor may be damaged."),
            Map.entry("0500_0300_0002_0001", "Nozzle temperature control error; heating failed. Check the nozzle heater."),
            Map.entry("0700_0300_0001_0002", "Homing failed; mechanical components may be stuck. Check for obstructions."),
            Map.entry("0C00_0100_0001_0001", "AMS communication error; check the AMS connection."),
            Map.entry("0D00_0200_0001_0001", "Filament runout detected; load new filament."),
            Map.entry("0700_0200_0001_0001", "Motion system error; mechanical components may be stuck or damaged."),
            Map.entry("0500_0100_0001_0001", "Nozzle temperature sensor error; check the sensor connection."),
            Map.entry("0300_0200_0001_0001", "Hotbed temperature sensor error; check the sensor connection."),
            Map.entry("1200_0100_0001_0001", "Chamber temperature abnormal; check ventilation."),
            Map.entry("07FF_2000_0002_0004", "Possible AMS filament conflict; the selected slots do not match the print."));

    private HmsParser() {
    }

    public static HmsError parse(String hmsCode) {
        if (hmsCode == null || hmsCode.isBlank()) {
            return new HmsError(String.valueOf(hmsCode), "Invalid HMS error code", HmsSeverity.UNKNOWN, "unknown", new String[0]);
        }
        Matcher matcher = CODE.matcher(hmsCode.trim().toUpperCase(Locale.ROOT));
        if (!matcher.matches()) {
            return new HmsError(hmsCode, "Malformed HMS error: " + hmsCode, HmsSeverity.UNKNOWN, "unknown", new String[0]);
        }

        String[] groups = {matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4)};
        String canonical = String.join("_", groups);
        String module = MODULES.getOrDefault(groups[0], "unknown");
        String description = DESCRIPTIONS.getOrDefault(canonical, "HMS Error " + canonical + " (module: " + module + ")");
        return new HmsError(canonical, description, severityOf(groups[2]), module, groups);
    }

    static HmsSeverity severityOf(String errorType) {
        switch (errorType) {
            case "0002":
            case "0003":
            case "0004":
                return HmsSeverity.CRITICAL;
            case "0001":
                return HmsSeverity.ERROR;
            default:
                return HmsSeverity.WARNING;
        }
    }
}
