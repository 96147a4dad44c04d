package pmc.domain.status;

import com.google.gson.Gson;
import pmc.common.PrinterConstants;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns heterogeneous raw printer payloads into a {@link StatusSnapshot}.
 *
 * <p>Vendors spell the same field in different ways and nest it at different depths, so every field
 * is resolved from a list of key spellings searched through nested maps and lists. Keys are compared
 * lower-cased with '-' and ' ' turned into '_'; a trailing '*' is a prefix match.</p>
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 08/10/2026
 */
public class SnapshotNormalizer {

    static final List<String> GCODE_KEYS = List.of("gcode_state", "gcodeState");
    static final List<String> STATE_KEYS = List.of("state", "print_state", "stage");
    static final List<String> PROGRESS_KEYS = List.of("mc_percent", "progress", "percentage", "progressPercent",
            "last_print_percentage", "print_percent", "print_percentage", "percent");
    static final List<String> REMAINING_KEYS = List.of("mc_remaining_time", "remaining_time", "remainingTimeSeconds");
    static final List<String> NOZZLE_KEYS = List.of("nozzle_temper", "nozzle_temp", "nozzleTemp", "nozzle_temperature",
            "nozzle_current_temper", "nozzle_target_temper", "nozzle", "nozzle_temp*");
    static final List<String> BED_KEYS = List.of("bed_temper", "bed_temp", "bedTemp", "bed_temperature",
            "bed_current_temper", "bed_target_temper", "bed", "bed_temp*");
    static final List<String> JOB_KEYS = List.of("job_id", "task_id", "current_job_id", "print_id", "jobId");
    static final List<String> FILE_KEYS = List.of("subtask_name", "gcode_file", "file_name", "fileName", "filename");
    static final List<String> HMS_KEYS = List.of("hms", "hms_code", "error_code", "print_error_code");
    static final List<String> ERROR_KEYS = List.of("error_message", "err_msg", "error", "message", "tips", "desc", "description");

    private static final List<String> NUMERIC_PREFERRED_KEYS = List.of("current", "value", "actual", "temperature", "temper", "target");
    private static final Pattern HMS_TOKEN = Pattern.compile("HMS_[0-9A-Fa-f]{4}[-_][0-9A-Fa-f]{4}[-_][0-9A-Fa-f]{4}[-_][0-9A-Fa-f]{4}");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final Gson gson = new Gson();

    /**
     * Build a snapshot from the accessor results of one poll. Any argument may be null.
     */
    public StatusSnapshot normalize(Object rawStatus, Object stateValue, Object percentageValue, Object gcodeValue, long timestamp) {
        List<Object> sources = new ArrayList<>();
        for (Object source : new Object[]{rawStatus, stateValue, percentageValue, gcodeValue}) {
            if (source != null) {
                sources.add(source);
            }
        }

        String gcodeState = coerceString(gcodeValue);
        if (gcodeState == null) {
            gcodeState = coerceString(findValue(sources, GCODE_KEYS));
        }

        String state = coerceString(stateValue);
        if (state == null) {
            state = coerceString(findValue(sources, STATE_KEYS));
        }
        if (state == null) {
            state = gcodeState;
        }

        Double progress = coerceDouble(findValue(sources, PROGRESS_KEYS));
        if (progress == null) {
            progress = coerceDouble(percentageValue);
        }

        Double remaining = coerceDouble(findValue(sources, REMAINING_KEYS));
        Double nozzle = coerceDouble(findValue(sources, NOZZLE_KEYS));
        Double bed = coerceDouble(findValue(sources, BED_KEYS));
        String jobId = coerceString(findValue(sources, JOB_KEYS));
        String fileName = coerceString(findValue(sources, FILE_KEYS));

        String hmsCode = extractHmsCode(sources);
        String errorMessage = coerceString(findValue(sources, ERROR_KEYS));
        if (hmsCode == null && looksLikeAmsConflict(rawStatus != null ? rawStatus : stateValue)) {
            hmsCode = PrinterConstants.AMS_CONFLICT_HMS_CODE;
            if (errorMessage == null) {
                errorMessage = PrinterConstants.AMS_CONFLICT_MESSAGE;
            }
        }

        return new StatusSnapshot(state, gcodeState, progress, nozzle, bed,
                remaining == null ? null : (int) Math.round(remaining),
                hmsCode, errorMessage, jobId, fileName, timestamp);
    }

    /**
     * Text content of the payload suggests an AMS / filament slot conflict
     */
    public boolean looksLikeAmsConflict(Object payload) {
        if (payload == null) {
            return false;
        }
        String text = stringify(payload).toLowerCase(Locale.ROOT);
        boolean amsMismatch = text.contains("ams") && (text.contains("conflict") || text.contains("mismatch"));
        return amsMismatch || text.contains("filament conflict");
    }

    private String extractHmsCode(List<Object> sources) {
        String candidate = coerceString(findValue(sources, HMS_KEYS));
        if (candidate != null && candidate.toUpperCase(Locale.ROOT).startsWith("HMS_")) {
            return candidate;
        }
        for (Object source : sources) {
            Matcher matcher = HMS_TOKEN.matcher(stringify(source));
            if (matcher.find()) {
                return matcher.group().toUpperCase(Locale.ROOT);
            }
        }
        return null;
    }

    private String stringify(Object payload) {
        if (payload instanceof String) {
            return (String) payload;
        }
        try {
            return gson.toJson(payload);
        } catch (RuntimeException e) {
            return String.valueOf(payload);
        }
    }

    /**
     * Depth-first search of the sources for the first key matching any of the spellings
     */
    public static Object findValue(List<Object> sources, List<String> keyNames) {
        List<String> exact = new ArrayList<>();
        List<String> prefixes = new ArrayList<>();
        for (String name : keyNames) {
            String normalized = normalizeKey(name);
            if (normalized.endsWith("*")) {
                prefixes.add(normalized.substring(0, normalized.length() - 1));
            } else {
                exact.add(normalized);
            }
        }
        for (Object source : sources) {
            Object result = search(source, exact, prefixes, 0);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private static Object search(Object value, List<String> exact, List<String> prefixes, int depth) {
        if (depth > 16) {
            return null;
        }
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                String key = normalizeKey(String.valueOf(entry.getKey()));
                if (entry.getValue() != null && matches(key, exact, prefixes)) {
                    return entry.getValue();
                }
                Object nested = search(entry.getValue(), exact, prefixes, depth + 1);
                if (nested != null) {
                    return nested;
                }
            }
        } else if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                Object nested = search(item, exact, prefixes, depth + 1);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    private static boolean matches(String key, List<String> exact, List<String> prefixes) {
        if (exact.contains(key)) {
            return true;
        }
        for (String prefix : prefixes) {
            if (key.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    static String normalizeKey(String key) {
        return key.trim().replace('-', '_').replace(' ', '_').toLowerCase(Locale.ROOT);
    }

    /**
     * Numbers, numeric strings with units ("215 °C", "45%", "3000rpm") and nested maps such as
     * {"current": 210, "target": 215}. Booleans are not numbers.
     */
    public static Double coerceDouble(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        if (value instanceof Number) {
            double result = ((Number) value).doubleValue();
            return Double.isNaN(result) ? null : result;
        }
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            for (String key : NUMERIC_PREFERRED_KEYS) {
                if (map.containsKey(key)) {
                    Double nested = coerceDouble(map.get(key));
                    if (nested != null) {
                        return nested;
                    }
                }
            }
            for (Object nestedValue : map.values()) {
                Double nested = coerceDouble(nestedValue);
                if (nested != null) {
                    return nested;
                }
            }
            return null;
        }
        if (value instanceof String) {
            String cleaned = ((String) value).trim().toLowerCase(Locale.ROOT)
                    .replace("°c", "")
                    .replace("%", "")
                    .replace("rpm", "")
                    .trim();
            if (cleaned.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(cleaned);
            } catch (NumberFormatException e) {
                Matcher matcher = NUMBER.matcher(cleaned);
                return matcher.find() ? Double.parseDouble(matcher.group()) : null;
            }
        }
        return null;
    }

    /**
     * Scalar to trimmed text, null for blanks and containers
     */
    public static String coerceString(Object value) {
        if (value == null || value instanceof Map || value instanceof Collection) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }
}
