package pmc.domain.hms;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed HMS error code, canonical form {@code XXXX_YYYY_ZZZZ_WWWW}
 * @param hmsCode canonical code, or the raw input when it could not be parsed
 * @param description human readable description
 * @param severity derived from the error type group
 * @param module printer subsystem derived from the module group
 * @param groups the four code groups, empty when the code is malformed
 */
public record HmsError(String hmsCode, String description, HmsSeverity severity, String module, String[] groups) {

    public boolean isWellFormed() {
        return groups.length == 4;
    }

    /**
     * Error data as reported to the cloud event endpoint
     */
    public Map<String, Object> toEventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("hmsCode", hmsCode);
        data.put("description", description);
        data.put("severity", severity.wireValue());
        data.put("module", module);
        if (isWellFormed()) {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("module_code", groups[0]);
            raw.put("error_category", groups[1]);
            raw.put("error_type", groups[2]);
            raw.put("error_detail", groups[3]);
            data.put("raw", raw);
        }
        return data;
    }
}
